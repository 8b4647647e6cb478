package com.lingwire.core.container;

import com.lingwire.api.container.ServiceContainer;
import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.api.exception.ServiceNotFoundException;
import com.lingwire.core.compiler.AutowirePass;
import com.lingwire.core.compiler.PassConfig;
import com.lingwire.core.compiler.PassStage;
import com.lingwire.core.compiler.ResolveChildDefinitionsPass;
import com.lingwire.core.compiler.ResolveReferencesPass;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.exception.FrozenContainerException;
import com.lingwire.core.parameter.ParameterStore;
import com.lingwire.core.reflect.ClassResolver;
import com.lingwire.core.spi.CompilerPass;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 容器构建器
 * <p>
 * 构建阶段（单线程、一次性）注册定义、别名、参数和编译器 Pass，
 * {@link #compile()} 按阶段执行 Pass 后冻结，产出不可变的 {@link Container}。
 * 编译失败时构建器保持可修改状态，不会产生半成品容器。
 */
@Slf4j
public class ContainerBuilder implements ServiceContainer {

    private final Map<String, Definition> definitions = new LinkedHashMap<>();

    private final Map<String, String> aliases = new LinkedHashMap<>();

    private final ParameterStore parameters = new ParameterStore();

    private final PassConfig passConfig = new PassConfig();

    // 编译前通过 set() 注入的合成服务实例
    private final Map<String, Object> syntheticInstances = new LinkedHashMap<>();

    private final ContainerConfig config;

    private final ClassResolver classResolver;

    private volatile Container compiled;

    // 编译前 get() 使用的引导容器，基于实时定义
    private Container bootstrap;

    public ContainerBuilder() {
        this(ContainerConfig.defaults());
    }

    public ContainerBuilder(ContainerConfig config) {
        this.config = config != null ? config : ContainerConfig.defaults();
        this.classResolver = new ClassResolver(this.config.getClassLoader());

        definitions.put(SERVICE_CONTAINER_ID, new Definition(ServiceContainer.class).setSynthetic(true));

        if (this.config.isRegisterDefaultPasses()) {
            passConfig.addPass(new ResolveChildDefinitionsPass(), PassStage.BEFORE_OPTIMIZATION, 100);
            passConfig.addPass(new AutowirePass(), PassStage.BEFORE_OPTIMIZATION, 0);
            passConfig.addPass(new ResolveReferencesPass(), PassStage.BEFORE_REMOVING, 0);
        }
    }

    // ==================== 定义 ====================

    /**
     * 注册服务定义，未指定类时以 id 作为类名
     */
    public Definition register(String id) {
        return register(id, (String) null);
    }

    public Definition register(String id, Class<?> type) {
        return register(id, type != null ? type.getName() : null);
    }

    public Definition register(String id, String className) {
        Definition definition = new Definition(className != null ? className : id);
        setDefinition(id, definition);
        return definition;
    }

    /**
     * 设置服务定义，同 id 的旧定义或别名会被替换
     */
    public ContainerBuilder setDefinition(String id, Definition definition) {
        ensureNotFrozen();
        requireId(id);
        if (definition == null) {
            throw new InvalidArgumentException("definition", "Definition of '" + id + "' cannot be null");
        }
        if (aliases.remove(id) != null) {
            log.warn("Definition '{}' replaces an alias with the same id", id);
        }
        if (definitions.put(id, definition) != null) {
            log.debug("Definition replaced: {}", id);
        }
        bootstrap = null;
        return this;
    }

    public Definition getDefinition(String id) {
        Definition definition = definitions.get(id);
        if (definition == null) {
            throw new ServiceNotFoundException(id);
        }
        return definition;
    }

    public boolean hasDefinition(String id) {
        return definitions.containsKey(id);
    }

    public ContainerBuilder removeDefinition(String id) {
        ensureNotFrozen();
        definitions.remove(id);
        syntheticInstances.remove(id);
        bootstrap = null;
        return this;
    }

    public Map<String, Definition> getDefinitions() {
        return Collections.unmodifiableMap(definitions);
    }

    /**
     * 注册合成服务并预置实例
     * 编译后实例会被放入容器缓存
     */
    public ContainerBuilder set(String id, Object instance) {
        ensureNotFrozen();
        if (instance == null) {
            throw new InvalidArgumentException("instance", "Instance of '" + id + "' cannot be null");
        }
        setDefinition(id, new Definition(instance.getClass()).setSynthetic(true));
        syntheticInstances.put(id, instance);
        return this;
    }

    // ==================== 别名 ====================

    public ContainerBuilder setAlias(String alias, String id) {
        ensureNotFrozen();
        requireId(alias);
        requireId(id);
        if (alias.equals(id)) {
            throw new InvalidArgumentException("alias", alias, "An alias cannot reference itself: " + alias);
        }
        if (definitions.remove(alias) != null) {
            log.warn("Alias '{}' replaces a definition with the same id", alias);
            syntheticInstances.remove(alias);
        }
        aliases.put(alias, id);
        bootstrap = null;
        return this;
    }

    public String getAlias(String alias) {
        String id = aliases.get(alias);
        if (id == null) {
            throw new ServiceNotFoundException(alias);
        }
        return id;
    }

    public boolean hasAlias(String alias) {
        return aliases.containsKey(alias);
    }

    public ContainerBuilder removeAlias(String alias) {
        ensureNotFrozen();
        aliases.remove(alias);
        bootstrap = null;
        return this;
    }

    public Map<String, String> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    // ==================== 参数 ====================

    public ContainerBuilder setParameter(String name, Object value) {
        ensureNotFrozen();
        parameters.set(name, value);
        return this;
    }

    @Override
    public Object getParameter(String name) {
        return compiled != null ? compiled.getParameter(name) : parameters.get(name);
    }

    @Override
    public boolean hasParameter(String name) {
        return parameters.has(name);
    }

    public Set<String> getParameterNames() {
        return parameters.getNames();
    }

    public ParameterStore getParameters() {
        return parameters;
    }

    // ==================== 标签 ====================

    /**
     * 查找带有指定标签的服务
     *
     * @param tag 标签名
     * @return 服务 ID -> 属性表列表（按注册顺序），没有匹配时返回空 Map
     */
    public Map<String, List<Map<String, Object>>> findTaggedServiceIds(String tag) {
        Map<String, List<Map<String, Object>>> result = new LinkedHashMap<>();
        definitions.forEach((id, definition) -> {
            if (definition.hasTag(tag)) {
                result.put(id, definition.getTag(tag));
            }
        });
        return result;
    }

    // ==================== 编译 ====================

    public ContainerBuilder addCompilerPass(CompilerPass pass) {
        return addCompilerPass(pass, PassStage.BEFORE_OPTIMIZATION, 0);
    }

    public ContainerBuilder addCompilerPass(CompilerPass pass, PassStage stage) {
        return addCompilerPass(pass, stage, 0);
    }

    public ContainerBuilder addCompilerPass(CompilerPass pass, PassStage stage, int priority) {
        ensureNotFrozen();
        passConfig.addPass(pass, stage, priority);
        return this;
    }

    public PassConfig getPassConfig() {
        return passConfig;
    }

    /**
     * 编译容器
     * <p>
     * 按阶段执行全部 Pass，解析参数，冻结结构并产出运行时容器。
     * 任何一步失败都会中止编译，构建器保持未冻结。
     *
     * @return 编译后的容器
     * @throws FrozenContainerException 重复编译
     */
    public Container compile() {
        if (compiled != null) {
            throw new FrozenContainerException("Container is already compiled");
        }

        long start = System.currentTimeMillis();
        log.info("Compiling container: {} definitions, {} aliases, {} passes",
                definitions.size(), aliases.size(), passConfig.size());

        for (PassConfig.Entry entry : passConfig.getOrderedEntries()) {
            log.debug("Running compiler pass {} [{}, priority={}]",
                    entry.pass().getClass().getSimpleName(), entry.stage(), entry.priority());
            entry.pass().process(this);
        }

        ParameterStore resolvedParameters = parameters.resolveAll();

        Map<String, Definition> frozenDefinitions = new LinkedHashMap<>();
        definitions.forEach((id, definition) -> frozenDefinitions.put(id, definition.copy()));

        Container container = new Container(
                Collections.unmodifiableMap(frozenDefinitions),
                Collections.unmodifiableMap(new LinkedHashMap<>(aliases)),
                resolvedParameters,
                config,
                classResolver,
                null,
                config.isExposePrivateServices());
        syntheticInstances.forEach(container::setSynthetic);

        if (config.isEagerInit()) {
            container.initializeEagerServices();
        }

        this.compiled = container;
        this.bootstrap = null;
        log.info("Container compiled in {} ms", System.currentTimeMillis() - start);
        return container;
    }

    public boolean isCompiled() {
        return compiled != null;
    }

    /**
     * 获取编译后的容器
     *
     * @throws IllegalStateException 尚未编译
     */
    public Container getCompiledContainer() {
        if (compiled == null) {
            throw new IllegalStateException("Container is not compiled yet");
        }
        return compiled;
    }

    public ContainerConfig getConfig() {
        return config;
    }

    public ClassResolver getClassResolver() {
        return classResolver;
    }

    // ==================== 引导期访问 ====================

    /**
     * 获取服务
     * 编译后委托给编译后的容器；编译前基于当前定义即时构造（仅用于引导）
     */
    @Override
    public Object get(String id) {
        if (compiled != null) {
            return compiled.get(id);
        }
        return bootstrap().get(id);
    }

    @Override
    public boolean has(String id) {
        return definitions.containsKey(id) || aliases.containsKey(id);
    }

    private Container bootstrap() {
        if (bootstrap == null) {
            Container container = new Container(definitions, aliases, parameters, config, classResolver, this, true);
            syntheticInstances.forEach(container::setSynthetic);
            bootstrap = container;
        }
        return bootstrap;
    }

    // ==================== 内部 ====================

    private void ensureNotFrozen() {
        if (compiled != null) {
            throw new FrozenContainerException();
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidArgumentException("id", "Service id cannot be blank");
        }
    }
}
