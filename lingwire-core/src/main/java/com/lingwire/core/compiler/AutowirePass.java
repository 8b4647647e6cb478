package com.lingwire.core.compiler;

import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.exception.AutowireException;
import com.lingwire.core.reflect.ConstructorIntrospector;
import com.lingwire.core.reflect.ParameterMetadata;
import com.lingwire.core.spi.CompilerPass;
import com.lingwire.core.spi.TypeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 自动装配 Pass
 * <p>
 * 对标记为 autowired 的定义，按构造器参数的声明类型补齐未显式提供的参数：
 * <ol>
 *   <li>标量类型（基本类型、字符串等）只能使用 {@code @DefaultValue}，否则失败</li>
 *   <li>唯一候选：绑定为 {@link Reference}</li>
 *   <li>多个候选：歧义失败，不猜测</li>
 *   <li>没有候选：默认值 → 可空时为 null → 失败</li>
 * </ol>
 * 已显式提供的位置不会被覆盖。使用工厂或类不可加载的定义会被跳过。
 */
@Slf4j
public class AutowirePass implements CompilerPass {

    private final Function<ContainerBuilder, TypeRegistry> registryFactory;

    public AutowirePass() {
        this(DefinitionTypeRegistry::new);
    }

    public AutowirePass(Function<ContainerBuilder, TypeRegistry> registryFactory) {
        this.registryFactory = registryFactory;
    }

    @Override
    public void process(ContainerBuilder builder) {
        TypeRegistry registry = registryFactory.apply(builder);
        int autowired = 0;

        for (Map.Entry<String, Definition> entry : builder.getDefinitions().entrySet()) {
            String id = entry.getKey();
            Definition definition = entry.getValue();
            if (!definition.isAutowired() || definition.isAbstract() || definition.isSynthetic()) {
                continue;
            }
            if (definition.getFactory() != null) {
                log.debug("Skipping autowiring of '{}': it is built by a factory", id);
                continue;
            }
            Optional<Class<?>> type = builder.getClassResolver().find(definition.getClassName());
            if (type.isEmpty()) {
                log.debug("Skipping autowiring of '{}': class '{}' is not loadable", id, definition.getClassName());
                continue;
            }

            autowire(id, definition, type.get(), registry);
            autowired++;
        }

        log.debug("Autowired {} services", autowired);
    }

    private void autowire(String id, Definition definition, Class<?> type, TypeRegistry registry) {
        List<Constructor<?>> constructors = ConstructorIntrospector.greediestConstructors(type);
        if (constructors.isEmpty()) {
            log.debug("Skipping autowiring of '{}': {} has no public constructor", id, type.getName());
            return;
        }
        if (constructors.size() > 1) {
            throw new AutowireException(id, "Cannot autowire service '" + id + "': " + type.getName()
                    + " has " + constructors.size() + " public constructors with "
                    + constructors.get(0).getParameterCount() + " parameters");
        }

        for (ParameterMetadata parameter : ConstructorIntrospector.describe(constructors.get(0))) {
            if (definition.hasArgument(parameter.index())) {
                continue;
            }
            definition.setArgument(parameter.index(), resolveParameter(id, parameter, registry));
        }
    }

    private Object resolveParameter(String id, ParameterMetadata parameter, TypeRegistry registry) {
        if (parameter.isScalar()) {
            if (parameter.hasDefault()) {
                return parameter.defaultValue();
            }
            throw new AutowireException(id, parameter.name(), "Cannot autowire service '" + id + "': parameter '"
                    + parameter.name() + "' has no type and no default value");
        }

        Class<?> type = parameter.type();
        List<String> candidates = new ArrayList<>(registry.resolveCandidatesFor(type));
        candidates.remove(id);

        if (candidates.size() == 1) {
            log.debug("Autowired {}.{} -> {}", id, parameter.name(), candidates.get(0));
            return new Reference(candidates.get(0));
        }
        if (candidates.size() > 1) {
            throw new AutowireException(id, parameter.name(), "Ambiguous autowiring for type " + type.getName()
                    + " (service '" + id + "', parameter '" + parameter.name() + "'): candidates " + candidates);
        }
        if (parameter.hasDefault()) {
            return parameter.defaultValue();
        }
        if (parameter.nullable()) {
            return null;
        }
        throw new AutowireException(id, parameter.name(), "Cannot autowire service '" + id + "': parameter '"
                + parameter.name() + "' requires " + type.getName() + " but no service implements type "
                + type.getName());
    }
}
