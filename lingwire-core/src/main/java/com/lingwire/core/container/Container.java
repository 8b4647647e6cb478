package com.lingwire.core.container;

import com.lingwire.api.container.ServiceContainer;
import com.lingwire.api.exception.ContainerException;
import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.api.exception.ServiceNotFoundException;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.Factory;
import com.lingwire.core.definition.MethodCall;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.exception.AbstractServiceException;
import com.lingwire.core.exception.CircularDependencyException;
import com.lingwire.core.exception.FrozenContainerException;
import com.lingwire.core.exception.ServiceCreationException;
import com.lingwire.core.parameter.ParameterStore;
import com.lingwire.core.reflect.ClassResolver;
import com.lingwire.core.reflect.ExecutableMatcher;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 编译后的运行时容器
 * <p>
 * 结构（定义、别名、参数）不可变，可无锁并发读取；唯一可变的是实例缓存。
 * <p>
 * 共享服务的首次构造在容器级可重入锁内完成（single-flight），并发调用方阻塞到实例入缓存后直接返回；
 * 循环依赖检查基于当前线程的构造栈，在加锁之前执行，真正的环会立刻失败而不是死锁。
 * <p>
 * 共享实例在执行方法调用<b>之前</b>进入早期缓存：A 的构造器完成后，
 * A 的 setter 所需的 B 在构造时可以拿到尚未执行 setter 的 A。
 * 因此经由 setter 的环可以成立，纯构造器环则报 {@link CircularDependencyException}。
 * 早期实例只对持有创建锁的线程可见，其他线程只能看到完整初始化的实例。
 * <p>
 * 创建锁是容器级的：不相关的共享服务的首次构造也会串行执行。
 * 构造器、工厂和 setter 中不能等待<b>另一个线程</b>对本容器的 {@code get()}，
 * 否则会一直阻塞；在当前线程内嵌套 {@code get()} 不受影响（锁可重入）。
 * 已缓存实例的读取不加锁。
 */
@Slf4j
public class Container implements ServiceContainer {

    // IGNORE 策略下缺失的引用
    private static final Object OMITTED = new Object();

    private final Map<String, Definition> definitions;
    private final Map<String, String> aliases;
    private final ParameterStore parameters;
    private final ContainerConfig config;
    private final ClassResolver classResolver;
    private final boolean exposePrivateServices;

    // 完整初始化的共享实例 + 合成服务
    private final ConcurrentHashMap<String, Object> instances = new ConcurrentHashMap<>();

    // 已构造但方法调用尚未完成的共享实例，受 creationLock 保护
    private final Map<String, Object> earlyInstances = new HashMap<>();

    private final ReentrantLock creationLock = new ReentrantLock();

    // 当前线程的构造栈（有序）
    private final ThreadLocal<LinkedHashSet<String>> constructionStack = ThreadLocal.withInitial(LinkedHashSet::new);

    Container(Map<String, Definition> definitions,
              Map<String, String> aliases,
              ParameterStore parameters,
              ContainerConfig config,
              ClassResolver classResolver,
              ServiceContainer self,
              boolean exposePrivateServices) {
        this.definitions = definitions;
        this.aliases = aliases;
        this.parameters = parameters;
        this.config = config;
        this.classResolver = classResolver;
        this.exposePrivateServices = exposePrivateServices;

        Definition selfDefinition = definitions.get(SERVICE_CONTAINER_ID);
        if (selfDefinition != null && selfDefinition.isSynthetic()) {
            instances.put(SERVICE_CONTAINER_ID, self != null ? self : this);
        }
    }

    // ==================== 查询 ====================

    @Override
    public Object get(String id) {
        String resolvedId = resolveAlias(id);
        if (!exposePrivateServices && resolvedId.equals(id)) {
            Definition definition = definitions.get(resolvedId);
            if (definition != null && !definition.isPublic()) {
                throw new ServiceNotFoundException(id,
                        "Service '" + id + "' is private; inject it as a dependency or expose it through an alias");
            }
        }
        return getService(resolvedId, id);
    }

    @Override
    public boolean has(String id) {
        return definitions.containsKey(id) || aliases.containsKey(id);
    }

    @Override
    public Object getParameter(String name) {
        return parameters.get(name);
    }

    @Override
    public boolean hasParameter(String name) {
        return parameters.has(name);
    }

    public Set<String> getParameterNames() {
        return parameters.getNames();
    }

    /**
     * 所有服务 ID 与别名
     */
    public Set<String> getServiceIds() {
        Set<String> ids = new LinkedHashSet<>(definitions.keySet());
        ids.addAll(aliases.keySet());
        return Collections.unmodifiableSet(ids);
    }

    /**
     * 共享服务是否已实例化
     */
    public boolean initialized(String id) {
        if (!has(id)) {
            return false;
        }
        return instances.containsKey(resolveAlias(id));
    }

    // ==================== 合成服务 ====================

    /**
     * 填充合成服务的实例
     * 每个合成服务只能设置一次
     */
    public void setSynthetic(String id, Object instance) {
        Definition definition = definitions.get(id);
        if (definition == null || !definition.isSynthetic()) {
            throw new InvalidArgumentException("id", id, "Service '" + id + "' is not a synthetic service");
        }
        if (instance == null) {
            throw new InvalidArgumentException("instance", "Synthetic instance for '" + id + "' cannot be null");
        }
        if (instances.putIfAbsent(id, instance) != null) {
            throw new FrozenContainerException("Synthetic service '" + id + "' is already set");
        }
        log.debug("Synthetic service set: {}", id);
    }

    /**
     * 实例化全部公共、共享、非延迟的服务
     */
    void initializeEagerServices() {
        int count = 0;
        for (Map.Entry<String, Definition> entry : definitions.entrySet()) {
            Definition definition = entry.getValue();
            if (definition.isPublic() && definition.isShared() && !definition.isLazy()
                    && !definition.isAbstract() && !definition.isSynthetic()) {
                getService(entry.getKey(), entry.getKey());
                count++;
            }
        }
        log.info("Eagerly initialized {} services", count);
    }

    // ==================== 别名 ====================

    String resolveAlias(String id) {
        if (id == null) {
            throw new InvalidArgumentException("id", "Service id cannot be null");
        }
        String current = id;
        LinkedHashSet<String> visited = new LinkedHashSet<>();
        visited.add(current);
        int hops = 0;
        while (aliases.containsKey(current)) {
            if (++hops > config.getMaxAliasDepth()) {
                throw new ServiceNotFoundException(id,
                        "Alias chain of '" + id + "' exceeds " + config.getMaxAliasDepth() + " hops");
            }
            current = aliases.get(current);
            if (!visited.add(current)) {
                List<String> path = new ArrayList<>(visited);
                path.add(current);
                throw CircularDependencyException.forAliases(path);
            }
        }
        return current;
    }

    // ==================== 构造 ====================

    private Object getService(String id, String requestedId) {
        Object instance = instances.get(id);
        if (instance != null) {
            return instance;
        }

        Definition definition = definitions.get(id);
        if (definition == null) {
            throw new ServiceNotFoundException(requestedId);
        }
        if (definition.isAbstract()) {
            throw new AbstractServiceException(requestedId);
        }
        if (definition.isSynthetic()) {
            throw new ServiceNotFoundException(requestedId,
                    "Service '" + requestedId + "' is synthetic and must be set at runtime");
        }

        // 持锁线程可以拿到自己正在执行方法调用的早期实例
        if (creationLock.isHeldByCurrentThread()) {
            Object early = earlyInstances.get(id);
            if (early != null) {
                return early;
            }
        }

        // 先查环，再加锁
        LinkedHashSet<String> stack = constructionStack.get();
        if (stack.contains(id)) {
            List<String> chain = new ArrayList<>(stack);
            List<String> cycle = new ArrayList<>(chain.subList(chain.indexOf(id), chain.size()));
            cycle.add(id);
            throw new CircularDependencyException(cycle);
        }

        if (!definition.isShared()) {
            return create(id, definition, stack);
        }

        creationLock.lock();
        try {
            Object existing = instances.get(id);
            if (existing != null) {
                return existing;
            }
            return create(id, definition, stack);
        } finally {
            creationLock.unlock();
        }
    }

    private Object create(String id, Definition definition, LinkedHashSet<String> stack) {
        stack.add(id);
        boolean cachedEarly = false;
        try {
            log.debug("Creating service '{}' ({})", id, definition.getClassName());
            Object instance = instantiate(id, definition);

            if (definition.isShared()) {
                earlyInstances.put(id, instance);
                cachedEarly = true;
            }

            for (MethodCall call : definition.getMethodCalls()) {
                invokeMethodCall(id, instance, call);
            }

            if (definition.isShared()) {
                instances.put(id, instance);
            }
            return instance;
        } finally {
            if (cachedEarly) {
                earlyInstances.remove(id);
            }
            stack.remove(id);
            if (stack.isEmpty()) {
                constructionStack.remove();
            }
        }
    }

    private Object instantiate(String id, Definition definition) {
        List<Object> args = positional(resolvePositional(id, definition.getArguments()));

        Factory factory = definition.getFactory();
        Object instance;
        if (factory != null) {
            instance = callFactory(id, factory, args);
        } else {
            Class<?> type = requireClass(id, definition.getClassName());
            Constructor<?> constructor = single(id, ExecutableMatcher.matchConstructors(type, args),
                    "public constructor of " + type.getName(), args);
            instance = invoke(id, constructor, null, args);
        }

        if (instance == null) {
            throw new ServiceCreationException(id, "Factory of service '" + id + "' returned null");
        }
        return instance;
    }

    private Object callFactory(String id, Factory factory, List<Object> args) {
        if (factory.isCallable()) {
            try {
                return factory.getCallable().create(args);
            } catch (ContainerException e) {
                throw e;
            } catch (Exception e) {
                throw new ServiceCreationException(id, "Factory of service '" + id + "' failed: " + e.getMessage(), e);
            }
        }

        Object target;
        if (factory.isServiceMethod()) {
            target = resolveReference(id, factory.getService());
            if (target == null || target == OMITTED) {
                throw new ServiceCreationException(id,
                        "Factory service '" + factory.getService().getId() + "' of service '" + id + "' is not available");
            }
        } else if (has(factory.getClassName())) {
            // 类名同时是服务 ID：调用该服务
            target = getService(resolveAlias(factory.getClassName()), factory.getClassName());
        } else {
            Class<?> type = requireClass(id, factory.getClassName());
            Method method = single(id, ExecutableMatcher.matchMethods(type, factory.getMethod(), args, true),
                    "public static method " + type.getName() + "." + factory.getMethod(), args);
            return invoke(id, method, null, args);
        }

        Method method = single(id, ExecutableMatcher.matchMethods(target.getClass(), factory.getMethod(), args, false),
                "public method " + target.getClass().getName() + "." + factory.getMethod(), args);
        return invoke(id, method, target, args);
    }

    private void invokeMethodCall(String id, Object instance, MethodCall call) {
        List<Object> args = resolvePositional(id, call.arguments());
        if (args.contains(OMITTED)) {
            log.debug("Skipping {}.{}(): ignored reference is missing", id, call.method());
            return;
        }
        Method method = single(id, ExecutableMatcher.matchMethods(instance.getClass(), call.method(), args, false),
                "public method " + instance.getClass().getName() + "." + call.method(), args);
        invoke(id, method, instance, args);
    }

    /**
     * 匹配结果必须唯一，否则按"不匹配"或"歧义"失败
     */
    private static <T extends Executable> T single(String id, List<T> matches, String what, List<Object> args) {
        if (matches.isEmpty()) {
            throw new ServiceCreationException(id, "No " + what + " matches arguments "
                    + ExecutableMatcher.describe(args) + " for service '" + id + "'");
        }
        if (matches.size() > 1) {
            throw new ServiceCreationException(id, "Ambiguous " + what + " for arguments "
                    + ExecutableMatcher.describe(args) + " of service '" + id + "': candidates " + matches);
        }
        return matches.get(0);
    }

    private Object invoke(String id, Executable executable, Object target, List<Object> args) {
        Object[] values = ExecutableMatcher.coerce(executable, args);
        executable.trySetAccessible();
        try {
            if (executable instanceof Constructor<?> constructor) {
                return constructor.newInstance(values);
            }
            return ((Method) executable).invoke(target, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof ContainerException containerException) {
                throw containerException;
            }
            throw new ServiceCreationException(id,
                    "Failed to create service '" + id + "': " + executable.getName() + " threw " + cause, cause);
        } catch (ReflectiveOperationException e) {
            throw new ServiceCreationException(id,
                    "Failed to create service '" + id + "': cannot invoke " + executable.getName(), e);
        }
    }

    private Class<?> requireClass(String id, String className) {
        if (className == null) {
            throw new ServiceCreationException(id, "Service '" + id + "' has neither a class nor a factory");
        }
        return classResolver.find(className)
                .orElseThrow(() -> new ServiceCreationException(id,
                        "Class '" + className + "' of service '" + id + "' cannot be loaded"));
    }

    // ==================== 参数解析 ====================

    // 顶层位置参数，保留 OMITTED 标记
    private List<Object> resolvePositional(String owner, List<Object> arguments) {
        List<Object> result = new ArrayList<>(arguments.size());
        for (Object argument : arguments) {
            result.add(resolveArgument(owner, argument));
        }
        return result;
    }

    // 构造器 / 工厂参数不能省略位置，OMITTED 以 null 代替
    private static List<Object> positional(List<Object> resolved) {
        List<Object> result = new ArrayList<>(resolved.size());
        for (Object value : resolved) {
            result.add(value == OMITTED ? null : value);
        }
        return result;
    }

    private Object resolveArgument(String owner, Object argument) {
        Reference reference = argument instanceof Reference r ? r : Reference.fromShorthand(argument);
        if (reference != null) {
            return resolveReference(owner, reference);
        }
        if (argument instanceof String s) {
            if (s.startsWith("@@")) {
                return parameters.resolveValue(s.substring(1));
            }
            return parameters.resolveValue(s);
        }
        if (argument instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                Object value = resolveArgument(owner, item);
                if (value != OMITTED) {
                    result.add(value);
                }
            }
            return result;
        }
        if (argument instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object value = resolveArgument(owner, entry.getValue());
                if (value != OMITTED) {
                    result.put(entry.getKey(), value);
                }
            }
            return result;
        }
        return argument;
    }

    private Object resolveReference(String owner, Reference reference) {
        String targetId = reference.getId();
        if (has(targetId)) {
            return getService(resolveAlias(targetId), targetId);
        }
        switch (reference.getInvalidBehavior()) {
            case NULL:
                return null;
            case IGNORE:
                return OMITTED;
            default:
                throw new ServiceNotFoundException(targetId,
                        "Service '" + owner + "' depends on non-existent service '" + targetId + "'");
        }
    }

    @Override
    public String toString() {
        return String.format("Container{definitions=%d, aliases=%d, instances=%d}",
                definitions.size(), aliases.size(), instances.size());
    }
}
