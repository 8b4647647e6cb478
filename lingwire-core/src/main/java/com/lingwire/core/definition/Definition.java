package com.lingwire.core.definition;

import com.lingwire.api.exception.InvalidArgumentException;

import java.util.*;

/**
 * 服务定义（蓝图）
 * <p>
 * 描述如何构造一个服务：类、构造参数、方法调用、标签、工厂和标志位。
 * 所有 setter 返回自身以便链式调用；定义本身不感知持有它的容器。
 * <p>
 * 构造参数按位置稀疏存储：{@link #setArgument(int, Object)} 越界时扩展列表，
 * 中间未设置的位置视为空洞，自动装配会填补空洞但不会覆盖已显式提供的位置。
 */
public class Definition {

    private String className;

    private final TreeMap<Integer, Object> arguments = new TreeMap<>();

    private final List<MethodCall> methodCalls = new ArrayList<>();

    // 标签名 -> 属性表列表，同一标签可多次添加
    private final Map<String, List<Map<String, Object>>> tags = new LinkedHashMap<>();

    private Factory factory;

    private boolean shared = true;
    private boolean publicService = true;
    private boolean autowired = false;
    private boolean lazy = false;
    private boolean synthetic = false;
    private boolean abstractDefinition = false;

    private String parent;

    public Definition() {
    }

    public Definition(String className) {
        this.className = className;
    }

    public Definition(Class<?> type) {
        this.className = type != null ? type.getName() : null;
    }

    // ==================== 类 ====================

    public String getClassName() {
        return className;
    }

    public Definition setClassName(String className) {
        this.className = className;
        return this;
    }

    public Definition setClass(Class<?> type) {
        this.className = type != null ? type.getName() : null;
        return this;
    }

    // ==================== 构造参数 ====================

    /**
     * 获取构造参数（稠密视图，空洞位置为 null）
     */
    public List<Object> getArguments() {
        if (arguments.isEmpty()) {
            return new ArrayList<>();
        }
        int size = arguments.lastKey() + 1;
        List<Object> list = new ArrayList<>(Collections.nCopies(size, null));
        arguments.forEach(list::set);
        return list;
    }

    /**
     * 替换全部构造参数
     */
    public Definition setArguments(List<?> arguments) {
        this.arguments.clear();
        if (arguments != null) {
            for (int i = 0; i < arguments.size(); i++) {
                this.arguments.put(i, arguments.get(i));
            }
        }
        return this;
    }

    public Definition setArguments(Object... arguments) {
        return setArguments(Arrays.asList(arguments));
    }

    public Definition setArgument(int index, Object value) {
        if (index < 0) {
            throw new InvalidArgumentException("index", index, "Argument index cannot be negative: " + index);
        }
        arguments.put(index, value);
        return this;
    }

    public Definition addArgument(Object value) {
        arguments.put(arguments.isEmpty() ? 0 : arguments.lastKey() + 1, value);
        return this;
    }

    public Object getArgument(int index) {
        if (!arguments.containsKey(index)) {
            throw new InvalidArgumentException("index", index, "Argument " + index + " is not set");
        }
        return arguments.get(index);
    }

    /**
     * 指定位置是否已显式提供参数
     */
    public boolean hasArgument(int index) {
        return arguments.containsKey(index);
    }

    /**
     * 已显式提供的位置集合（升序）
     */
    public Set<Integer> getArgumentIndexes() {
        return Collections.unmodifiableSet(arguments.keySet());
    }

    // ==================== 方法调用 ====================

    public Definition addMethodCall(String method, List<?> arguments) {
        if (method == null || method.isBlank()) {
            throw new InvalidArgumentException("method", "Method name cannot be blank");
        }
        methodCalls.add(new MethodCall(method, arguments == null ? null : new ArrayList<>(arguments)));
        return this;
    }

    public Definition addMethodCall(String method, Object... arguments) {
        return addMethodCall(method, Arrays.asList(arguments));
    }

    public List<MethodCall> getMethodCalls() {
        return Collections.unmodifiableList(methodCalls);
    }

    public Definition setMethodCalls(List<MethodCall> calls) {
        methodCalls.clear();
        if (calls != null) {
            methodCalls.addAll(calls);
        }
        return this;
    }

    public boolean hasMethodCall(String method) {
        return methodCalls.stream().anyMatch(c -> c.method().equals(method));
    }

    // ==================== 标签 ====================

    public Definition addTag(String name) {
        return addTag(name, Collections.emptyMap());
    }

    public Definition addTag(String name, Map<String, ?> attributes) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Tag name cannot be blank");
        }
        Map<String, Object> copy = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
        tags.computeIfAbsent(name, k -> new ArrayList<>()).add(copy);
        return this;
    }

    public Map<String, List<Map<String, Object>>> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public boolean hasTag(String name) {
        return tags.containsKey(name);
    }

    /**
     * 获取某个标签的全部属性表（按添加顺序），没有该标签时返回空列表
     */
    public List<Map<String, Object>> getTag(String name) {
        List<Map<String, Object>> list = tags.get(name);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public Definition clearTag(String name) {
        tags.remove(name);
        return this;
    }

    // ==================== 工厂 ====================

    public Factory getFactory() {
        return factory;
    }

    public Definition setFactory(Factory factory) {
        this.factory = factory;
        return this;
    }

    public Definition setFactory(ServiceFactory callable) {
        this.factory = Factory.of(callable);
        return this;
    }

    public Definition setFactory(Reference service, String method) {
        this.factory = Factory.ofService(service, method);
        return this;
    }

    // ==================== 标志位 ====================

    public boolean isShared() {
        return shared;
    }

    public Definition setShared(boolean shared) {
        this.shared = shared;
        return this;
    }

    public boolean isPublic() {
        return publicService;
    }

    public Definition setPublic(boolean publicService) {
        this.publicService = publicService;
        return this;
    }

    public boolean isAutowired() {
        return autowired;
    }

    public Definition setAutowired(boolean autowired) {
        this.autowired = autowired;
        return this;
    }

    public boolean isLazy() {
        return lazy;
    }

    public Definition setLazy(boolean lazy) {
        this.lazy = lazy;
        return this;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public Definition setSynthetic(boolean synthetic) {
        this.synthetic = synthetic;
        return this;
    }

    public boolean isAbstract() {
        return abstractDefinition;
    }

    public Definition setAbstract(boolean abstractDefinition) {
        this.abstractDefinition = abstractDefinition;
        return this;
    }

    public String getParent() {
        return parent;
    }

    public Definition setParent(String parent) {
        this.parent = parent;
        return this;
    }

    // ==================== 拷贝 ====================

    /**
     * 深拷贝
     * 嵌套的 List / Map 参数会被复制，引用和字面量共享
     */
    public Definition copy() {
        Definition copy = new Definition(className);
        arguments.forEach((index, value) -> copy.arguments.put(index, deepCopy(value)));
        for (MethodCall call : methodCalls) {
            copy.methodCalls.add(call.copy());
        }
        tags.forEach((name, list) -> {
            List<Map<String, Object>> copied = new ArrayList<>();
            for (Map<String, Object> attrs : list) {
                copied.add(new LinkedHashMap<>(attrs));
            }
            copy.tags.put(name, copied);
        });
        copy.factory = factory;
        copy.shared = shared;
        copy.publicService = publicService;
        copy.autowired = autowired;
        copy.lazy = lazy;
        copy.synthetic = synthetic;
        copy.abstractDefinition = abstractDefinition;
        copy.parent = parent;
        return copy;
    }

    @SuppressWarnings("unchecked")
    static <T> T deepCopy(T value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return (T) copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return (T) copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format("Definition{class='%s', shared=%s, public=%s, autowired=%s, abstract=%s, synthetic=%s}",
                className, shared, publicService, autowired, abstractDefinition, synthetic);
    }
}
