package com.lingwire.core.parameter;

import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.api.exception.ParameterNotFoundException;
import com.lingwire.core.exception.CircularDependencyException;
import com.lingwire.core.exception.FrozenContainerException;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 参数仓库
 * <p>
 * 扁平的 名称 -> 值 注册表，值可以是标量、List 或 Map，且可以包含 %other.param% 占位符。
 * <ul>
 *   <li>整个字符串恰好是一个占位符时，替换结果保留参数原类型（整数仍是整数）</li>
 *   <li>占位符嵌在更长的字符串中时，做文本替换</li>
 *   <li>{@code %%} 转义为字面的 {@code %}，如 {@code "%%name%%"} 得到 {@code "%name%"}</li>
 * </ul>
 * 参数之间的引用递归解析，出现环时抛出 {@link CircularDependencyException}。
 * 冻结副本中的 List / Map 是不可修改的深拷贝。
 */
public class ParameterStore {

    // %% 在前，先于占位符匹配
    private static final Pattern PLACEHOLDER = Pattern.compile("%%|%([^%\\s]+)%");

    private final Map<String, Object> parameters = new LinkedHashMap<>();

    private final boolean frozen;

    public ParameterStore() {
        this(Collections.emptyMap(), false);
    }

    public ParameterStore(Map<String, ?> initial) {
        this(initial, false);
    }

    private ParameterStore(Map<String, ?> initial, boolean frozen) {
        if (initial != null) {
            this.parameters.putAll(initial);
        }
        this.frozen = frozen;
    }

    // ==================== 读写 ====================

    public void set(String name, Object value) {
        if (frozen) {
            throw new FrozenContainerException("Cannot set parameter '" + name + "' on a frozen parameter store");
        }
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Parameter name cannot be blank");
        }
        parameters.put(name, value);
    }

    public void remove(String name) {
        if (frozen) {
            throw new FrozenContainerException("Cannot remove parameter '" + name + "' from a frozen parameter store");
        }
        parameters.remove(name);
    }

    public boolean has(String name) {
        return parameters.containsKey(name);
    }

    /**
     * 获取参数值（已解析占位符）
     *
     * @throws ParameterNotFoundException 参数不存在
     */
    public Object get(String name) {
        if (frozen) {
            // 冻结副本中的值已全部解析
            return getRaw(name);
        }
        return resolveParameter(name, new LinkedHashSet<>());
    }

    /**
     * 获取原始值（不解析占位符）
     */
    public Object getRaw(String name) {
        if (!parameters.containsKey(name)) {
            throw new ParameterNotFoundException(name);
        }
        return parameters.get(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(parameters.keySet());
    }

    public Map<String, Object> all() {
        return Collections.unmodifiableMap(parameters);
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * 解析全部参数，返回冻结的副本
     * 任何缺失参数或参数环都会在此处暴露
     */
    public ParameterStore resolveAll() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String name : parameters.keySet()) {
            resolved.put(name, immutableCopy(get(name)));
        }
        return new ParameterStore(resolved, true);
    }

    private static Object immutableCopy(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(immutableCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), immutableCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    // ==================== 占位符 ====================

    /**
     * 解析任意值中的占位符
     * 字符串按占位符规则替换，List / Map 逐元素递归，其他值原样返回
     */
    public Object resolveValue(Object value) {
        return resolveValue(value, new LinkedHashSet<>());
    }

    /**
     * 字符串是否包含占位符
     */
    public static boolean containsPlaceholder(String value) {
        if (value == null) {
            return false;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 字符串是否需要替换（含占位符或 %% 转义）
     */
    private static boolean needsResolution(String value) {
        return value.indexOf('%') >= 0 && PLACEHOLDER.matcher(value).find();
    }

    private Object resolveParameter(String name, LinkedHashSet<String> resolving) {
        if (!parameters.containsKey(name)) {
            throw new ParameterNotFoundException(name);
        }
        if (!resolving.add(name)) {
            List<String> chain = new ArrayList<>(resolving);
            List<String> cycle = new ArrayList<>(chain.subList(chain.indexOf(name), chain.size()));
            cycle.add(name);
            throw CircularDependencyException.forParameters(cycle);
        }
        try {
            return resolveValue(parameters.get(name), resolving);
        } finally {
            resolving.remove(name);
        }
    }

    private Object resolveValue(Object value, LinkedHashSet<String> resolving) {
        if (value instanceof String s) {
            return resolveString(s, resolving);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(resolveValue(item, resolving));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(entry.getKey(), resolveValue(entry.getValue(), resolving));
            }
            return result;
        }
        return value;
    }

    private Object resolveString(String value, LinkedHashSet<String> resolving) {
        if (!needsResolution(value)) {
            return value;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        if (matcher.matches() && matcher.group(1) != null) {
            // 整串即占位符：保留参数类型
            String name = matcher.group(1);
            return frozen ? getRaw(name) : resolveParameter(name, resolving);
        }

        matcher.reset();
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (name == null) {
                matcher.appendReplacement(sb, "%");
                continue;
            }
            Object resolved = frozen ? getRaw(name) : resolveParameter(name, resolving);
            if (resolved instanceof Collection<?> || resolved instanceof Map<?, ?>) {
                throw new InvalidArgumentException(name, resolved,
                        "Parameter '" + name + "' of type " + resolved.getClass().getSimpleName()
                                + " cannot be embedded in string \"" + value + "\"");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(resolved)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ParameterStore{size=%d, frozen=%s}", parameters.size(), frozen);
    }
}
