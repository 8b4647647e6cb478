package com.lingwire.core.reflect;

/**
 * 构造参数元数据
 *
 * @param index        参数位置
 * @param name         参数名（需 -parameters 编译，否则为 argN）
 * @param type         声明类型
 * @param hasDefault   是否声明了默认值
 * @param defaultValue 默认值（已转换为参数类型，或保留占位符字符串）
 * @param nullable     是否允许 null
 */
public record ParameterMetadata(int index, String name, Class<?> type,
                                boolean hasDefault, Object defaultValue, boolean nullable) {

    /**
     * 标量类型（基本类型、包装类型、字符串）无法按类型自动装配
     */
    public boolean isScalar() {
        return ConstructorIntrospector.isScalarType(type);
    }
}
