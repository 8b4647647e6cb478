package com.lingwire.core.reflect;

import com.lingwire.api.annotation.DefaultValue;
import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.core.parameter.ParameterStore;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.*;

/**
 * 构造器内省
 * <p>
 * 为自动装配提供参数名、声明类型、默认值和可空性。
 * Java 没有参数默认值，以 {@link DefaultValue} 代替；可空性识别任何简单名为 Nullable 的注解。
 */
public final class ConstructorIntrospector {

    private static final String NULLABLE = "Nullable";

    private static final Set<Class<?>> SCALAR_TYPES = Set.of(
            String.class, CharSequence.class, Number.class, Object.class,
            Boolean.class, Character.class, Byte.class, Short.class,
            Integer.class, Long.class, Float.class, Double.class);

    private ConstructorIntrospector() {
    }

    /**
     * 参数最多的公共构造器（可能有多个并列）
     * 没有公共构造器时返回空列表
     */
    public static List<Constructor<?>> greediestConstructors(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return Collections.emptyList();
        }
        Constructor<?>[] constructors = type.getConstructors();
        int max = -1;
        List<Constructor<?>> result = new ArrayList<>();
        for (Constructor<?> constructor : constructors) {
            int count = constructor.getParameterCount();
            if (count > max) {
                max = count;
                result.clear();
                result.add(constructor);
            } else if (count == max) {
                result.add(constructor);
            }
        }
        return result;
    }

    public static List<ParameterMetadata> describe(Constructor<?> constructor) {
        Parameter[] parameters = constructor.getParameters();
        List<ParameterMetadata> result = new ArrayList<>(parameters.length);
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            Class<?> type = parameter.getType();
            DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);
            boolean nullable = !type.isPrimitive() && isNullable(parameter);
            if (defaultValue != null) {
                result.add(new ParameterMetadata(i, parameter.getName(), type, true,
                        convertDefault(parameter.getName(), defaultValue.value(), type), nullable));
            } else {
                result.add(new ParameterMetadata(i, parameter.getName(), type, false, null, nullable));
            }
        }
        return result;
    }

    public static boolean isScalarType(Class<?> type) {
        return type.isPrimitive() || type.isEnum() || SCALAR_TYPES.contains(type);
    }

    private static boolean isNullable(Parameter parameter) {
        for (Annotation annotation : parameter.getAnnotations()) {
            if (NULLABLE.equals(annotation.annotationType().getSimpleName())) {
                return true;
            }
        }
        // TYPE_USE 注解（如 jspecify）挂在类型上
        for (Annotation annotation : parameter.getAnnotatedType().getAnnotations()) {
            if (NULLABLE.equals(annotation.annotationType().getSimpleName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 将默认值字符串转换为参数类型
     * 含占位符时保留字符串，由运行期替换
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object convertDefault(String name, String raw, Class<?> type) {
        if (ParameterStore.containsPlaceholder(raw) || type == String.class
                || type == CharSequence.class || type == Object.class) {
            return raw;
        }
        try {
            if (type == int.class || type == Integer.class) return Integer.valueOf(raw.trim());
            if (type == long.class || type == Long.class) return Long.valueOf(raw.trim());
            if (type == boolean.class || type == Boolean.class) return Boolean.valueOf(raw.trim());
            if (type == double.class || type == Double.class) return Double.valueOf(raw.trim());
            if (type == float.class || type == Float.class) return Float.valueOf(raw.trim());
            if (type == short.class || type == Short.class) return Short.valueOf(raw.trim());
            if (type == byte.class || type == Byte.class) return Byte.valueOf(raw.trim());
            if (type == char.class || type == Character.class) {
                if (raw.length() != 1) {
                    throw new IllegalArgumentException("expected a single character");
                }
                return raw.charAt(0);
            }
            if (type.isEnum()) return Enum.valueOf((Class<? extends Enum>) type, raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(name, raw,
                    "Default value '" + raw + "' of parameter '" + name + "' is not a valid " + type.getSimpleName());
        }
        throw new InvalidArgumentException(name, raw,
                "@DefaultValue is not supported for parameter '" + name + "' of type " + type.getName());
    }
}
