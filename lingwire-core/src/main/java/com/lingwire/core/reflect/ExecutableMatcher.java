package com.lingwire.core.reflect;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 按实参匹配构造器 / 方法
 * <p>
 * 匹配规则：参数个数一致，每个实参可赋值给形参（支持装箱，null 不能赋给基本类型）。
 * 数值只做无损转换：整数须落在目标类型范围内，带小数的值不能转为整数。
 * <p>
 * 多个候选时取精确匹配最多的；仍然并列时取形参最具体的一个（与 javac 重载选择一致），
 * 无法区分时全部返回，由调用方报歧义。
 */
public final class ExecutableMatcher {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            int.class, Integer.class, long.class, Long.class, boolean.class, Boolean.class,
            double.class, Double.class, float.class, Float.class, short.class, Short.class,
            byte.class, Byte.class, char.class, Character.class);

    // double / float 能精确表示的整数上限
    private static final long MAX_EXACT_DOUBLE = 1L << 53;
    private static final long MAX_EXACT_FLOAT = 1L << 24;

    private ExecutableMatcher() {
    }

    /**
     * @return 最佳候选；为空表示没有匹配，多于一个表示歧义
     */
    public static List<Constructor<?>> matchConstructors(Class<?> type, List<Object> args) {
        List<Constructor<?>> candidates = new ArrayList<>();
        for (Constructor<?> constructor : type.getConstructors()) {
            candidates.add(constructor);
        }
        return best(candidates, args);
    }

    /**
     * @return 最佳候选；为空表示没有匹配，多于一个表示歧义
     */
    public static List<Method> matchMethods(Class<?> type, String name, List<Object> args, boolean requireStatic) {
        List<Method> candidates = new ArrayList<>();
        for (Method method : type.getMethods()) {
            // 桥接方法与其目标方法签名重复
            if (!method.getName().equals(name) || method.isBridge()) {
                continue;
            }
            if (requireStatic && !Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            candidates.add(method);
        }
        return best(candidates, args);
    }

    /**
     * 按形参类型转换实参（仅无损数值转换）
     */
    public static Object[] coerce(Executable executable, List<Object> args) {
        Class<?>[] types = executable.getParameterTypes();
        Object[] result = new Object[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = coerceValue(types[i], args.get(i));
        }
        return result;
    }

    public static String describe(List<Object> args) {
        List<String> types = new ArrayList<>(args.size());
        for (Object arg : args) {
            types.add(arg == null ? "null" : arg.getClass().getSimpleName());
        }
        return "(" + String.join(", ", types) + ")";
    }

    private static <T extends Executable> List<T> best(List<T> candidates, List<Object> args) {
        List<T> top = new ArrayList<>();
        int bestScore = -1;
        for (T candidate : candidates) {
            int score = score(candidate, args);
            if (score < 0 || score < bestScore) {
                continue;
            }
            if (score > bestScore) {
                top.clear();
                bestScore = score;
            }
            top.add(candidate);
        }
        if (top.size() <= 1) {
            return top;
        }

        List<T> mostSpecific = new ArrayList<>();
        for (T candidate : top) {
            boolean specific = true;
            for (T other : top) {
                if (other != candidate && !isMoreSpecific(candidate, other)) {
                    specific = false;
                    break;
                }
            }
            if (specific) {
                mostSpecific.add(candidate);
            }
        }
        return mostSpecific.size() == 1 ? mostSpecific : top;
    }

    private static boolean isMoreSpecific(Executable candidate, Executable other) {
        Class<?>[] mine = candidate.getParameterTypes();
        Class<?>[] theirs = other.getParameterTypes();
        for (int i = 0; i < mine.length; i++) {
            if (!box(theirs[i]).isAssignableFrom(box(mine[i]))) {
                return false;
            }
        }
        return true;
    }

    // 不匹配返回 -1，否则返回精确匹配数
    private static int score(Executable executable, List<Object> args) {
        Class<?>[] types = executable.getParameterTypes();
        if (types.length != args.size()) {
            return -1;
        }
        int exact = 0;
        for (int i = 0; i < types.length; i++) {
            Object arg = args.get(i);
            Class<?> type = types[i];
            if (arg == null) {
                if (type.isPrimitive()) {
                    return -1;
                }
                continue;
            }
            Class<?> boxed = box(type);
            if (arg.getClass() == boxed) {
                exact++;
            } else if (!boxed.isInstance(arg) && !isLosslessNumber(boxed, arg)) {
                return -1;
            }
        }
        return exact;
    }

    private static Class<?> box(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    static boolean isLosslessNumber(Class<?> boxed, Object arg) {
        if (!(arg instanceof Number number) || !Number.class.isAssignableFrom(boxed)
                || !WRAPPERS.containsValue(boxed)) {
            return false;
        }
        if (isIntegral(number)) {
            if (number instanceof BigInteger big && big.bitLength() >= Long.SIZE) {
                return false;
            }
            long value = number.longValue();
            if (boxed == Long.class) return true;
            if (boxed == Integer.class) return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            if (boxed == Short.class) return value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            if (boxed == Byte.class) return value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
            if (boxed == Double.class) return value >= -MAX_EXACT_DOUBLE && value <= MAX_EXACT_DOUBLE;
            if (boxed == Float.class) return value >= -MAX_EXACT_FLOAT && value <= MAX_EXACT_FLOAT;
            return false;
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (boxed == Double.class) return true;
            if (boxed == Float.class) return Double.isNaN(value) || (double) (float) value == value;
        }
        return false;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger;
    }

    private static Object coerceValue(Class<?> type, Object arg) {
        Class<?> boxed = box(type);
        if (arg == null || boxed.isInstance(arg) || !(arg instanceof Number number)) {
            return arg;
        }
        if (boxed == Integer.class) return number.intValue();
        if (boxed == Long.class) return number.longValue();
        if (boxed == Double.class) return number.doubleValue();
        if (boxed == Float.class) return number.floatValue();
        if (boxed == Short.class) return number.shortValue();
        if (boxed == Byte.class) return number.byteValue();
        return arg;
    }
}
