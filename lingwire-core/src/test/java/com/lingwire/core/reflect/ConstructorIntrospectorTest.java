package com.lingwire.core.reflect;

import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.core.fixture.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstructorIntrospector 单元测试")
public class ConstructorIntrospectorTest {

    @Test
    @DisplayName("读取默认值与可空性")
    void describeParameters() {
        Constructor<?> constructor = ConstructorIntrospector.greediestConstructors(Newsletter.class).get(0);

        List<ParameterMetadata> parameters = ConstructorIntrospector.describe(constructor);

        assertEquals(4, parameters.size());
        assertTrue(parameters.get(0).nullable());
        assertFalse(parameters.get(0).isScalar());
        assertFalse(parameters.get(1).nullable());
        assertTrue(parameters.get(2).hasDefault());
        assertEquals("Weekly news", parameters.get(2).defaultValue());
        assertEquals(50, parameters.get(3).defaultValue());
        assertTrue(parameters.get(3).isScalar());
    }

    @Test
    @DisplayName("取参数最多的构造器，接口没有构造器")
    void greediestConstructors() {
        assertEquals(1, ConstructorIntrospector.greediestConstructors(FileLogger.class).size());
        assertEquals(1, ConstructorIntrospector.greediestConstructors(FileLogger.class).get(0).getParameterCount());
        assertEquals(2, ConstructorIntrospector.greediestConstructors(TwoConstructors.class).size());
        assertTrue(ConstructorIntrospector.greediestConstructors(Logger.class).isEmpty());
    }

    @Test
    @DisplayName("标量类型")
    void scalarTypes() {
        assertTrue(ConstructorIntrospector.isScalarType(int.class));
        assertTrue(ConstructorIntrospector.isScalarType(String.class));
        assertTrue(ConstructorIntrospector.isScalarType(RetentionPolicy.class));
        assertFalse(ConstructorIntrospector.isScalarType(List.class));
        assertFalse(ConstructorIntrospector.isScalarType(Map.class));
        assertFalse(ConstructorIntrospector.isScalarType(Logger.class));
    }

    @Test
    @DisplayName("默认值转换")
    void convertDefault() {
        assertEquals(8080, ConstructorIntrospector.convertDefault("port", "8080", int.class));
        assertEquals(true, ConstructorIntrospector.convertDefault("debug", "true", Boolean.class));
        assertEquals(RetentionPolicy.RUNTIME,
                ConstructorIntrospector.convertDefault("policy", "RUNTIME", RetentionPolicy.class));
        assertEquals("%port%", ConstructorIntrospector.convertDefault("port", "%port%", int.class));
        assertThrows(InvalidArgumentException.class,
                () -> ConstructorIntrospector.convertDefault("port", "eighty", int.class));
        assertThrows(InvalidArgumentException.class,
                () -> ConstructorIntrospector.convertDefault("logger", "x", Logger.class));
    }

    @Test
    @DisplayName("按实参匹配构造器并做数值转换")
    void executableMatcher() {
        List<Constructor<?>> matches = ExecutableMatcher.matchConstructors(Mailer.class, List.of("host", 25L));

        assertEquals(1, matches.size());
        Object[] values = ExecutableMatcher.coerce(matches.get(0), List.of("host", 25L));
        assertEquals(25, values[1]);
        assertTrue(ExecutableMatcher.matchConstructors(Mailer.class, Arrays.asList("host", null)).isEmpty());
        assertEquals("(String, Long)", ExecutableMatcher.describe(List.of("host", 25L)));
        assertEquals(1, ExecutableMatcher.matchMethods(MailerFactory.class, "create", List.of("h", 1), true).size());
        assertTrue(ExecutableMatcher.matchMethods(MailerFactory.class, "build", List.of(1), true).isEmpty());
    }

    @Test
    @DisplayName("数值只做无损转换")
    void losslessNumbersOnly() {
        assertTrue(ExecutableMatcher.isLosslessNumber(Integer.class, 25L));
        assertFalse(ExecutableMatcher.isLosslessNumber(Integer.class, 5_000_000_000L));
        assertFalse(ExecutableMatcher.isLosslessNumber(Integer.class, 2.9d));
        assertFalse(ExecutableMatcher.isLosslessNumber(Integer.class, 2.0d));
        assertFalse(ExecutableMatcher.isLosslessNumber(Byte.class, 300));
        assertTrue(ExecutableMatcher.isLosslessNumber(Short.class, -300));
        assertTrue(ExecutableMatcher.isLosslessNumber(Double.class, 42));
        assertFalse(ExecutableMatcher.isLosslessNumber(Double.class, Long.MAX_VALUE));
        assertFalse(ExecutableMatcher.isLosslessNumber(Double.class, Long.MIN_VALUE));
        assertTrue(ExecutableMatcher.isLosslessNumber(Float.class, 0.5d));
        assertFalse(ExecutableMatcher.isLosslessNumber(Float.class, 0.1d));
        assertTrue(ExecutableMatcher.isLosslessNumber(Long.class, BigInteger.valueOf(7)));
        assertFalse(ExecutableMatcher.isLosslessNumber(Long.class, BigInteger.ONE.shiftLeft(64)));
        assertFalse(ExecutableMatcher.isLosslessNumber(Number.class, 1));
        assertTrue(ExecutableMatcher.matchConstructors(Mailer.class, List.of("host", 5_000_000_000L)).isEmpty());
    }

    @Test
    @DisplayName("并列候选取最具体的，无法区分时全部返回")
    void tiesAreReported() {
        List<Object> nullArgument = Arrays.asList((Object) null);

        assertEquals(2, ExecutableMatcher.matchConstructors(Overloaded.class, nullArgument).size());
        List<Method> setters =
                ExecutableMatcher.matchMethods(Overloaded.class, "set", nullArgument, false);
        assertEquals(1, setters.size());
        assertEquals(CharSequence.class, setters.get(0).getParameterTypes()[0]);
    }
}
