package com.lingwire.core.definition;

import com.lingwire.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reference 单元测试")
public class ReferenceTest {

    @Test
    @DisplayName("默认策略为 EXCEPTION")
    void defaultBehaviorIsException() {
        Reference reference = new Reference("mailer");

        assertEquals("mailer", reference.getId());
        assertEquals(InvalidBehavior.EXCEPTION, reference.getInvalidBehavior());
        assertEquals("mailer", reference.toString());
    }

    @Test
    @DisplayName("值对象相等性")
    void referencesShouldBeValueObjects() {
        assertEquals(new Reference("a", InvalidBehavior.NULL), new Reference("a", InvalidBehavior.NULL));
        assertNotEquals(new Reference("a", InvalidBehavior.NULL), new Reference("a", InvalidBehavior.IGNORE));
    }

    @Test
    @DisplayName("空 ID 被拒绝")
    void blankIdShouldBeRejected() {
        assertThrows(InvalidArgumentException.class, () -> new Reference(" "));
        assertThrows(InvalidArgumentException.class, () -> new Reference(null));
    }

    @Test
    @DisplayName("解析 @ 简写，@@ 为转义")
    void shorthandParsing() {
        assertEquals(new Reference("logger"), Reference.fromShorthand("@logger"));
        assertNull(Reference.fromShorthand("@@literal"));
        assertNull(Reference.fromShorthand("@"));
        assertNull(Reference.fromShorthand("plain"));
        assertNull(Reference.fromShorthand(42));
    }

    @Test
    @DisplayName("工厂的三种形态")
    void factoryShapes() {
        Factory callable = Factory.of(args -> "x");
        Factory service = Factory.ofService("mailer.factory", "build");
        Factory staticMethod = Factory.ofStatic(String.class, "valueOf");

        assertTrue(callable.isCallable());
        assertTrue(service.isServiceMethod());
        assertEquals("mailer.factory", service.getService().getId());
        assertTrue(staticMethod.isStaticMethod());
        assertEquals("java.lang.String", staticMethod.getClassName());
        assertThrows(InvalidArgumentException.class, () -> Factory.ofStatic(String.class, ""));
    }
}
