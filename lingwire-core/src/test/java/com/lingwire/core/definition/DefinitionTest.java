package com.lingwire.core.definition;

import com.lingwire.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Definition 单元测试")
public class DefinitionTest {

    @Nested
    @DisplayName("构造参数")
    class ArgumentTests {

        @Test
        @DisplayName("setArgument 越界时扩展并留下空洞")
        void setArgumentShouldExtendWithHoles() {
            Definition definition = new Definition("x").addArgument("a").setArgument(3, "d");

            assertEquals(Arrays.asList("a", null, null, "d"), definition.getArguments());
            assertTrue(definition.hasArgument(0));
            assertFalse(definition.hasArgument(1));
            assertTrue(definition.hasArgument(3));
        }

        @Test
        @DisplayName("addArgument 追加在最后一个位置之后")
        void addArgumentShouldAppend() {
            Definition definition = new Definition("x").setArgument(1, "b").addArgument("c");

            assertEquals(Arrays.asList(null, "b", "c"), definition.getArguments());
        }

        @Test
        @DisplayName("负数位置被拒绝")
        void negativeIndexShouldBeRejected() {
            Definition definition = new Definition("x");

            assertThrows(InvalidArgumentException.class, () -> definition.setArgument(-1, "a"));
        }

        @Test
        @DisplayName("读取未设置的位置报错")
        void getUnsetArgumentShouldFail() {
            Definition definition = new Definition("x").setArguments("a");

            assertEquals("a", definition.getArgument(0));
            assertThrows(InvalidArgumentException.class, () -> definition.getArgument(1));
        }

        @Test
        @DisplayName("setArguments 替换全部参数")
        void setArgumentsShouldReplace() {
            Definition definition = new Definition("x").setArgument(5, "z").setArguments("a", "b");

            assertEquals(List.of("a", "b"), definition.getArguments());
        }
    }

    @Nested
    @DisplayName("标签")
    class TagTests {

        @Test
        @DisplayName("同一标签可以多次添加，保持顺序")
        void sameTagCanBeAddedTwice() {
            Definition definition = new Definition("x")
                    .addTag("kernel.listener", Map.of("event", "request"))
                    .addTag("kernel.listener", Map.of("event", "response"));

            List<Map<String, Object>> tags = definition.getTag("kernel.listener");
            assertEquals(2, tags.size());
            assertEquals("request", tags.get(0).get("event"));
            assertEquals("response", tags.get(1).get("event"));
        }

        @Test
        @DisplayName("未添加的标签返回空列表")
        void missingTagShouldBeEmpty() {
            Definition definition = new Definition("x").addTag("a");

            assertTrue(definition.hasTag("a"));
            assertTrue(definition.getTag("a").get(0).isEmpty());
            assertFalse(definition.hasTag("b"));
            assertTrue(definition.getTag("b").isEmpty());
        }

        @Test
        @DisplayName("clearTag 删除整个标签")
        void clearTagShouldRemove() {
            Definition definition = new Definition("x").addTag("a").addTag("b");

            definition.clearTag("a");

            assertFalse(definition.hasTag("a"));
            assertTrue(definition.hasTag("b"));
        }
    }

    @Nested
    @DisplayName("流式 API 与拷贝")
    class FluentAndCopyTests {

        @Test
        @DisplayName("setter 返回同一个实例")
        void settersShouldReturnSameInstance() {
            Definition definition = new Definition();

            assertSame(definition, definition.setShared(false));
            assertSame(definition, definition.setPublic(false));
            assertSame(definition, definition.setAutowired(true));
            assertSame(definition, definition.setLazy(true));
            assertSame(definition, definition.setClass(String.class));
            assertSame(definition, definition.addMethodCall("setX", 1));
            assertEquals(String.class.getName(), definition.getClassName());
        }

        @Test
        @DisplayName("默认标志位")
        void defaultFlags() {
            Definition definition = new Definition("x");

            assertTrue(definition.isShared());
            assertTrue(definition.isPublic());
            assertFalse(definition.isAutowired());
            assertFalse(definition.isLazy());
            assertFalse(definition.isSynthetic());
            assertFalse(definition.isAbstract());
            assertNull(definition.getParent());
        }

        @Test
        @DisplayName("copy 深拷贝嵌套参数")
        void copyShouldBeDeep() {
            List<Object> nested = new ArrayList<>(List.of("a"));
            Definition original = new Definition("x")
                    .addArgument(nested)
                    .addMethodCall("add", new ArrayList<>(List.of("m")))
                    .addTag("t", Map.of("k", "v"))
                    .setLazy(true);

            Definition copy = original.copy();
            nested.add("b");
            original.addTag("t2");

            assertEquals(List.of("a"), copy.getArgument(0));
            assertEquals(1, copy.getMethodCalls().size());
            assertFalse(copy.hasTag("t2"));
            assertTrue(copy.isLazy());
            assertEquals("x", copy.getClassName());
        }

        @Test
        @DisplayName("方法调用按添加顺序保存")
        void methodCallsShouldKeepOrder() {
            Definition definition = new Definition("x")
                    .addMethodCall("first")
                    .addMethodCall("second", "arg");

            assertEquals("first", definition.getMethodCalls().get(0).method());
            assertEquals(List.of("arg"), definition.getMethodCalls().get(1).arguments());
            assertTrue(definition.hasMethodCall("second"));
            assertThrows(InvalidArgumentException.class, () -> definition.addMethodCall(" "));
        }
    }
}
