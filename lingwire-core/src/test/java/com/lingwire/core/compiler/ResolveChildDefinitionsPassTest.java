package com.lingwire.core.compiler;

import com.lingwire.api.exception.ServiceNotFoundException;
import com.lingwire.core.container.Container;
import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.exception.CircularDependencyException;
import com.lingwire.core.fixture.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolveChildDefinitionsPass 单元测试")
public class ResolveChildDefinitionsPassTest {

    private ContainerBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ContainerBuilder();
    }

    @Test
    @DisplayName("子定义继承类、参数、方法调用和标签")
    void childShouldInheritFromParent() {
        builder.register("logger", ConsoleLogger.class);
        builder.register("mailer.base", Mailer.class)
                .setAbstract(true)
                .setPublic(false)
                .setArguments("localhost", 25)
                .addMethodCall("setLogger", new Reference("logger"))
                .addTag("mailer", Map.of("transport", "smtp"));
        builder.setDefinition("mailer.backup", new Definition()
                .setParent("mailer.base")
                .setArgument(1, 2525)
                .addTag("mailer", Map.of("transport", "backup")));

        new ResolveChildDefinitionsPass().process(builder);

        Definition child = builder.getDefinition("mailer.backup");
        assertEquals(Mailer.class.getName(), child.getClassName());
        assertEquals(List.of("localhost", 2525), child.getArguments());
        assertEquals(1, child.getMethodCalls().size());
        assertEquals("smtp", child.getTag("mailer").get(0).get("transport"));
        assertEquals("backup", child.getTag("mailer").get(1).get("transport"));
        assertNull(child.getParent());
        assertTrue(child.isPublic());
        assertFalse(child.isAbstract());
    }

    @Test
    @DisplayName("多级继承与运行期构造")
    void multiLevelInheritance() {
        builder.register("logger", ConsoleLogger.class);
        builder.register("base", Mailer.class).setAbstract(true).addArgument("smtp.local")
                .addMethodCall("setLogger", "@logger");
        builder.setDefinition("middle", new Definition().setParent("base").setAbstract(true).setArgument(1, 25));
        builder.setDefinition("leaf", new Definition().setParent("middle").setLazy(true));

        Container container = builder.compile();

        Mailer mailer = container.get("leaf", Mailer.class);
        assertEquals("smtp.local", mailer.getHost());
        assertEquals(25, mailer.getPort());
        assertSame(container.get("logger"), mailer.getLogger());
    }

    @Test
    @DisplayName("父定义中的 autowired 被继承")
    void autowiredFlagIsInherited() {
        builder.register("repository", UserRepository.class);
        builder.register("logger", ConsoleLogger.class);
        builder.register("service.template", UserService.class).setAbstract(true).setAutowired(true);
        builder.setDefinition("users", new Definition().setParent("service.template"));

        Container container = builder.compile();

        assertNotNull(container.get("users", UserService.class).getRepository());
    }

    @Test
    @DisplayName("父定义不存在时失败")
    void missingParentShouldFail() {
        builder.setDefinition("orphan", new Definition().setParent("nobody"));

        ServiceNotFoundException e = assertThrows(ServiceNotFoundException.class,
                () -> new ResolveChildDefinitionsPass().process(builder));

        assertEquals("nobody", e.getServiceId());
    }

    @Test
    @DisplayName("父定义环失败")
    void parentCycleShouldFail() {
        builder.setDefinition("a", new Definition().setParent("b"));
        builder.setDefinition("b", new Definition().setParent("a"));

        CircularDependencyException e = assertThrows(CircularDependencyException.class,
                () -> new ResolveChildDefinitionsPass().process(builder));

        assertEquals(List.of("a", "b", "a"), e.getPath());
    }
}
