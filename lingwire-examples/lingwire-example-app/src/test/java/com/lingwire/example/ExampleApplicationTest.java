package com.lingwire.example;

import com.lingwire.api.exception.ServiceNotFoundException;
import com.lingwire.core.container.Container;
import com.lingwire.core.kernel.Kernel;
import com.lingwire.example.controller.UserController;
import com.lingwire.example.mail.Mailer;
import com.lingwire.example.mail.SmtpMailer;
import com.lingwire.example.report.ReportRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("示例应用集成测试")
public class ExampleApplicationTest {

    private Container container;

    @BeforeEach
    void setUp() {
        Kernel kernel = ExampleApplication.createKernel("test", false);
        kernel.boot();
        container = kernel.getContainer();
    }

    @Test
    @DisplayName("邮件发送器由工厂创建，参数来自 parameters.yml")
    void mailerIsBuiltByFactory() {
        SmtpMailer mailer = container.get("mailer", SmtpMailer.class);

        assertEquals("smtp.example.com", mailer.getHost());
        assertEquals(2525, mailer.getPort());
    }

    @Test
    @DisplayName("控制器通过别名获取，依赖自动装配")
    void controllerIsAutowired() {
        UserController controller = container.get("controller.users", UserController.class);

        controller.create("Alice", "alice@example.com");
        controller.create("Bob", "bob@example.com");

        assertEquals(2, controller.list().size());
        assertSame(controller, container.get("user.controller"));
        assertEquals(2, container.get("mailer", Mailer.class).getSentCount());
    }

    @Test
    @DisplayName("带标签的报表生成器被注册")
    void reportGeneratorsAreRegistered() {
        UserController controller = container.get("user.controller", UserController.class);
        controller.create("Alice", "alice@example.com");

        assertEquals(Set.of("csv", "json"), container.get("report.registry", ReportRegistry.class).formats());
        assertEquals("id,name,email\n1,Alice,alice@example.com", controller.export("csv"));
        assertEquals("[{\"id\":1,\"name\":\"Alice\"}]", controller.export("json"));
    }

    @Test
    @DisplayName("私有仓库不能直接获取")
    void repositoryIsPrivate() {
        assertThrows(ServiceNotFoundException.class, () -> container.get("user.repository"));
    }
}
