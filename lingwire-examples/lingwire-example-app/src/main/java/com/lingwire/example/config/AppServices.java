package com.lingwire.example.config;

import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.kernel.ServiceConfigurator;
import com.lingwire.example.controller.UserController;
import com.lingwire.example.mail.MailerFactory;
import com.lingwire.example.mail.SmtpMailer;
import com.lingwire.example.report.CsvReportGenerator;
import com.lingwire.example.report.JsonReportGenerator;
import com.lingwire.example.report.ReportRegistry;
import com.lingwire.example.repository.UserRepository;
import com.lingwire.example.service.UserService;

import java.util.Map;

/**
 * 示例应用的服务注册
 */
public class AppServices implements ServiceConfigurator {

    @Override
    public void configure(ContainerBuilder builder) {
        builder.register("user.repository", UserRepository.class).setPublic(false);

        builder.register("mailer.factory", MailerFactory.class)
                .addArgument("%mailer.host%")
                .setPublic(false);
        builder.register("mailer", SmtpMailer.class)
                .setFactory(new Reference("mailer.factory"), "create")
                .addArgument("%mailer.port%");

        builder.register("user.service", UserService.class)
                .setAutowired(true)
                .addMethodCall("setWelcomeSubject", "Welcome to %app.name%");

        builder.register("report.csv", CsvReportGenerator.class)
                .addTag("report.generator", Map.of("format", "csv"));
        builder.register("report.json", JsonReportGenerator.class)
                .addTag("report.generator", Map.of("format", "json"));
        builder.register("report.registry", ReportRegistry.class);

        builder.register("user.controller", UserController.class).setAutowired(true);
        builder.setAlias("controller.users", "user.controller");
    }
}
