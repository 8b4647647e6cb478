package com.lingwire.example;

import com.lingwire.core.compiler.PassStage;
import com.lingwire.core.container.Container;
import com.lingwire.core.kernel.Kernel;
import com.lingwire.example.config.AppServices;
import com.lingwire.example.controller.UserController;
import com.lingwire.example.report.ReportGeneratorPass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ExampleApplication {

    public static Kernel createKernel(String environment, boolean debug) {
        return new Kernel(environment, debug)
                .addParameterResource("parameters.yml")
                .addConfigurator(new AppServices())
                .addCompilerPass(new ReportGeneratorPass(), PassStage.BEFORE_OPTIMIZATION, 0);
    }

    public static void main(String[] args) {
        Kernel kernel = createKernel("dev", true);
        kernel.boot();

        Container container = kernel.getContainer();
        UserController controller = container.get("controller.users", UserController.class);

        controller.create("Alice", "alice@example.com");
        controller.create("Bob", "bob@example.com");

        log.info("Users:\n{}", controller.export("csv"));
        log.info("Users (json): {}", controller.export("json"));
    }
}
