package com.lingwire.core.kernel;

import com.lingwire.core.compiler.PassStage;
import com.lingwire.core.container.Container;
import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.container.ContainerConfig;
import com.lingwire.core.loader.ParameterFileLoader;
import com.lingwire.core.spi.CompilerPass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 应用内核
 * <p>
 * 负责一次性装配容器：写入 kernel.* 参数，注册自身为合成服务 {@code kernel}，
 * 加载参数文件，执行注册回调，追加编译器 Pass，最后编译。
 * 容器通过 {@link #getContainer()} 显式获取，不提供静态访问入口。
 */
@Slf4j
public class Kernel {

    public static final String KERNEL_ID = "kernel";

    private final String environment;
    private final boolean debug;
    private final ContainerConfig config;

    private final List<ServiceConfigurator> configurators = new ArrayList<>();
    private final List<PendingPass> passes = new ArrayList<>();
    private final List<Path> parameterFiles = new ArrayList<>();
    private final List<String> parameterResources = new ArrayList<>();

    private volatile Container container;

    public Kernel(String environment, boolean debug) {
        this(environment, debug, ContainerConfig.defaults());
    }

    public Kernel(String environment, boolean debug, ContainerConfig config) {
        this.environment = environment;
        this.debug = debug;
        this.config = config != null ? config : ContainerConfig.defaults();
    }

    public Kernel addConfigurator(ServiceConfigurator configurator) {
        ensureNotBooted();
        configurators.add(configurator);
        return this;
    }

    public Kernel addCompilerPass(CompilerPass pass) {
        return addCompilerPass(pass, PassStage.BEFORE_OPTIMIZATION, 0);
    }

    public Kernel addCompilerPass(CompilerPass pass, PassStage stage, int priority) {
        ensureNotBooted();
        passes.add(new PendingPass(pass, stage, priority));
        return this;
    }

    public Kernel addParameterFile(Path file) {
        ensureNotBooted();
        parameterFiles.add(file);
        return this;
    }

    public Kernel addParameterResource(String resource) {
        ensureNotBooted();
        parameterResources.add(resource);
        return this;
    }

    /**
     * 启动内核
     * 重复调用直接返回
     */
    public synchronized void boot() {
        if (container != null) {
            return;
        }

        long start = System.currentTimeMillis();
        log.info("Booting kernel [env={}, debug={}]", environment, debug);

        ContainerBuilder builder = buildContainer();
        this.container = builder.compile();

        log.info("Kernel booted in {} ms, {} services", System.currentTimeMillis() - start,
                container.getServiceIds().size());
    }

    public boolean isBooted() {
        return container != null;
    }

    /**
     * @throws IllegalStateException 内核尚未启动
     */
    public Container getContainer() {
        Container current = container;
        if (current == null) {
            throw new IllegalStateException("Cannot get container before kernel is booted");
        }
        return current;
    }

    public String getEnvironment() {
        return environment;
    }

    public boolean isDebug() {
        return debug;
    }

    protected ContainerBuilder buildContainer() {
        ContainerBuilder builder = new ContainerBuilder(config);

        builder.setParameter("kernel.environment", environment);
        builder.setParameter("kernel.debug", debug);
        builder.setParameter("kernel.project_dir", System.getProperty("user.dir"));

        builder.set(KERNEL_ID, this);

        ParameterFileLoader loader = new ParameterFileLoader(builder);
        for (Path file : parameterFiles) {
            loader.load(file);
        }
        for (String resource : parameterResources) {
            loader.loadResource(resource);
        }

        for (ServiceConfigurator configurator : configurators) {
            configurator.configure(builder);
        }

        for (PendingPass pending : passes) {
            builder.addCompilerPass(pending.pass(), pending.stage(), pending.priority());
        }
        return builder;
    }

    private void ensureNotBooted() {
        if (container != null) {
            throw new IllegalStateException("Kernel is already booted");
        }
    }

    private record PendingPass(CompilerPass pass, PassStage stage, int priority) {
    }
}
