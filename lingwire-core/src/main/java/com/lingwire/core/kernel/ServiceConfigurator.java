package com.lingwire.core.kernel;

import com.lingwire.core.container.ContainerBuilder;

/**
 * 服务注册回调
 * 在 {@link Kernel#boot()} 编译前执行，用于注册定义、别名和参数
 */
@FunctionalInterface
public interface ServiceConfigurator {

    void configure(ContainerBuilder builder);
}
