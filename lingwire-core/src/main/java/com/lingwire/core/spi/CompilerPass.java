package com.lingwire.core.spi;

import com.lingwire.core.container.ContainerBuilder;

/**
 * 编译器 Pass SPI
 * <p>
 * 在 {@link ContainerBuilder#compile()} 中执行一次，可以校验或改写定义。
 * 抛出的异常会中止整个编译，构建器保持未冻结状态。
 */
@FunctionalInterface
public interface CompilerPass {

    void process(ContainerBuilder builder);
}
