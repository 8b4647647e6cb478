package com.lingwire.core.container;

import lombok.Builder;
import lombok.Getter;

/**
 * 容器配置
 */
@Getter
@Builder
public class ContainerConfig {

    /**
     * 是否注册默认 Pass（父定义合并、自动装配、引用校验）
     */
    @Builder.Default
    private boolean registerDefaultPasses = true;

    /**
     * 编译完成后是否立即实例化公共、共享、非延迟的服务
     * 实例化失败会中止编译
     */
    @Builder.Default
    private boolean eagerInit = false;

    /**
     * 别名链最大跳数
     */
    @Builder.Default
    private int maxAliasDepth = 32;

    /**
     * 编译后的容器是否允许直接 get() 私有服务
     */
    @Builder.Default
    private boolean exposePrivateServices = false;

    /**
     * 加载服务类使用的类加载器，为空时使用线程上下文类加载器
     */
    private ClassLoader classLoader;

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static ContainerConfig defaults() {
        return ContainerConfig.builder().build();
    }

    /**
     * 启动即实例化（尽早暴露构造错误）
     */
    public static ContainerConfig eager() {
        return ContainerConfig.builder()
                .eagerInit(true)
                .build();
    }

    /**
     * 开发模式配置（更宽松）
     */
    public static ContainerConfig development() {
        return ContainerConfig.builder()
                .eagerInit(true)
                .exposePrivateServices(true)  // 方便调试时直接取私有服务
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "ContainerConfig{defaultPasses=%s, eager=%s, maxAliasDepth=%d, exposePrivate=%s}",
                registerDefaultPasses, eagerInit, maxAliasDepth, exposePrivateServices
        );
    }
}
