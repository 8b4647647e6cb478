package com.lingwire.core.spi;

import java.util.List;

/**
 * 类型注册表 SPI
 * 自动装配通过它按类型查找候选服务，与具体的反射实现解耦
 */
public interface TypeRegistry {

    /**
     * 查找可注入到指定类型的服务 ID
     * <p>
     * 以类型全限定名注册的服务（或别名）优先，此时只返回这一个；
     * 否则返回所有类等于、实现或继承该类型的服务，按注册顺序。
     *
     * @param type 声明类型
     * @return 候选服务 ID，没有候选时返回空列表
     */
    List<String> resolveCandidatesFor(Class<?> type);
}
