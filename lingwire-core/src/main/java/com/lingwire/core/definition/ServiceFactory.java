package com.lingwire.core.definition;

import java.util.List;

/**
 * 可调用的服务工厂
 * 接收已解析的参数列表，返回服务实例
 */
@FunctionalInterface
public interface ServiceFactory {

    Object create(List<Object> arguments) throws Exception;
}
