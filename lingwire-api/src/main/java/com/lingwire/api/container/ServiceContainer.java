package com.lingwire.api.container;

import com.lingwire.api.exception.ParameterNotFoundException;
import com.lingwire.api.exception.ServiceNotFoundException;

/**
 * 服务容器契约
 * 外部组件（路由、控制器、命令等）只通过此接口获取服务
 */
public interface ServiceContainer {

    /**
     * 容器自身的服务 ID
     */
    String SERVICE_CONTAINER_ID = "service_container";

    /**
     * 获取服务实例
     *
     * @param id 服务 ID 或别名
     * @return 服务实例，共享服务每次返回同一实例
     * @throws ServiceNotFoundException 服务不存在
     */
    Object get(String id);

    /**
     * 获取服务实例并转换为指定类型
     */
    default <T> T get(String id, Class<T> type) {
        return type.cast(get(id));
    }

    /**
     * 服务或别名是否存在（不会触发实例化）
     */
    boolean has(String id);

    /**
     * 获取已解析的参数值
     *
     * @throws ParameterNotFoundException 参数不存在
     */
    Object getParameter(String name);

    boolean hasParameter(String name);
}
