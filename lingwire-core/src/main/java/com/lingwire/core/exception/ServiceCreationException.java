package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

/**
 * 服务创建异常
 * 构造器、工厂方法或 setter 调用失败，或找不到匹配的签名
 */
public class ServiceCreationException extends ContainerException {

    private final String serviceId;

    public ServiceCreationException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public ServiceCreationException(String serviceId, String message, Throwable cause) {
        super(message, cause);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
