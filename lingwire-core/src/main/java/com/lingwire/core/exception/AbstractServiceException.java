package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

/**
 * 尝试实例化抽象定义
 */
public class AbstractServiceException extends ContainerException {

    private final String serviceId;

    public AbstractServiceException(String serviceId) {
        super("Service is abstract and cannot be instantiated: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
