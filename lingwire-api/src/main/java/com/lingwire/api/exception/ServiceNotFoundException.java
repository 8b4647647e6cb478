package com.lingwire.api.exception;

/**
 * 服务未找到异常
 */
public class ServiceNotFoundException extends ContainerException {

    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        super("Service not found: " + serviceId);
        this.serviceId = serviceId;
    }

    public ServiceNotFoundException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
