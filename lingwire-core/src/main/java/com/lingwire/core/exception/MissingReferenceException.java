package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

/**
 * 引用目标不存在
 * 由 ResolveReferencesPass 针对 EXCEPTION 策略的引用抛出
 */
public class MissingReferenceException extends ContainerException {

    private final String serviceId;
    private final String missingId;

    public MissingReferenceException(String serviceId, String missingId) {
        super("Service '" + serviceId + "' has a dependency on a non-existent service '" + missingId + "'");
        this.serviceId = serviceId;
        this.missingId = missingId;
    }

    public MissingReferenceException(String serviceId, String missingId, String message) {
        super(message);
        this.serviceId = serviceId;
        this.missingId = missingId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getMissingId() {
        return missingId;
    }
}
