package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

/**
 * 自动装配失败
 * <p>
 * 属于构建期配置错误（参数歧义或无法解析），在 compile() 阶段抛出，
 * 与运行期的服务缺失区分开
 */
public class AutowireException extends ContainerException {

    private final String serviceId;
    private final String parameterName;

    public AutowireException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
        this.parameterName = null;
    }

    public AutowireException(String serviceId, String parameterName, String message) {
        super(message);
        this.serviceId = serviceId;
        this.parameterName = parameterName;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getParameterName() {
        return parameterName;
    }
}
