package com.lingwire.core.definition;

import com.lingwire.api.exception.InvalidArgumentException;

/**
 * 工厂配置
 * <p>
 * 三种形态：
 * <ul>
 *   <li>{@link ServiceFactory} 回调</li>
 *   <li>[服务引用, 方法名]：调用另一个服务的实例方法</li>
 *   <li>[类名, 方法名]：调用静态方法；若类名本身是已注册的服务 ID，则改为调用该服务</li>
 * </ul>
 */
public final class Factory {

    private final ServiceFactory callable;
    private final Reference service;
    private final String className;
    private final String method;

    private Factory(ServiceFactory callable, Reference service, String className, String method) {
        this.callable = callable;
        this.service = service;
        this.className = className;
        this.method = method;
    }

    public static Factory of(ServiceFactory callable) {
        if (callable == null) {
            throw new InvalidArgumentException("callable", "Factory callable cannot be null");
        }
        return new Factory(callable, null, null, null);
    }

    public static Factory ofService(Reference service, String method) {
        if (service == null) {
            throw new InvalidArgumentException("service", "Factory service reference cannot be null");
        }
        return new Factory(null, service, null, requireMethod(method));
    }

    public static Factory ofService(String serviceId, String method) {
        return ofService(new Reference(serviceId), method);
    }

    public static Factory ofStatic(Class<?> type, String method) {
        return ofStatic(type.getName(), method);
    }

    public static Factory ofStatic(String className, String method) {
        if (className == null || className.isBlank()) {
            throw new InvalidArgumentException("className", "Factory class cannot be blank");
        }
        return new Factory(null, null, className, requireMethod(method));
    }

    private static String requireMethod(String method) {
        if (method == null || method.isBlank()) {
            throw new InvalidArgumentException("method", "Factory method cannot be blank");
        }
        return method;
    }

    public boolean isCallable() {
        return callable != null;
    }

    public boolean isServiceMethod() {
        return service != null;
    }

    public boolean isStaticMethod() {
        return className != null;
    }

    public ServiceFactory getCallable() {
        return callable;
    }

    public Reference getService() {
        return service;
    }

    public String getClassName() {
        return className;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public String toString() {
        if (callable != null) {
            return "Factory{callable}";
        }
        return String.format("Factory{%s::%s}", service != null ? "@" + service.getId() : className, method);
    }
}
