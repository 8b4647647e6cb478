package com.lingwire.api.exception;

/**
 * 容器异常基类
 * <p>
 * 所有容器相关异常均为非受检异常，由调用方决定是否捕获
 */
public class ContainerException extends RuntimeException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
