package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

/**
 * 容器已冻结异常
 * compile() 之后对构建器的任何修改都会抛出此异常
 */
public class FrozenContainerException extends ContainerException {

    public FrozenContainerException() {
        super("Cannot modify a frozen container");
    }

    public FrozenContainerException(String message) {
        super(message);
    }
}
