package com.lingwire.api.exception;

/**
 * 参数未找到异常
 * 包括占位符替换过程中引用了不存在的参数
 */
public class ParameterNotFoundException extends ContainerException {

    private final String parameterName;

    public ParameterNotFoundException(String parameterName) {
        super("Parameter not found: " + parameterName);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
