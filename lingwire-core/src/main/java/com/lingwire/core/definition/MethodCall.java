package com.lingwire.core.definition;

import java.util.ArrayList;
import java.util.List;

/**
 * 实例化后执行的方法调用（setter 注入）
 */
public record MethodCall(String method, List<Object> arguments) {

    public MethodCall {
        arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
    }

    MethodCall copy() {
        return new MethodCall(method, Definition.deepCopy(arguments));
    }
}
