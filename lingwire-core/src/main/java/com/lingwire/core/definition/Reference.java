package com.lingwire.core.definition;

import com.lingwire.api.exception.InvalidArgumentException;
import lombok.Value;

/**
 * 指向另一个服务的具名引用
 * 不持有目标，构造时才解析
 */
@Value
public class Reference {

    String id;
    InvalidBehavior invalidBehavior;

    public Reference(String id) {
        this(id, InvalidBehavior.EXCEPTION);
    }

    public Reference(String id, InvalidBehavior invalidBehavior) {
        if (id == null || id.isBlank()) {
            throw new InvalidArgumentException("id", "Reference id cannot be blank");
        }
        this.id = id;
        this.invalidBehavior = invalidBehavior != null ? invalidBehavior : InvalidBehavior.EXCEPTION;
    }

    /**
     * 解析 "@service.id" 简写，不是简写时返回 null
     * "@@" 开头是转义后的字面量，不视为引用
     */
    public static Reference fromShorthand(Object argument) {
        if (argument instanceof String s && s.length() > 1 && s.charAt(0) == '@' && s.charAt(1) != '@') {
            return new Reference(s.substring(1));
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
