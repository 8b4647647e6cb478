package com.lingwire.api.annotation;

import java.lang.annotation.*;

/**
 * 标记构造参数可为空
 * 自动装配找不到候选服务时注入 null，而不是报错
 */
@Target({ElementType.PARAMETER, ElementType.FIELD, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Nullable {
}
