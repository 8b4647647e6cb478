package com.lingwire.api.annotation;

import java.lang.annotation.*;

/**
 * 构造参数默认值
 * <p>
 * Java 没有参数默认值，自动装配时以此注解代替。
 * 值会被转换为参数类型；包含 %param% 占位符时原样保留，运行时再替换。
 *
 * <pre>
 * public MailTransport(@DefaultValue("25") int port,
 *                      @DefaultValue("%mailer.host%") String host) { ... }
 * </pre>
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DefaultValue {

    String value();
}
