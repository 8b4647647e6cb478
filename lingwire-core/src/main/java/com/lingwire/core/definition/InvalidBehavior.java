package com.lingwire.core.definition;

/**
 * 引用目标不存在时的处理策略
 */
public enum InvalidBehavior {

    /**
     * 编译期校验失败，运行期抛出 ServiceNotFoundException
     */
    EXCEPTION,

    /**
     * 运行期以 null 代替
     */
    NULL,

    /**
     * 运行期忽略：集合中省略该元素，方法调用整体跳过，位置参数为 null
     */
    IGNORE
}
