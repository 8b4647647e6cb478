package com.lingwire.core.compiler;

/**
 * Pass 执行阶段，按声明顺序执行
 */
public enum PassStage {
    BEFORE_OPTIMIZATION,
    OPTIMIZE,
    BEFORE_REMOVING,
    REMOVE,
    AFTER_REMOVING
}
