package com.lingwire.core.exception;

import com.lingwire.api.exception.ContainerException;

import java.util.List;

/**
 * 循环依赖异常
 * <p>
 * 构造链、别名链、父定义链或参数引用链出现重入时抛出，携带完整环路径（如 {@code A -> B -> A}）
 */
public class CircularDependencyException extends ContainerException {

    private final List<String> path;

    public CircularDependencyException(List<String> path) {
        this("Circular dependency detected", path);
    }

    public CircularDependencyException(String prefix, List<String> path) {
        super(prefix + ": " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public static CircularDependencyException forAliases(List<String> path) {
        return new CircularDependencyException("Circular alias reference detected", path);
    }

    public static CircularDependencyException forParents(List<String> path) {
        return new CircularDependencyException("Circular parent definition detected", path);
    }

    public static CircularDependencyException forParameters(List<String> path) {
        return new CircularDependencyException("Circular parameter reference detected", path);
    }

    public List<String> getPath() {
        return path;
    }
}
