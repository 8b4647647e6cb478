package com.lingwire.core.reflect;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 类名解析
 * 优先使用配置的类加载器，否则使用线程上下文类加载器
 */
@Slf4j
public class ClassResolver {

    private final ClassLoader classLoader;

    private final Map<String, Optional<Class<?>>> cache = new ConcurrentHashMap<>();

    public ClassResolver(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public Optional<Class<?>> find(String className) {
        if (className == null || className.isBlank()) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(className, this::load);
    }

    private Optional<Class<?>> load(String className) {
        ClassLoader loader = classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ClassResolver.class.getClassLoader();
        }
        try {
            return Optional.of(Class.forName(className, false, loader));
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("Class not loadable: {} ({})", className, e.getMessage());
            return Optional.empty();
        }
    }
}
