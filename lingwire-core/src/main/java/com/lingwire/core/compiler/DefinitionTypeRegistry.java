package com.lingwire.core.compiler;

import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.spi.TypeRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于构建器中定义的类型注册表
 * <p>
 * 扫描非抽象定义的类，按可赋值关系匹配；类不可加载的定义不参与匹配。
 * 结果不缓存，Pass 之间对定义的修改立即可见。
 */
public class DefinitionTypeRegistry implements TypeRegistry {

    private final ContainerBuilder builder;

    public DefinitionTypeRegistry(ContainerBuilder builder) {
        this.builder = builder;
    }

    @Override
    public List<String> resolveCandidatesFor(Class<?> type) {
        String typeName = type.getName();

        // 以类型名注册的服务或别名优先
        Definition exact = builder.getDefinitions().get(typeName);
        if (exact != null && !exact.isAbstract()) {
            return List.of(typeName);
        }
        if (builder.hasAlias(typeName)) {
            return List.of(typeName);
        }

        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, Definition> entry : builder.getDefinitions().entrySet()) {
            Definition definition = entry.getValue();
            if (definition.isAbstract()) {
                continue;
            }
            Optional<Class<?>> candidateType = builder.getClassResolver().find(definition.getClassName());
            if (candidateType.isPresent() && type.isAssignableFrom(candidateType.get())) {
                candidates.add(entry.getKey());
            }
        }
        return candidates.isEmpty() ? Collections.emptyList() : candidates;
    }
}
