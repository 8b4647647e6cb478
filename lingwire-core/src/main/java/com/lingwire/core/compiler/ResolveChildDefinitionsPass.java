package com.lingwire.core.compiler;

import com.lingwire.api.exception.ServiceNotFoundException;
import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.MethodCall;
import com.lingwire.core.exception.CircularDependencyException;
import com.lingwire.core.spi.CompilerPass;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 父定义合并 Pass
 * <p>
 * 把 parent 链上的配置合并进子定义（父在前，子覆盖）：
 * 类与工厂仅在子定义缺省时继承；构造参数按位置合并，子定义优先；
 * 方法调用和标签父在前；autowired / lazy 取或。
 * public、abstract、shared、synthetic 不继承。合并完成后清除 parent。
 */
@Slf4j
public class ResolveChildDefinitionsPass implements CompilerPass {

    @Override
    public void process(ContainerBuilder builder) {
        Set<String> merged = new HashSet<>();
        for (String id : builder.getDefinitions().keySet()) {
            resolve(builder, id, new LinkedHashSet<>(), merged);
        }
        if (!merged.isEmpty()) {
            log.debug("Merged parent definitions into {} services", merged.size());
        }
    }

    private Definition resolve(ContainerBuilder builder, String id, LinkedHashSet<String> chain, Set<String> merged) {
        Definition definition = builder.getDefinitions().get(id);
        String parentId = definition.getParent();
        if (parentId == null) {
            return definition;
        }

        if (!chain.add(id)) {
            List<String> visited = new ArrayList<>(chain);
            List<String> path = new ArrayList<>(visited.subList(visited.indexOf(id), visited.size()));
            path.add(id);
            throw CircularDependencyException.forParents(path);
        }
        if (!builder.hasDefinition(parentId)) {
            throw new ServiceNotFoundException(parentId,
                    "Service '" + id + "' extends non-existent parent definition '" + parentId + "'");
        }

        Definition parent = resolve(builder, parentId, chain, merged);
        merge(parent.copy(), definition);
        definition.setParent(null);
        chain.remove(id);
        merged.add(id);
        log.debug("Definition '{}' inherits from '{}'", id, parentId);
        return definition;
    }

    private void merge(Definition parent, Definition child) {
        if (child.getClassName() == null) {
            child.setClassName(parent.getClassName());
        }
        if (child.getFactory() == null) {
            child.setFactory(parent.getFactory());
        }

        for (Integer index : parent.getArgumentIndexes()) {
            if (!child.hasArgument(index)) {
                child.setArgument(index, parent.getArgument(index));
            }
        }

        List<MethodCall> calls = new ArrayList<>(parent.getMethodCalls());
        calls.addAll(child.getMethodCalls());
        child.setMethodCalls(calls);

        Map<String, List<Map<String, Object>>> childTags = new LinkedHashMap<>(child.getTags());
        for (String name : childTags.keySet()) {
            child.clearTag(name);
        }
        parent.getTags().forEach((name, list) -> list.forEach(attributes -> child.addTag(name, attributes)));
        childTags.forEach((name, list) -> list.forEach(attributes -> child.addTag(name, attributes)));

        child.setAutowired(child.isAutowired() || parent.isAutowired());
        child.setLazy(child.isLazy() || parent.isLazy());
    }
}
