package com.lingwire.core.compiler;

import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.Factory;
import com.lingwire.core.definition.InvalidBehavior;
import com.lingwire.core.definition.MethodCall;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.exception.CircularDependencyException;
import com.lingwire.core.exception.MissingReferenceException;
import com.lingwire.core.spi.CompilerPass;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 引用校验 Pass
 * <p>
 * 只读校验，不修改任何定义：
 * <ul>
 *   <li>非抽象定义的构造参数、方法调用参数、工厂服务中的 EXCEPTION 引用必须指向已注册的服务或别名</li>
 *   <li>每条别名链最终落在一个定义上且不成环</li>
 * </ul>
 * NULL / IGNORE 引用留给运行期处理。
 */
@Slf4j
public class ResolveReferencesPass implements CompilerPass {

    @Override
    public void process(ContainerBuilder builder) {
        validateAliases(builder);

        int checked = 0;
        for (Map.Entry<String, Definition> entry : builder.getDefinitions().entrySet()) {
            Definition definition = entry.getValue();
            if (definition.isAbstract()) {
                continue;
            }
            String id = entry.getKey();

            validateArguments(builder, id, definition.getArguments());
            for (MethodCall call : definition.getMethodCalls()) {
                validateArguments(builder, id, call.arguments());
            }
            Factory factory = definition.getFactory();
            if (factory != null && factory.isServiceMethod()) {
                validateReference(builder, id, factory.getService());
            }
            checked++;
        }

        log.debug("Validated references of {} definitions", checked);
    }

    private void validateArguments(ContainerBuilder builder, String id, Collection<?> arguments) {
        for (Object argument : arguments) {
            validateArgument(builder, id, argument);
        }
    }

    private void validateArgument(ContainerBuilder builder, String id, Object argument) {
        if (argument instanceof Reference reference) {
            validateReference(builder, id, reference);
        } else if (argument instanceof String) {
            Reference shorthand = Reference.fromShorthand(argument);
            if (shorthand != null) {
                validateReference(builder, id, shorthand);
            }
        } else if (argument instanceof Collection<?> nested) {
            validateArguments(builder, id, nested);
        } else if (argument instanceof Map<?, ?> map) {
            validateArguments(builder, id, map.values());
        }
    }

    private void validateReference(ContainerBuilder builder, String id, Reference reference) {
        if (reference.getInvalidBehavior() != InvalidBehavior.EXCEPTION) {
            return;
        }
        if (!builder.has(reference.getId())) {
            throw new MissingReferenceException(id, reference.getId());
        }
    }

    private void validateAliases(ContainerBuilder builder) {
        Map<String, String> aliases = builder.getAliases();
        for (String alias : aliases.keySet()) {
            LinkedHashSet<String> visited = new LinkedHashSet<>();
            visited.add(alias);
            String current = aliases.get(alias);
            while (aliases.containsKey(current)) {
                if (!visited.add(current)) {
                    List<String> path = new ArrayList<>(visited);
                    path.add(current);
                    throw CircularDependencyException.forAliases(path);
                }
                current = aliases.get(current);
            }
            if (!builder.hasDefinition(current)) {
                throw new MissingReferenceException(alias, current,
                        "Alias '" + alias + "' points to non-existent service '" + current + "'");
            }
        }
    }
}
