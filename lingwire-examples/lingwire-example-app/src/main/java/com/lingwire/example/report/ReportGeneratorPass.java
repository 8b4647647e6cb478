package com.lingwire.example.report;

import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.definition.Definition;
import com.lingwire.core.definition.Reference;
import com.lingwire.core.spi.CompilerPass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * 把带 {@code report.generator} 标签的服务注册到 {@code report.registry}
 */
@Slf4j
public class ReportGeneratorPass implements CompilerPass {

    public static final String TAG = "report.generator";
    public static final String REGISTRY_ID = "report.registry";

    @Override
    public void process(ContainerBuilder builder) {
        if (!builder.hasDefinition(REGISTRY_ID)) {
            return;
        }
        Definition registry = builder.getDefinition(REGISTRY_ID);

        for (Map.Entry<String, List<Map<String, Object>>> entry : builder.findTaggedServiceIds(TAG).entrySet()) {
            for (Map<String, Object> attributes : entry.getValue()) {
                Object format = attributes.get("format");
                if (format == null) {
                    throw new IllegalStateException("Service '" + entry.getKey() + "' is tagged " + TAG
                            + " without a 'format' attribute");
                }
                registry.addMethodCall("register", format, new Reference(entry.getKey()));
            }
        }
    }
}
