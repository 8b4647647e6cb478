package com.lingwire.example.report;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 报表生成器注册表，由 {@link ReportGeneratorPass} 填充
 */
@Slf4j
public class ReportRegistry {

    private final Map<String, ReportGenerator> generators = new TreeMap<>();

    public void register(String format, ReportGenerator generator) {
        generators.put(format, generator);
        log.debug("Report generator registered: {}", format);
    }

    public ReportGenerator get(String format) {
        ReportGenerator generator = generators.get(format);
        if (generator == null) {
            throw new IllegalArgumentException("Unknown report format: " + format + ", available: " + formats());
        }
        return generator;
    }

    public Set<String> formats() {
        return generators.keySet();
    }
}
