package com.lingwire.core.loader;

import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 参数文件加载器
 * <p>
 * 读取 YAML 文件顶层的 {@code parameters} 映射并写入构建器。文件格式：
 * <pre>
 * parameters:
 *   db.host: localhost
 *   db.port: 5432
 *   db.url: "jdbc:postgresql://%db.host%:%db.port%/app"
 * </pre>
 * 只接受参数，不定义服务；其他顶层键一律拒绝。
 */
@Slf4j
public class ParameterFileLoader {

    private static final String PARAMETERS_KEY = "parameters";

    private final ContainerBuilder builder;

    public ParameterFileLoader(ContainerBuilder builder) {
        this.builder = builder;
    }

    /**
     * 从文件加载
     *
     * @return 加载的参数个数
     */
    public int load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidArgumentException("file", file, "Parameter file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return load(is, file.toString());
        } catch (IOException e) {
            throw new InvalidArgumentException("file", "Failed to read parameter file: " + file, e);
        }
    }

    /**
     * 从类路径资源加载
     *
     * @return 加载的参数个数
     */
    public int loadResource(String resource) {
        ClassLoader loader = builder.getConfig().getClassLoader() != null
                ? builder.getConfig().getClassLoader()
                : Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ParameterFileLoader.class.getClassLoader();
        }
        InputStream stream = loader.getResourceAsStream(resource);
        if (stream == null) {
            throw new InvalidArgumentException("resource", resource, "Parameter resource not found: " + resource);
        }
        try (InputStream is = stream) {
            return load(is, resource);
        } catch (IOException e) {
            throw new InvalidArgumentException("resource", "Failed to read parameter resource: " + resource, e);
        }
    }

    private int load(InputStream is, String source) {
        Object document;
        try {
            document = YamlUtils.createLoaderYaml().load(is);
        } catch (YAMLException e) {
            throw new InvalidArgumentException("source", "Invalid YAML in " + source + ": " + e.getMessage(), e);
        }

        if (document == null) {
            log.warn("Parameter file {} is empty", source);
            return 0;
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new InvalidArgumentException("source", source,
                    "Parameter file " + source + " must contain a top-level '" + PARAMETERS_KEY + "' map");
        }
        for (Object key : root.keySet()) {
            if (!PARAMETERS_KEY.equals(key)) {
                throw new InvalidArgumentException("source", source,
                        "Unsupported top-level key '" + key + "' in " + source + ", only '" + PARAMETERS_KEY + "' is allowed");
            }
        }

        Object parameters = root.get(PARAMETERS_KEY);
        if (parameters == null) {
            return 0;
        }
        if (!(parameters instanceof Map<?, ?> map)) {
            throw new InvalidArgumentException(PARAMETERS_KEY, parameters,
                    "'" + PARAMETERS_KEY + "' in " + source + " must be a map");
        }

        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new InvalidArgumentException(PARAMETERS_KEY, entry.getKey(),
                        "Parameter name must be a string in " + source + ": " + entry.getKey());
            }
            builder.setParameter(name, entry.getValue());
        }
        log.info("Loaded {} parameters from {}", map.size(), source);
        return map.size();
    }
}
