package com.lingwire.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * YAML 工具类
 * 参数文件只需要标量、列表和映射，统一使用 SafeConstructor 加载。
 */
public final class YamlUtils {

    // 参数文件的合理上限，防止别名膨胀
    private static final int MAX_ALIASES = 50;

    private YamlUtils() {
    }

    /**
     * 创建仅用于加载的安全 Yaml 实例
     * <p>
     * 拒绝所有 !! 全局标签，重复键直接报错而不是静默覆盖。
     * Yaml 实例不是线程安全的，每次加载都应新建。
     */
    public static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        loaderOptions.setTagInspector(tag -> false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
