package com.forex.optimizer;

/**
 * 参数空间解析失败，例如引用了不存在的特征名。整个构建失败，不返回部分结果
 */
public class ConfigurationResolutionException extends RuntimeException {

    private final String key;

    public ConfigurationResolutionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
