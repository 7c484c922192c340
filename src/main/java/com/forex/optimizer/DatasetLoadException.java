package com.forex.optimizer;

/**
 * 数据加载失败（无法统计或查询数据点），不重试，直接终止运行
 */
public class DatasetLoadException extends RuntimeException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
