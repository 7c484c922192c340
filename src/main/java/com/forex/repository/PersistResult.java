package com.forex.repository;

/**
 * 一次批量写入的结果
 *
 * @param requested    请求写入的文档数
 * @param inserted     实际写入的文档数
 * @param errorMessage 写入失败时的错误信息，成功时为 null
 */
public record PersistResult(int requested, int inserted, String errorMessage) {

    public static PersistResult success(int inserted) {
        return new PersistResult(inserted, inserted, null);
    }

    public static PersistResult failure(int requested, int inserted, String errorMessage) {
        return new PersistResult(requested, inserted, errorMessage);
    }

    public boolean isSuccessful() {
        return errorMessage == null;
    }
}
