package com.nexus.common.exception;

import org.springframework.dao.DuplicateKeyException;

import java.util.function.Supplier;

/**
 * 唯一约束冲突转换
 *
 * 先查后写的校验挡不住并发写入，唯一约束是最终防线；冲突时转换为调用方指定的重复错误码。
 * 其余数据访问异常由 {@link com.nexus.config.StoreExceptionAspect} 统一转换。
 */
public final class StoreErrors {

    private StoreErrors() {
    }

    /**
     * 执行一次插入，唯一约束冲突时抛出指定的重复错误
     */
    public static <T> T insertUnique(Supplier<T> insert, ErrorCode duplicateCode, String duplicateMessage) {
        try {
            return insert.get();
        } catch (DuplicateKeyException e) {
            throw new GraphStoreException(duplicateCode, duplicateMessage, e);
        }
    }
}
