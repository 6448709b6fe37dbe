package com.nexus.common.exception;

/**
 * 图存储业务异常
 * 所有写路径的校验失败、查找失败和存储故障都以此异常抛出，由错误码区分
 */
public class GraphStoreException extends RuntimeException {

    private final ErrorCode code;

    public GraphStoreException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GraphStoreException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static GraphStoreException entityNotFound(Long entityId) {
        return new GraphStoreException(ErrorCode.ENTITY_NOT_FOUND, "实体不存在: id=" + entityId);
    }

    public static GraphStoreException notFound(String what) {
        return new GraphStoreException(ErrorCode.NOT_FOUND, what + " 不存在");
    }

    @Override
    public String toString() {
        return "GraphStoreException{" +
                "code=" + code +
                ", description='" + code.getDescription() + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
