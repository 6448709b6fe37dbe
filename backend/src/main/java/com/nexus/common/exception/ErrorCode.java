package com.nexus.common.exception;

/**
 * 图存储错误码
 */
public enum ErrorCode {

    DUPLICATE_NAME("名称已存在"),
    DUPLICATE_KEY("属性键已存在"),
    DUPLICATE_TRAIT_ASSIGNMENT("特征已分配"),
    DUPLICATE_VALUE("属性值已存在"),
    UNKNOWN_TYPE("类型不存在"),
    UNKNOWN_ATTRIBUTE_KEY("属性键未定义"),
    INVALID_BASE_TYPE("不是基础类型"),
    INVALID_TRAIT_TYPE("不是特征类型"),
    TYPE_MISMATCH("属性值类型不匹配"),
    CONSTRAINT_VIOLATION("属性值违反约束"),
    ENDPOINT_TYPE_MISMATCH("关系端点类型不匹配"),
    MULTIPLICITY_EXCEEDED("关系数量超出基数限制"),
    ENTITY_NOT_FOUND("实体不存在"),
    NOT_FOUND("记录不存在"),
    STORE_UNAVAILABLE("存储不可用");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
