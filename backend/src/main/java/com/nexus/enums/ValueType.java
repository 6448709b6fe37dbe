package com.nexus.enums;

/**
 * EAV 属性值类型
 * 每种类型对应属性表中的一个值列，非空的那一列即类型标识
 */
public enum ValueType {

    STRING("string"),

    NUMBER("number"),

    DATETIME("datetime"),

    BOOLEAN("boolean"),

    /**
     * 向量以不透明文本保存，核心不做解释
     */
    VECTOR("vector");

    private final String code;

    ValueType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ValueType fromCode(String code) {
        for (ValueType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的属性值类型: " + code);
    }
}
