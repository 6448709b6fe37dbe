package com.nexus.enums;

/**
 * 模型类型种类
 * 基础类型是实体的主分类，特征类型是可叠加的能力
 */
public enum TypeKind {

    /**
     * 基础类型 - 每个实体有且仅有一个
     */
    BASE("base"),

    /**
     * 特征类型 - 可额外分配给实体
     */
    TRAIT("trait");

    private final String code;

    TypeKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 根据数据库存储值解析
     */
    public static TypeKind fromCode(String code) {
        for (TypeKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的类型种类: " + code);
    }
}
