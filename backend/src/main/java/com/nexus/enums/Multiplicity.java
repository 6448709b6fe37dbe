package com.nexus.enums;

/**
 * 关系基数策略
 */
public enum Multiplicity {

    /**
     * 同一起点实体最多一条该类型关系
     */
    ONE("one"),

    MANY("many");

    private final String code;

    Multiplicity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Multiplicity fromCode(String code) {
        if (code == null) {
            return MANY;
        }
        for (Multiplicity m : values()) {
            if (m.code.equalsIgnoreCase(code)) {
                return m;
            }
        }
        throw new IllegalArgumentException("未知的关系基数: " + code);
    }
}
