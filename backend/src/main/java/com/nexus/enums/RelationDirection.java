package com.nexus.enums;

/**
 * 关系方向（相对于被物化的实体）
 */
public enum RelationDirection {

    OUTGOING("outgoing"),

    INCOMING("incoming");

    private final String code;

    RelationDirection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static boolean isValid(Object code) {
        for (RelationDirection d : values()) {
            if (d.code.equals(code)) {
                return true;
            }
        }
        return false;
    }
}
