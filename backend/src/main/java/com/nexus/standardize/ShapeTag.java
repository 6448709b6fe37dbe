package com.nexus.standardize;

/**
 * 规范化结构标签
 */
public enum ShapeTag {

    /**
     * 类型组合块 {base_model, traits}
     */
    MODEL_TYPE("model_type"),

    /**
     * 实体块 {id, title, body, created_at, updated_at, model_type}
     */
    MODEL("model"),

    /**
     * 完整物化结果 {model, attributes, relations}
     */
    MODEL_FULL_DATA("model_full_data");

    private final String code;

    ShapeTag(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ShapeTag fromCode(String code) {
        for (ShapeTag tag : values()) {
            if (tag.code.equalsIgnoreCase(code)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("未知的结构标签: " + code);
    }
}
