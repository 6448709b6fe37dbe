package com.nexus.domain.value;

import com.nexus.enums.ValueType;

/**
 * 标签联合与分列存储之间的映射（仅在存储边界使用）
 */
public final class AttributeColumns {

    private AttributeColumns() {
    }

    /**
     * 写入对应类型的值列，其余值列清空
     */
    public static <T extends TypedValueColumns> T write(AttributeValue value, T row) {
        row.setValueText(null);
        row.setValueNumber(null);
        row.setValueTime(null);
        row.setValueBool(null);
        row.setValueVector(null);
        switch (value.getType()) {
            case STRING:
                row.setValueText(value.asString());
                break;
            case NUMBER:
                row.setValueNumber(value.asNumber());
                break;
            case DATETIME:
                row.setValueTime(value.asDateTime());
                break;
            case BOOLEAN:
                row.setValueBool(value.asBoolean());
                break;
            case VECTOR:
                row.setValueVector(value.asVector());
                break;
            default:
                throw new IllegalArgumentException("不支持的值类型: " + value.getType());
        }
        row.setValueKey(value.uniquenessKey());
        return row;
    }

    /**
     * 由非空值列还原属性值；没有或有多个非空列时返回 null
     */
    public static AttributeValue read(TypedValueColumns row) {
        AttributeValue found = null;
        int populated = 0;
        if (row.getValueText() != null) {
            found = AttributeValue.ofString(row.getValueText());
            populated++;
        }
        if (row.getValueNumber() != null) {
            found = AttributeValue.ofNumber(row.getValueNumber());
            populated++;
        }
        if (row.getValueTime() != null) {
            found = AttributeValue.ofDateTime(row.getValueTime());
            populated++;
        }
        if (row.getValueBool() != null) {
            found = AttributeValue.ofBoolean(row.getValueBool());
            populated++;
        }
        if (row.getValueVector() != null) {
            found = AttributeValue.ofVector(row.getValueVector());
            populated++;
        }
        return populated == 1 ? found : null;
    }

    /**
     * 当前被填充的值类型，不合法时返回 null
     */
    public static ValueType populatedType(TypedValueColumns row) {
        AttributeValue value = read(row);
        return value == null ? null : value.getType();
    }
}
