package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.nexus.enums.ValueType;
import lombok.Data;

/**
 * 属性定义（EAV 的 schema），作用域为一个模型类型
 */
@Data
@TableName("attribute_definitions")
public class AttributeDefinition {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("model_type_id")
    private Long modelTypeId;

    @TableField("attr_key")
    private String attrKey;

    @TableField("value_type")
    private String valueType;

    private Boolean required = false;

    /**
     * 结构约束（JSON 文本），如 min/max/maxLength/pattern/enum
     */
    private String constraints;

    public ValueType type() {
        return ValueType.fromCode(valueType);
    }
}
