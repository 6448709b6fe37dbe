package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.nexus.enums.ValueType;
import lombok.Data;

/**
 * 关系属性定义
 */
@Data
@TableName("relation_attribute_definitions")
public class RelationAttributeDefinition {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("relationship_type_id")
    private Long relationshipTypeId;

    @TableField("attr_key")
    private String attrKey;

    @TableField("value_type")
    private String valueType;

    private Boolean required = false;

    public ValueType type() {
        return ValueType.fromCode(valueType);
    }
}
