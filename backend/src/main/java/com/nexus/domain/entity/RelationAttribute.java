package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.nexus.domain.value.TypedValueColumns;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 关系属性值
 */
@Data
@TableName("relation_attributes")
public class RelationAttribute implements TypedValueColumns {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("relation_id")
    private Long relationId;

    @TableField("relation_attribute_definition_id")
    private Long relationAttributeDefinitionId;

    @TableField("value_text")
    private String valueText;

    @TableField("value_number")
    private BigDecimal valueNumber;

    @TableField("value_time")
    private LocalDateTime valueTime;

    @TableField("value_bool")
    private Boolean valueBool;

    @TableField("value_vector")
    private String valueVector;

    @TableField("value_key")
    private String valueKey;
}
