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
 * 实体属性值（EAV 行）
 * 同一实体同一定义可以有多个值，但相同值不能出现两次
 */
@Data
@TableName("attributes")
public class Attribute implements TypedValueColumns {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("model_id")
    private Long modelId;

    @TableField("attribute_definition_id")
    private Long attributeDefinitionId;

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
