package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 关系（有向边）from_id → to_id
 */
@Data
@TableName("relations")
public class Relation {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("from_id")
    private Long fromId;

    @TableField("to_id")
    private Long toId;

    @TableField("relationship_type_id")
    private Long relationshipTypeId;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
