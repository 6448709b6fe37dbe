package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 模型（实体）
 * 所属类型必须是基础类型，特征通过 trait_assignments 叠加
 */
@Data
@TableName("models")
public class Model {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("model_type_id")
    private Long modelTypeId;

    private String title;

    private String body;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT)
    private LocalDateTime updatedAt;
}
