package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 特征分配：实体 X 额外拥有特征类型 T
 */
@Data
@TableName("trait_assignments")
public class TraitAssignment {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("model_id")
    private Long modelId;

    @TableField("trait_type_id")
    private Long traitTypeId;

    @TableField(value = "applied_at", fill = FieldFill.INSERT)
    private LocalDateTime appliedAt;

    public TraitAssignment() {}

    public TraitAssignment(Long modelId, Long traitTypeId) {
        this.modelId = modelId;
        this.traitTypeId = traitTypeId;
    }
}
