package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.nexus.enums.TypeKind;
import lombok.Data;

/**
 * 模型类型实体
 * 基础类型或特征类型，名称全局唯一
 */
@Data
@TableName("model_types")
public class ModelType {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    /**
     * 父类型（单层分类，不是多层继承）
     */
    @TableField("parent_id")
    private Long parentId;

    /**
     * base / trait
     */
    @TableField("type_kind")
    private String typeKind;

    @TableField("is_action")
    private Boolean isAction = false;

    private String description;

    public TypeKind kind() {
        return TypeKind.fromCode(typeKind);
    }

    public boolean isBase() {
        return TypeKind.BASE.getCode().equals(typeKind);
    }

    public boolean isTrait() {
        return TypeKind.TRAIT.getCode().equals(typeKind);
    }
}
