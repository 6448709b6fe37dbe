package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.nexus.enums.Multiplicity;
import lombok.Data;

/**
 * 关系类型：从某基础类型指向另一基础类型的有向边定义
 */
@Data
@TableName("relationship_types")
public class RelationshipType {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("from_model_type_id")
    private Long fromModelTypeId;

    @TableField("to_model_type_id")
    private Long toModelTypeId;

    @TableField("relation_name")
    private String relationName;

    private String multiplicity = Multiplicity.MANY.getCode();

    private String description;

    public Multiplicity policy() {
        return Multiplicity.fromCode(multiplicity);
    }
}
