package com.nexus.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * 向量嵌入，每个实体至多一条，内容不做解释
 */
@Data
@TableName("embeddings")
public class Embedding {

    @TableId(value = "model_id", type = IdType.INPUT)
    private Long modelId;

    @TableField(value = "embedding", updateStrategy = FieldStrategy.IGNORED)
    private String payload;
}
