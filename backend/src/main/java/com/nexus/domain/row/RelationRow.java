package com.nexus.domain.row;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 关系 + 关系类型名称的联合查询行
 */
@Data
public class RelationRow {

    private Long id;

    private Long fromId;

    private Long toId;

    private Long relationshipTypeId;

    /**
     * 关系类型被删除后为 null
     */
    private String relationName;

    private LocalDateTime createdAt;
}
