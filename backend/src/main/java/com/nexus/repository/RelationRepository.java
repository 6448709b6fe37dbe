package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.Relation;
import com.nexus.domain.row.RelationRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface RelationRepository extends BaseMapper<Relation> {

    /**
     * 以实体为任一端点的全部关系
     */
    @Select("SELECT r.id, r.from_id, r.to_id, r.relationship_type_id, rt.relation_name, r.created_at " +
            "FROM relations r LEFT JOIN relationship_types rt ON rt.id = r.relationship_type_id " +
            "WHERE r.from_id = #{modelId} OR r.to_id = #{modelId} ORDER BY r.id ASC")
    List<RelationRow> findIncident(@Param("modelId") Long modelId);

    @Select("SELECT COUNT(*) FROM relations WHERE from_id = #{fromId} AND relationship_type_id = #{relationshipTypeId}")
    long countOutgoingOfType(@Param("fromId") Long fromId, @Param("relationshipTypeId") Long relationshipTypeId);
}
