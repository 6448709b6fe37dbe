package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.RelationAttribute;
import com.nexus.domain.row.AttributeRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface RelationAttributeRepository extends BaseMapper<RelationAttribute> {

    @Select("SELECT COUNT(*) FROM relation_attributes WHERE relation_id = #{relationId} " +
            "AND relation_attribute_definition_id = #{definitionId} AND value_key = #{valueKey}")
    long countValue(@Param("relationId") Long relationId, @Param("definitionId") Long definitionId,
                    @Param("valueKey") String valueKey);

    @Select("SELECT ra.id, ra.relation_id AS owner_id, ra.relation_attribute_definition_id AS definition_id, " +
            "rad.attr_key, rad.value_type, ra.value_text, ra.value_number, ra.value_time, ra.value_bool, " +
            "ra.value_vector, ra.value_key " +
            "FROM relation_attributes ra " +
            "JOIN relation_attribute_definitions rad ON ra.relation_attribute_definition_id = rad.id " +
            "WHERE ra.relation_id = #{relationId} ORDER BY ra.id ASC")
    List<AttributeRow> findRowsByRelation(@Param("relationId") Long relationId);
}
