package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.RelationAttributeDefinition;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface RelationAttributeDefinitionRepository extends BaseMapper<RelationAttributeDefinition> {

    @Select("SELECT * FROM relation_attribute_definitions " +
            "WHERE relationship_type_id = #{relationshipTypeId} AND attr_key = #{key}")
    RelationAttributeDefinition findByTypeAndKey(@Param("relationshipTypeId") Long relationshipTypeId,
                                                 @Param("key") String key);

    @Select("SELECT * FROM relation_attribute_definitions WHERE relationship_type_id = #{relationshipTypeId} ORDER BY id ASC")
    List<RelationAttributeDefinition> findByType(@Param("relationshipTypeId") Long relationshipTypeId);
}
