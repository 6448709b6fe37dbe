package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.AttributeDefinition;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface AttributeDefinitionRepository extends BaseMapper<AttributeDefinition> {

    @Select("SELECT * FROM attribute_definitions WHERE model_type_id = #{typeId} AND attr_key = #{key}")
    AttributeDefinition findByTypeAndKey(@Param("typeId") Long typeId, @Param("key") String key);

    @Select("SELECT * FROM attribute_definitions WHERE model_type_id = #{typeId} ORDER BY id ASC")
    List<AttributeDefinition> findByType(@Param("typeId") Long typeId);

    /**
     * 在实体的有效类型组合（基础类型 + 已分配特征）中查找某个键的定义，
     * 基础类型优先，其次按特征类型 id 升序
     */
    @Select("SELECT ad.* FROM attribute_definitions ad JOIN models m ON m.id = #{modelId} " +
            "WHERE ad.attr_key = #{key} AND (ad.model_type_id = m.model_type_id " +
            "  OR ad.model_type_id IN (SELECT ta.trait_type_id FROM trait_assignments ta WHERE ta.model_id = #{modelId})) " +
            "ORDER BY CASE WHEN ad.model_type_id = m.model_type_id THEN 0 ELSE 1 END, ad.model_type_id ASC")
    List<AttributeDefinition> findInComposition(@Param("modelId") Long modelId, @Param("key") String key);

    /**
     * 实体有效类型组合中的全部必填定义
     */
    @Select("SELECT ad.* FROM attribute_definitions ad JOIN models m ON m.id = #{modelId} " +
            "WHERE ad.required = TRUE AND (ad.model_type_id = m.model_type_id " +
            "  OR ad.model_type_id IN (SELECT ta.trait_type_id FROM trait_assignments ta WHERE ta.model_id = #{modelId})) " +
            "ORDER BY ad.id ASC")
    List<AttributeDefinition> findRequiredInComposition(@Param("modelId") Long modelId);
}
