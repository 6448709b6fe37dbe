package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.Attribute;
import com.nexus.domain.row.AttributeRow;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface AttributeRepository extends BaseMapper<Attribute> {

    @Select("SELECT COUNT(*) FROM attributes WHERE model_id = #{modelId} " +
            "AND attribute_definition_id = #{definitionId} AND value_key = #{valueKey}")
    long countValue(@Param("modelId") Long modelId, @Param("definitionId") Long definitionId,
                    @Param("valueKey") String valueKey);

    @Delete("DELETE FROM attributes WHERE model_id = #{modelId} " +
            "AND attribute_definition_id = #{definitionId} AND value_key = #{valueKey}")
    int deleteValue(@Param("modelId") Long modelId, @Param("definitionId") Long definitionId,
                    @Param("valueKey") String valueKey);

    /**
     * 实体的全部属性值及其键，按插入顺序
     */
    @Select("SELECT a.id, a.model_id AS owner_id, a.attribute_definition_id AS definition_id, " +
            "ad.attr_key, ad.value_type, a.value_text, a.value_number, a.value_time, a.value_bool, " +
            "a.value_vector, a.value_key " +
            "FROM attributes a JOIN attribute_definitions ad ON a.attribute_definition_id = ad.id " +
            "WHERE a.model_id = #{modelId} ORDER BY a.id ASC")
    List<AttributeRow> findRowsByModel(@Param("modelId") Long modelId);

    @Select("SELECT a.id, a.model_id AS owner_id, a.attribute_definition_id AS definition_id, " +
            "ad.attr_key, ad.value_type, a.value_text, a.value_number, a.value_time, a.value_bool, " +
            "a.value_vector, a.value_key " +
            "FROM attributes a JOIN attribute_definitions ad ON a.attribute_definition_id = ad.id " +
            "WHERE a.model_id = #{modelId} AND ad.attr_key = #{key} ORDER BY a.id ASC")
    List<AttributeRow> findRowsByModelAndKey(@Param("modelId") Long modelId, @Param("key") String key);
}
