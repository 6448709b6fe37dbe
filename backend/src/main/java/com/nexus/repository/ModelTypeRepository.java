package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.ModelType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ModelTypeRepository extends BaseMapper<ModelType> {

    @Select("SELECT * FROM model_types WHERE name = #{name}")
    ModelType findByName(@Param("name") String name);

    @Select("SELECT * FROM model_types WHERE type_kind = #{typeKind} ORDER BY id ASC")
    List<ModelType> findByKind(@Param("typeKind") String typeKind);

    @Select("SELECT * FROM model_types ORDER BY id ASC")
    List<ModelType> findAllOrdered();

    /**
     * 实体已分配的特征类型
     */
    @Select("SELECT mt.* FROM trait_assignments ta " +
            "JOIN model_types mt ON ta.trait_type_id = mt.id " +
            "WHERE ta.model_id = #{modelId} ORDER BY mt.id ASC")
    List<ModelType> findTraitsOfModel(@Param("modelId") Long modelId);
}
