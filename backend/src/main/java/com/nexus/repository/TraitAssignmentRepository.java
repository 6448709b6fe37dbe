package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.TraitAssignment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TraitAssignmentRepository extends BaseMapper<TraitAssignment> {

    @Select("SELECT COUNT(*) FROM trait_assignments WHERE model_id = #{modelId} AND trait_type_id = #{traitTypeId}")
    long countAssignment(@Param("modelId") Long modelId, @Param("traitTypeId") Long traitTypeId);
}
