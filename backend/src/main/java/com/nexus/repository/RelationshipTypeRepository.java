package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.RelationshipType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface RelationshipTypeRepository extends BaseMapper<RelationshipType> {

    @Select("SELECT * FROM relationship_types WHERE from_model_type_id = #{fromTypeId} " +
            "AND to_model_type_id = #{toTypeId} AND relation_name = #{name}")
    RelationshipType findByEndpointsAndName(@Param("fromTypeId") Long fromTypeId,
                                            @Param("toTypeId") Long toTypeId,
                                            @Param("name") String name);

    @Select("SELECT * FROM relationship_types WHERE relation_name = #{name} ORDER BY id ASC")
    List<RelationshipType> findByName(@Param("name") String name);
}
