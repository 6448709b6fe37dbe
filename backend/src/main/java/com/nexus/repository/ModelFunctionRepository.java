package com.nexus.repository;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 数据库端物化函数 get_model_full（见 db/postgresql/get_model_full.sql）
 */
@Mapper
public interface ModelFunctionRepository {

    @Select("SELECT CAST(get_model_full(#{modelId}) AS TEXT)")
    String getModelFull(@Param("modelId") Long modelId);
}
