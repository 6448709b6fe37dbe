package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.Model;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface ModelRepository extends BaseMapper<Model> {

    @Select("SELECT * FROM models ORDER BY id ASC")
    List<Model> findAllOrdered();

    @Select("SELECT m.* FROM models m JOIN model_types mt ON m.model_type_id = mt.id " +
            "WHERE mt.name = #{typeName} ORDER BY m.id ASC")
    List<Model> findByTypeName(@Param("typeName") String typeName);

    /**
     * 更新标题/正文，null 表示保持原值
     */
    @Update("UPDATE models SET title = COALESCE(#{title}, title), body = COALESCE(#{body}, body), " +
            "updated_at = #{now} WHERE id = #{id}")
    int updateContent(@Param("id") Long id, @Param("title") String title,
                      @Param("body") String body, @Param("now") LocalDateTime now);

    /**
     * 读取并锁定实体行，直到当前事务结束
     */
    @Select("SELECT * FROM models WHERE id = #{id} FOR UPDATE")
    Model lockById(@Param("id") Long id);

    /**
     * 刷新更新时间（属性变更时调用）
     */
    @Update("UPDATE models SET updated_at = #{now} WHERE id = #{id}")
    int touch(@Param("id") Long id, @Param("now") LocalDateTime now);
}
