package com.nexus.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.nexus.domain.entity.Embedding;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface EmbeddingRepository extends BaseMapper<Embedding> {
}
