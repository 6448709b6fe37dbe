package com.nexus.service;

import com.nexus.common.exception.GraphStoreException;
import com.nexus.dto.MaterializedModel;
import com.nexus.graph.IModelGraphSource;
import com.nexus.standardize.ResponseStandardizer;
import com.nexus.standardize.ShapeTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * 实体物化服务
 *
 * 在一个只读事务中读取实体的一跳视图（实体、类型组合、扁平属性、双向关系），
 * 并经 ResponseStandardizer 规范化后返回。
 */
@Slf4j
@Service
public class ModelMaterializerService {

    @Autowired
    private IModelGraphSource graphSource;

    @Autowired
    private ResponseStandardizer responseStandardizer;

    /**
     * 物化实体
     *
     * @param entityId 实体ID
     * @return 类型化的物化结果
     */
    @Transactional(readOnly = true)
    public MaterializedModel materialize(Long entityId) {
        return MaterializedModel.fromCanonical(materializeAsMap(entityId));
    }

    /**
     * 物化实体，返回规范化后的嵌套 Map（便于直接序列化）
     */
    @Transactional(readOnly = true)
    public Map<String, Object> materializeAsMap(Long entityId) {
        if (entityId == null) {
            throw GraphStoreException.entityNotFound(null);
        }
        Object raw = graphSource.loadModelFull(entityId);
        if (raw == null) {
            throw GraphStoreException.entityNotFound(entityId);
        }

        Map<String, Object> canonical = responseStandardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);
        if (!responseStandardizer.validate(ShapeTag.MODEL_FULL_DATA, canonical)) {
            log.warn("实体 {} 物化结果结构校验未通过 (source={})", entityId, graphSource.getSourceType());
        }
        log.debug("实体物化完成: id={}, source={}", entityId, graphSource.getSourceType());
        return canonical;
    }
}
