package com.nexus.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.repository.ModelFunctionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 存储过程物化实现：调用数据库函数 get_model_full，返回其 JSON 解析结果
 *
 * 函数返回的是不受信任的非结构化数据，调用方必须再经过规范化。
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "nexus.materializer.mode", havingValue = "stored-routine")
public class StoredRoutineModelGraphSource implements IModelGraphSource {

    @Autowired
    private ModelFunctionRepository modelFunctionRepository;

    @Autowired
    private ObjectMapper objectMapper;

    public StoredRoutineModelGraphSource() {
        log.info("使用数据库存储过程 get_model_full 物化实体");
    }

    @Override
    public Object loadModelFull(Long modelId) {
        String json = modelFunctionRepository.getModelFull(modelId);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.reader()
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .forType(Object.class)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            // 交给规范化层按非结构化输入处理
            log.error("get_model_full 返回的 JSON 无法解析: modelId={}, error={}", modelId, e.getMessage());
            return json;
        }
    }

    @Override
    public String getSourceType() {
        return "STORED_ROUTINE";
    }
}
