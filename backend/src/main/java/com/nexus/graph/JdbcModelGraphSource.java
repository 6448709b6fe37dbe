package com.nexus.graph;

import com.nexus.domain.entity.Model;
import com.nexus.domain.entity.ModelType;
import com.nexus.domain.row.AttributeRow;
import com.nexus.domain.row.RelationRow;
import com.nexus.domain.value.AttributeColumns;
import com.nexus.domain.value.AttributeValue;
import com.nexus.enums.RelationDirection;
import com.nexus.repository.AttributeRepository;
import com.nexus.repository.ModelRepository;
import com.nexus.repository.ModelTypeRepository;
import com.nexus.repository.RelationAttributeRepository;
import com.nexus.repository.RelationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 进程内物化实现：通过 Mapper 逐表查询并组装嵌套结构（默认实现）
 *
 * 邻居实体只展开类型组合，不再展开其关系。
 * 多值属性扁平化时，后插入的值覆盖先插入的值。
 */
@Service
@ConditionalOnProperty(name = "nexus.materializer.mode", havingValue = "in-process", matchIfMissing = true)
public class JdbcModelGraphSource implements IModelGraphSource {

    private static final Logger logger = LoggerFactory.getLogger(JdbcModelGraphSource.class);

    @Autowired
    private ModelRepository modelRepository;

    @Autowired
    private ModelTypeRepository modelTypeRepository;

    @Autowired
    private AttributeRepository attributeRepository;

    @Autowired
    private RelationRepository relationRepository;

    @Autowired
    private RelationAttributeRepository relationAttributeRepository;

    @Override
    public Object loadModelFull(Long modelId) {
        Model model = modelRepository.selectById(modelId);
        if (model == null) {
            return null;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("model", modelBlock(model));
        result.put("attributes", flatten(attributeRepository.findRowsByModel(modelId)));

        List<Map<String, Object>> relations = new ArrayList<>();
        for (RelationRow row : relationRepository.findIncident(modelId)) {
            boolean outgoing = modelId.equals(row.getFromId());
            Long otherId = outgoing ? row.getToId() : row.getFromId();
            Model other = modelRepository.selectById(otherId);
            if (other == null) {
                // 并发删除时邻居可能已不存在
                logger.debug("关系 {} 的另一端实体 {} 不存在，已跳过", row.getId(), otherId);
                continue;
            }

            Map<String, Object> relation = new LinkedHashMap<>();
            relation.put("relation_id", row.getId());
            relation.put("relation_name", row.getRelationName());
            relation.put("direction", (outgoing ? RelationDirection.OUTGOING : RelationDirection.INCOMING).getCode());
            relation.put("other_model", modelBlock(other));
            relation.put("relation_attributes", flatten(relationAttributeRepository.findRowsByRelation(row.getId())));
            relations.add(relation);
        }
        result.put("relations", relations);

        logger.debug("实体物化完成: id={}, relations={}", modelId, relations.size());
        return result;
    }

    @Override
    public String getSourceType() {
        return "IN_PROCESS";
    }

    private Map<String, Object> modelBlock(Model model) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("id", model.getId());
        block.put("title", model.getTitle());
        block.put("body", model.getBody());
        block.put("created_at", model.getCreatedAt());
        block.put("updated_at", model.getUpdatedAt());
        block.put("model_type", typeBlock(model));
        return block;
    }

    private Map<String, Object> typeBlock(Model model) {
        Map<String, Object> block = new LinkedHashMap<>();
        ModelType base = modelTypeRepository.selectById(model.getModelTypeId());
        block.put("base_model", base == null ? null : typeRef(base));

        List<Map<String, Object>> traits = new ArrayList<>();
        for (ModelType trait : modelTypeRepository.findTraitsOfModel(model.getId())) {
            traits.add(typeRef(trait));
        }
        block.put("traits", traits);
        return block;
    }

    private static Map<String, Object> typeRef(ModelType type) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("id", type.getId());
        ref.put("name", type.getName());
        ref.put("description", type.getDescription());
        return ref;
    }

    /**
     * 行按 id 升序，后写覆盖先写
     */
    private static Map<String, Object> flatten(List<AttributeRow> rows) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (AttributeRow row : rows) {
            AttributeValue value = AttributeColumns.read(row);
            if (value == null) {
                logger.warn("属性行值列异常，已跳过: id={}, key={}", row.getId(), row.getAttrKey());
                continue;
            }
            flat.put(row.getAttrKey(), value.toPlainValue());
        }
        return flat;
    }
}
