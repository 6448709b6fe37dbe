package com.nexus.service;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.common.exception.StoreErrors;
import com.nexus.domain.entity.Attribute;
import com.nexus.domain.entity.AttributeDefinition;
import com.nexus.domain.entity.Embedding;
import com.nexus.domain.entity.Model;
import com.nexus.domain.entity.ModelType;
import com.nexus.domain.entity.TraitAssignment;
import com.nexus.domain.row.AttributeRow;
import com.nexus.domain.value.AttributeColumns;
import com.nexus.domain.value.AttributeValue;
import com.nexus.repository.AttributeDefinitionRepository;
import com.nexus.repository.AttributeRepository;
import com.nexus.repository.EmbeddingRepository;
import com.nexus.repository.ModelRepository;
import com.nexus.repository.ModelTypeRepository;
import com.nexus.repository.TraitAssignmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 实体存储服务
 *
 * 负责实体、特征分配、EAV 属性值与向量嵌入。每个写操作在单个事务中完成，
 * 校验失败抛出 {@link GraphStoreException} 并回滚。
 */
@Service
@Slf4j
public class EntityStoreService {

    @Autowired
    private ModelRepository modelRepository;

    @Autowired
    private ModelTypeRepository modelTypeRepository;

    @Autowired
    private TraitAssignmentRepository traitAssignmentRepository;

    @Autowired
    private AttributeDefinitionRepository attributeDefinitionRepository;

    @Autowired
    private AttributeRepository attributeRepository;

    @Autowired
    private EmbeddingRepository embeddingRepository;

    @Autowired
    private AttributeValueChecker attributeValueChecker;

    /**
     * 创建实体
     *
     * @param baseTypeId 基础类型ID（不能是特征类型）
     * @param title 标题
     * @param body 正文，可为空
     * @return 实体ID
     */
    @Transactional
    public Long createEntity(Long baseTypeId, String title, String body) {
        if (StringUtils.isBlank(title)) {
            throw new IllegalArgumentException("实体标题不能为空");
        }
        ModelType type = modelTypeRepository.selectById(baseTypeId);
        if (type == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "类型不存在: id=" + baseTypeId);
        }
        if (!type.isBase()) {
            throw new GraphStoreException(ErrorCode.INVALID_BASE_TYPE,
                    "实体的所属类型必须是基础类型: " + type.getName() + " 是 " + type.getTypeKind());
        }

        Model model = new Model();
        model.setModelTypeId(baseTypeId);
        model.setTitle(title);
        model.setBody(body);
        modelRepository.insert(model);

        log.info("实体创建成功: {} [{}] (id={})", title, type.getName(), model.getId());
        return model.getId();
    }

    /**
     * 更新标题/正文，null 保持原值
     */
    @Transactional
    public Model updateEntity(Long entityId, String title, String body) {
        requireEntity(entityId);
        modelRepository.updateContent(entityId, title, body, LocalDateTime.now());
        log.info("实体已更新: id={}", entityId);
        return modelRepository.selectById(entityId);
    }

    public Model getEntity(Long entityId) {
        return requireEntity(entityId);
    }

    public List<Model> listEntities() {
        return modelRepository.findAllOrdered();
    }

    public List<Model> listEntitiesByType(String typeName) {
        return modelRepository.findByTypeName(typeName);
    }

    /**
     * 删除实体，特征分配、属性、嵌入及两个方向的关系由外键级联删除
     */
    @Transactional
    public void deleteEntity(Long entityId) {
        Model model = requireEntity(entityId);
        int deleted = modelRepository.deleteById(entityId);
        if (deleted == 0) {
            throw GraphStoreException.entityNotFound(entityId);
        }
        log.info("实体已删除: {} (id={})", model.getTitle(), entityId);
    }

    /**
     * 为实体分配特征类型，重复分配报错
     */
    @Transactional
    public void assignTrait(Long entityId, Long traitTypeId) {
        Model model = requireEntity(entityId);
        ModelType trait = modelTypeRepository.selectById(traitTypeId);
        if (trait == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "类型不存在: id=" + traitTypeId);
        }
        if (!trait.isTrait()) {
            throw new GraphStoreException(ErrorCode.INVALID_TRAIT_TYPE,
                    "只能分配特征类型: " + trait.getName() + " 是 " + trait.getTypeKind());
        }
        String duplicateMessage = "实体 " + model.getTitle() + " 已拥有特征 " + trait.getName();
        if (traitAssignmentRepository.countAssignment(entityId, traitTypeId) > 0) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_TRAIT_ASSIGNMENT, duplicateMessage);
        }

        TraitAssignment assignment = new TraitAssignment(entityId, traitTypeId);
        StoreErrors.insertUnique(() -> traitAssignmentRepository.insert(assignment),
                ErrorCode.DUPLICATE_TRAIT_ASSIGNMENT, duplicateMessage);
        log.info("特征已分配: {} + {}", model.getTitle(), trait.getName());
    }

    /**
     * 设置属性值（多值追加，不覆盖同键已有值）
     *
     * 键在实体的有效类型组合中解析；同一键在多个类型上定义时，基础类型优先，
     * 其次按特征类型 id 升序。
     */
    @Transactional
    public Long setAttribute(Long entityId, String key, AttributeValue value) {
        requireEntity(entityId);
        AttributeDefinition definition = resolveDefinition(entityId, key);
        attributeValueChecker.check(key, definition.getValueType(), definition.getConstraints(), value);

        String duplicateMessage = "实体 " + entityId + " 的属性 " + key + " 已有值 " + value;
        if (attributeRepository.countValue(entityId, definition.getId(), value.uniquenessKey()) > 0) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_VALUE, duplicateMessage);
        }

        Attribute attribute = new Attribute();
        attribute.setModelId(entityId);
        attribute.setAttributeDefinitionId(definition.getId());
        AttributeColumns.write(value, attribute);
        StoreErrors.insertUnique(() -> attributeRepository.insert(attribute),
                ErrorCode.DUPLICATE_VALUE, duplicateMessage);
        modelRepository.touch(entityId, LocalDateTime.now());

        log.info("属性已写入: model={}, {}={}", entityId, key, value);
        return attribute.getId();
    }

    /**
     * 便捷重载：由普通 Java 值推断属性值类型
     */
    @Transactional
    public Long setAttribute(Long entityId, String key, Object rawValue) {
        return setAttribute(entityId, key, AttributeValue.of(rawValue));
    }

    /**
     * 删除某个键下的一个值
     */
    @Transactional
    public void removeAttributeValue(Long entityId, String key, AttributeValue value) {
        requireEntity(entityId);
        AttributeDefinition definition = resolveDefinition(entityId, key);
        int deleted = attributeRepository.deleteValue(entityId, definition.getId(), value.uniquenessKey());
        if (deleted == 0) {
            throw GraphStoreException.notFound("实体 " + entityId + " 的属性值 " + key + "=" + value);
        }
        modelRepository.touch(entityId, LocalDateTime.now());
        log.info("属性值已删除: model={}, {}={}", entityId, key, value);
    }

    /**
     * 某个键的全部已存值，按插入先后排列
     */
    public List<AttributeValue> getAttributeValues(Long entityId, String key) {
        requireEntity(entityId);
        List<AttributeValue> values = new ArrayList<>();
        for (AttributeRow row : attributeRepository.findRowsByModelAndKey(entityId, key)) {
            AttributeValue value = AttributeColumns.read(row);
            if (value != null) {
                values.add(value);
            } else {
                log.warn("属性行值列异常，已跳过: attributeId={}", row.getId());
            }
        }
        return values;
    }

    /**
     * 有效类型组合中标记为必填但尚无值的属性键（仅报告，不阻塞写入）
     */
    public List<String> findMissingRequiredAttributes(Long entityId) {
        requireEntity(entityId);
        Set<Long> populated = new HashSet<>();
        for (AttributeRow row : attributeRepository.findRowsByModel(entityId)) {
            populated.add(row.getDefinitionId());
        }
        List<String> missing = new ArrayList<>();
        for (AttributeDefinition definition : attributeDefinitionRepository.findRequiredInComposition(entityId)) {
            if (!populated.contains(definition.getId())) {
                missing.add(definition.getAttrKey());
            }
        }
        return missing;
    }

    /**
     * 写入或替换实体的向量嵌入（不透明文本）
     */
    @Transactional
    public void setEmbedding(Long entityId, String payload) {
        // 锁住实体行，同一实体的并发写入串行执行，后到者走更新分支
        if (entityId == null || modelRepository.lockById(entityId) == null) {
            throw GraphStoreException.entityNotFound(entityId);
        }
        Embedding embedding = new Embedding();
        embedding.setModelId(entityId);
        embedding.setPayload(payload);
        if (embeddingRepository.updateById(embedding) == 0) {
            embeddingRepository.insert(embedding);
        }
        log.debug("向量嵌入已写入: model={}", entityId);
    }

    public Optional<String> getEmbedding(Long entityId) {
        Embedding embedding = embeddingRepository.selectById(entityId);
        return Optional.ofNullable(embedding).map(Embedding::getPayload);
    }

    private AttributeDefinition resolveDefinition(Long entityId, String key) {
        List<AttributeDefinition> candidates = attributeDefinitionRepository.findInComposition(entityId, key);
        if (candidates.isEmpty()) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_ATTRIBUTE_KEY,
                    "实体 " + entityId + " 的类型组合中未定义属性键: " + key);
        }
        return candidates.get(0);
    }

    private Model requireEntity(Long entityId) {
        Model model = entityId == null ? null : modelRepository.selectById(entityId);
        if (model == null) {
            throw GraphStoreException.entityNotFound(entityId);
        }
        return model;
    }
}
