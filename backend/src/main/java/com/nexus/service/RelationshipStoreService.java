package com.nexus.service;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.common.exception.StoreErrors;
import com.nexus.domain.entity.Model;
import com.nexus.domain.entity.Relation;
import com.nexus.domain.entity.RelationAttribute;
import com.nexus.domain.entity.RelationAttributeDefinition;
import com.nexus.domain.entity.RelationshipType;
import com.nexus.domain.row.RelationRow;
import com.nexus.domain.value.AttributeColumns;
import com.nexus.domain.value.AttributeValue;
import com.nexus.enums.Multiplicity;
import com.nexus.repository.ModelRepository;
import com.nexus.repository.RelationAttributeDefinitionRepository;
import com.nexus.repository.RelationAttributeRepository;
import com.nexus.repository.RelationRepository;
import com.nexus.repository.RelationshipTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 关系存储服务
 *
 * 创建关系时校验两端实体的基础类型与关系类型声明一致；关系属性沿用实体属性的
 * 类型化 EAV 规则，作用域为关系类型的属性定义。
 */
@Service
public class RelationshipStoreService {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipStoreService.class);

    @Autowired
    private ModelRepository modelRepository;

    @Autowired
    private RelationshipTypeRepository relationshipTypeRepository;

    @Autowired
    private RelationRepository relationRepository;

    @Autowired
    private RelationAttributeDefinitionRepository relationAttributeDefinitionRepository;

    @Autowired
    private RelationAttributeRepository relationAttributeRepository;

    @Autowired
    private AttributeValueChecker attributeValueChecker;

    /**
     * 创建有向关系 from → to
     *
     * @param fromId 起点实体ID
     * @param toId 终点实体ID
     * @param relationshipTypeId 关系类型ID
     * @return 关系ID
     */
    @Transactional
    public Long createRelation(Long fromId, Long toId, Long relationshipTypeId) {
        Model from = requireEntity(fromId);
        Model to = requireEntity(toId);
        RelationshipType relationshipType = relationshipTypeRepository.selectById(relationshipTypeId);
        if (relationshipType == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "关系类型不存在: id=" + relationshipTypeId);
        }

        if (!relationshipType.getFromModelTypeId().equals(from.getModelTypeId())
                || !relationshipType.getToModelTypeId().equals(to.getModelTypeId())) {
            throw new GraphStoreException(ErrorCode.ENDPOINT_TYPE_MISMATCH,
                    "关系 " + relationshipType.getRelationName() + " 要求 " + relationshipType.getFromModelTypeId()
                            + " -> " + relationshipType.getToModelTypeId() + "，实际为 "
                            + from.getModelTypeId() + " -> " + to.getModelTypeId());
        }

        // 基数 one 由应用层检查，不受唯一约束保护
        if (relationshipType.policy() == Multiplicity.ONE
                && relationRepository.countOutgoingOfType(fromId, relationshipTypeId) > 0) {
            throw new GraphStoreException(ErrorCode.MULTIPLICITY_EXCEEDED,
                    "实体 " + from.getTitle() + " 已存在 " + relationshipType.getRelationName() + " 关系");
        }

        Relation relation = new Relation();
        relation.setFromId(fromId);
        relation.setToId(toId);
        relation.setRelationshipTypeId(relationshipTypeId);
        relationRepository.insert(relation);

        logger.info("关系创建成功: {} -[{}]-> {} (id={})",
                from.getTitle(), relationshipType.getRelationName(), to.getTitle(), relation.getId());
        return relation.getId();
    }

    /**
     * 设置关系属性值（多值追加）
     */
    @Transactional
    public Long setRelationAttribute(Long relationId, String key, AttributeValue value) {
        Relation relation = requireRelation(relationId);
        RelationAttributeDefinition definition = relation.getRelationshipTypeId() == null
                ? null
                : relationAttributeDefinitionRepository.findByTypeAndKey(relation.getRelationshipTypeId(), key);
        if (definition == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_ATTRIBUTE_KEY,
                    "关系 " + relationId + " 的关系类型未定义属性键: " + key);
        }
        attributeValueChecker.check(key, definition.getValueType(), null, value);

        String duplicateMessage = "关系 " + relationId + " 的属性 " + key + " 已有值 " + value;
        if (relationAttributeRepository.countValue(relationId, definition.getId(), value.uniquenessKey()) > 0) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_VALUE, duplicateMessage);
        }

        RelationAttribute attribute = new RelationAttribute();
        attribute.setRelationId(relationId);
        attribute.setRelationAttributeDefinitionId(definition.getId());
        AttributeColumns.write(value, attribute);
        StoreErrors.insertUnique(() -> relationAttributeRepository.insert(attribute),
                ErrorCode.DUPLICATE_VALUE, duplicateMessage);

        logger.info("关系属性已写入: relation={}, {}={}", relationId, key, value);
        return attribute.getId();
    }

    @Transactional
    public Long setRelationAttribute(Long relationId, String key, Object rawValue) {
        return setRelationAttribute(relationId, key, AttributeValue.of(rawValue));
    }

    /**
     * 删除关系，关系属性级联删除
     */
    @Transactional
    public void deleteRelation(Long relationId) {
        requireRelation(relationId);
        relationRepository.deleteById(relationId);
        logger.info("关系已删除: id={}", relationId);
    }

    public Relation getRelation(Long relationId) {
        return requireRelation(relationId);
    }

    /**
     * 以实体为任一端点的全部关系
     */
    public List<RelationRow> listRelations(Long entityId) {
        requireEntity(entityId);
        return relationRepository.findIncident(entityId);
    }

    private Relation requireRelation(Long relationId) {
        Relation relation = relationRepository.selectById(relationId);
        if (relation == null) {
            throw GraphStoreException.notFound("关系 id=" + relationId);
        }
        return relation;
    }

    private Model requireEntity(Long entityId) {
        Model model = entityId == null ? null : modelRepository.selectById(entityId);
        if (model == null) {
            throw GraphStoreException.entityNotFound(entityId);
        }
        return model;
    }
}
