package com.nexus.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.common.exception.StoreErrors;
import com.nexus.domain.entity.AttributeDefinition;
import com.nexus.domain.entity.ModelType;
import com.nexus.domain.entity.RelationAttributeDefinition;
import com.nexus.domain.entity.RelationshipType;
import com.nexus.enums.Multiplicity;
import com.nexus.enums.TypeKind;
import com.nexus.enums.ValueType;
import com.nexus.repository.AttributeDefinitionRepository;
import com.nexus.repository.ModelTypeRepository;
import com.nexus.repository.RelationAttributeDefinitionRepository;
import com.nexus.repository.RelationshipTypeRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * 类型注册服务
 *
 * 管理基础类型、特征类型、属性定义、关系类型及关系属性定义。
 * 定义只增不改，名称/键的唯一性最终由数据库约束保证。
 */
@Service
@Slf4j
public class TypeRegistryService {

    @Autowired
    private ModelTypeRepository modelTypeRepository;

    @Autowired
    private AttributeDefinitionRepository attributeDefinitionRepository;

    @Autowired
    private RelationshipTypeRepository relationshipTypeRepository;

    @Autowired
    private RelationAttributeDefinitionRepository relationAttributeDefinitionRepository;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * 定义模型类型
     *
     * @param name 类型名称（全局唯一）
     * @param kind 基础 / 特征
     * @param parentId 父类型ID，可为空
     * @param description 描述，可为空
     * @return 类型ID
     */
    @Transactional
    public Long defineType(String name, TypeKind kind, Long parentId, String description) {
        return defineType(name, kind, parentId, description, false);
    }

    /**
     * 定义模型类型，并标记是否为动作类型
     */
    @Transactional
    public Long defineType(String name, TypeKind kind, Long parentId, String description, boolean isAction) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("类型名称不能为空");
        }
        log.info("定义模型类型: name={}, kind={}", name, kind.getCode());

        if (modelTypeRepository.findByName(name) != null) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_NAME, "类型名称已存在: " + name);
        }
        if (parentId != null && modelTypeRepository.selectById(parentId) == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "父类型不存在: id=" + parentId);
        }

        ModelType type = new ModelType();
        type.setName(name);
        type.setTypeKind(kind.getCode());
        type.setParentId(parentId);
        type.setDescription(description);
        type.setIsAction(isAction);

        StoreErrors.insertUnique(() -> modelTypeRepository.insert(type),
                ErrorCode.DUPLICATE_NAME, "类型名称已存在: " + name);
        log.info("模型类型创建成功: {} (id={})", name, type.getId());
        return type.getId();
    }

    /**
     * 在某类型上定义属性
     */
    @Transactional
    public Long defineAttribute(Long typeId, String key, ValueType valueType, boolean required,
                                Map<String, Object> constraints) {
        if (StringUtils.isBlank(key)) {
            throw new IllegalArgumentException("属性键不能为空");
        }
        ModelType type = modelTypeRepository.selectById(typeId);
        if (type == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "类型不存在: id=" + typeId);
        }
        if (attributeDefinitionRepository.findByTypeAndKey(typeId, key) != null) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_KEY,
                    "类型 " + type.getName() + " 已定义属性键: " + key);
        }

        AttributeDefinition definition = new AttributeDefinition();
        definition.setModelTypeId(typeId);
        definition.setAttrKey(key);
        definition.setValueType(valueType.getCode());
        definition.setRequired(required);
        definition.setConstraints(writeConstraints(constraints));

        StoreErrors.insertUnique(() -> attributeDefinitionRepository.insert(definition),
                ErrorCode.DUPLICATE_KEY, "类型 " + type.getName() + " 已定义属性键: " + key);
        log.info("属性定义创建成功: {}.{} ({}, required={})", type.getName(), key, valueType.getCode(), required);
        return definition.getId();
    }

    public Long defineAttribute(Long typeId, String key, ValueType valueType, boolean required) {
        return defineAttribute(typeId, key, valueType, required, null);
    }

    /**
     * 定义关系类型，两端必须都是基础类型
     */
    @Transactional
    public Long defineRelationshipType(Long fromTypeId, Long toTypeId, String name,
                                       Multiplicity multiplicity, String description) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("关系名称不能为空");
        }
        ModelType from = requireBaseEndpoint(fromTypeId);
        ModelType to = requireBaseEndpoint(toTypeId);
        String label = from.getName() + " -[" + name + "]-> " + to.getName();

        if (relationshipTypeRepository.findByEndpointsAndName(fromTypeId, toTypeId, name) != null) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_NAME, "关系类型已存在: " + label);
        }

        RelationshipType relationshipType = new RelationshipType();
        relationshipType.setFromModelTypeId(fromTypeId);
        relationshipType.setToModelTypeId(toTypeId);
        relationshipType.setRelationName(name);
        relationshipType.setMultiplicity((multiplicity == null ? Multiplicity.MANY : multiplicity).getCode());
        relationshipType.setDescription(description);

        StoreErrors.insertUnique(() -> relationshipTypeRepository.insert(relationshipType),
                ErrorCode.DUPLICATE_NAME, "关系类型已存在: " + label);
        log.info("关系类型创建成功: {} (id={}, multiplicity={})",
                label, relationshipType.getId(), relationshipType.getMultiplicity());
        return relationshipType.getId();
    }

    /**
     * 在关系类型上定义关系属性
     */
    @Transactional
    public Long defineRelationAttribute(Long relationshipTypeId, String key, ValueType valueType, boolean required) {
        if (StringUtils.isBlank(key)) {
            throw new IllegalArgumentException("属性键不能为空");
        }
        RelationshipType relationshipType = relationshipTypeRepository.selectById(relationshipTypeId);
        if (relationshipType == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "关系类型不存在: id=" + relationshipTypeId);
        }
        if (relationAttributeDefinitionRepository.findByTypeAndKey(relationshipTypeId, key) != null) {
            throw new GraphStoreException(ErrorCode.DUPLICATE_KEY,
                    "关系类型 " + relationshipType.getRelationName() + " 已定义属性键: " + key);
        }

        RelationAttributeDefinition definition = new RelationAttributeDefinition();
        definition.setRelationshipTypeId(relationshipTypeId);
        definition.setAttrKey(key);
        definition.setValueType(valueType.getCode());
        definition.setRequired(required);

        StoreErrors.insertUnique(() -> relationAttributeDefinitionRepository.insert(definition),
                ErrorCode.DUPLICATE_KEY, "关系类型 " + relationshipType.getRelationName() + " 已定义属性键: " + key);
        log.info("关系属性定义创建成功: {}.{} ({})", relationshipType.getRelationName(), key, valueType.getCode());
        return definition.getId();
    }

    // ---------------------------------------------------------------- 查询

    public ModelType getType(Long typeId) {
        ModelType type = modelTypeRepository.selectById(typeId);
        if (type == null) {
            throw GraphStoreException.notFound("模型类型 id=" + typeId);
        }
        return type;
    }

    public ModelType getTypeByName(String name) {
        ModelType type = modelTypeRepository.findByName(name);
        if (type == null) {
            throw GraphStoreException.notFound("模型类型 " + name);
        }
        return type;
    }

    /**
     * 列出类型，kind 为空时返回全部
     */
    public List<ModelType> listTypes(TypeKind kind) {
        if (kind == null) {
            return modelTypeRepository.findAllOrdered();
        }
        return modelTypeRepository.findByKind(kind.getCode());
    }

    public AttributeDefinition getAttributeDefinition(Long typeId, String key) {
        AttributeDefinition definition = attributeDefinitionRepository.findByTypeAndKey(typeId, key);
        if (definition == null) {
            throw GraphStoreException.notFound("属性定义 typeId=" + typeId + ", key=" + key);
        }
        return definition;
    }

    public List<AttributeDefinition> listAttributeDefinitions(Long typeId) {
        return attributeDefinitionRepository.findByType(typeId);
    }

    public RelationshipType getRelationshipType(Long relationshipTypeId) {
        RelationshipType relationshipType = relationshipTypeRepository.selectById(relationshipTypeId);
        if (relationshipType == null) {
            throw GraphStoreException.notFound("关系类型 id=" + relationshipTypeId);
        }
        return relationshipType;
    }

    public RelationshipType getRelationshipType(Long fromTypeId, Long toTypeId, String name) {
        RelationshipType relationshipType = relationshipTypeRepository.findByEndpointsAndName(fromTypeId, toTypeId, name);
        if (relationshipType == null) {
            throw GraphStoreException.notFound("关系类型 " + name + " (" + fromTypeId + " -> " + toTypeId + ")");
        }
        return relationshipType;
    }

    public List<RelationshipType> findRelationshipTypesByName(String name) {
        return relationshipTypeRepository.findByName(name);
    }

    public RelationAttributeDefinition getRelationAttributeDefinition(Long relationshipTypeId, String key) {
        RelationAttributeDefinition definition = relationAttributeDefinitionRepository.findByTypeAndKey(relationshipTypeId, key);
        if (definition == null) {
            throw GraphStoreException.notFound("关系属性定义 relationshipTypeId=" + relationshipTypeId + ", key=" + key);
        }
        return definition;
    }

    private ModelType requireBaseEndpoint(Long typeId) {
        ModelType type = modelTypeRepository.selectById(typeId);
        if (type == null) {
            throw new GraphStoreException(ErrorCode.UNKNOWN_TYPE, "关系端点类型不存在: id=" + typeId);
        }
        if (!type.isBase()) {
            throw new GraphStoreException(ErrorCode.INVALID_BASE_TYPE,
                    "关系端点必须是基础类型: " + type.getName() + " 是 " + type.getTypeKind());
        }
        return type;
    }

    private String writeConstraints(Map<String, Object> constraints) {
        if (constraints == null || constraints.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(constraints);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("属性约束无法序列化: " + e.getMessage(), e);
        }
    }
}
