package com.nexus.service;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.domain.entity.Attribute;
import com.nexus.domain.entity.Model;
import com.nexus.domain.value.AttributeColumns;
import com.nexus.domain.value.AttributeValue;
import com.nexus.enums.TypeKind;
import com.nexus.enums.ValueType;
import com.nexus.repository.AttributeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class EntityStoreServiceTest {

    @Autowired
    private TypeRegistryService typeRegistryService;

    @Autowired
    private EntityStoreService entityStoreService;

    @Autowired
    private AttributeRepository attributeRepository;

    private Long person;
    private Long employee;
    private Long manager;

    @BeforeEach
    void setUp() {
        person = typeRegistryService.defineType("Person", TypeKind.BASE, null, null);
        employee = typeRegistryService.defineType("Employee", TypeKind.TRAIT, null, null);
        manager = typeRegistryService.defineType("Manager", TypeKind.TRAIT, null, null);
        typeRegistryService.defineAttribute(person, "age", ValueType.NUMBER, true);
        typeRegistryService.defineAttribute(person, "nickname", ValueType.STRING, false);
        typeRegistryService.defineAttribute(employee, "employee_id", ValueType.STRING, true);
        typeRegistryService.defineAttribute(employee, "hired_at", ValueType.DATETIME, false);
    }

    @Test
    void createsEntityOfBaseType() {
        Long alice = entityStoreService.createEntity(person, "Alice", "工程师");

        Model model = entityStoreService.getEntity(alice);
        assertThat(model.getModelTypeId()).isEqualTo(person);
        assertThat(model.getTitle()).isEqualTo("Alice");
        assertThat(model.getCreatedAt()).isNotNull();
        assertThat(entityStoreService.listEntitiesByType("Person"))
                .extracting(Model::getId)
                .containsExactly(alice);
    }

    @Test
    void entityCannotUseTraitAsBaseType() {
        assertThatThrownBy(() -> entityStoreService.createEntity(employee, "Alice", null))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_BASE_TYPE);
        assertThatThrownBy(() -> entityStoreService.createEntity(123_456L, "Alice", null))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.UNKNOWN_TYPE);
    }

    @Test
    void assignsTraitOnlyOnce() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.assignTrait(alice, employee);

        assertThatThrownBy(() -> entityStoreService.assignTrait(alice, employee))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.DUPLICATE_TRAIT_ASSIGNMENT);
    }

    @Test
    void assignTraitValidatesKindAndEntity() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);

        assertThatThrownBy(() -> entityStoreService.assignTrait(alice, person))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_TRAIT_TYPE);
        assertThatThrownBy(() -> entityStoreService.assignTrait(987_654L, employee))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.ENTITY_NOT_FOUND);
    }

    @Test
    void storesValueInExactlyOneTypedColumn() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        Long attributeId = entityStoreService.setAttribute(alice, "age", 28);

        Attribute row = attributeRepository.selectById(attributeId);
        assertThat(AttributeColumns.populatedType(row)).isEqualTo(ValueType.NUMBER);
        assertThat(row.getValueNumber()).isEqualByComparingTo(new BigDecimal("28"));
        assertThat(row.getValueText()).isNull();
        assertThat(row.getValueTime()).isNull();
        assertThat(row.getValueBool()).isNull();
        assertThat(row.getValueVector()).isNull();
    }

    @Test
    void traitAttributesRequireTheTrait() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "employee_id", "E-1"))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.UNKNOWN_ATTRIBUTE_KEY);

        entityStoreService.assignTrait(alice, employee);
        entityStoreService.setAttribute(alice, "employee_id", "E-1");
        assertThat(entityStoreService.getAttributeValues(alice, "employee_id"))
                .containsExactly(AttributeValue.ofString("E-1"));
    }

    @Test
    void valueTypeMustMatchDefinition() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "age", "twenty-eight"))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
    }

    @Test
    void keepsMultipleValuesAndRejectsIdenticalOne() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.setAttribute(alice, "nickname", "Al");
        entityStoreService.setAttribute(alice, "nickname", "Ali");

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "nickname", "Al"))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.DUPLICATE_VALUE);
        assertThat(entityStoreService.getAttributeValues(alice, "nickname"))
                .containsExactly(AttributeValue.ofString("Al"), AttributeValue.ofString("Ali"));
    }

    @Test
    void numericDuplicatesIgnoreScale() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.setAttribute(alice, "age", 28);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "age", new BigDecimal("28.00")))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.DUPLICATE_VALUE);
    }

    @Test
    void rejectsNumbersBeyondStoredPrecision() {
        typeRegistryService.defineAttribute(person, "score", ValueType.NUMBER, false);
        Long alice = entityStoreService.createEntity(person, "Alice", null);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "score", 0.12345678901))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);
        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "score", new BigDecimal("1E+30")))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);

        entityStoreService.setAttribute(alice, "score", 0.123456789);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "score", new BigDecimal("0.1234567890")))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.DUPLICATE_VALUE);
        assertThat(entityStoreService.getAttributeValues(alice, "score"))
                .containsExactly(AttributeValue.ofNumber(new BigDecimal("0.123456789")));
    }

    @Test
    void rejectsNonFiniteNumbers() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);

        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "age", Double.NaN))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "age", Double.POSITIVE_INFINITY))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
        assertThat(entityStoreService.getAttributeValues(alice, "age")).isEmpty();
    }

    @Test
    void removesSingleValue() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.setAttribute(alice, "nickname", "Al");
        entityStoreService.setAttribute(alice, "nickname", "Ali");

        entityStoreService.removeAttributeValue(alice, "nickname", AttributeValue.ofString("Al"));

        assertThat(entityStoreService.getAttributeValues(alice, "nickname"))
                .containsExactly(AttributeValue.ofString("Ali"));
        assertThatThrownBy(() -> entityStoreService.removeAttributeValue(alice, "nickname", AttributeValue.ofString("Al")))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void datetimeValuesRoundTripThroughStorage() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.assignTrait(alice, employee);
        LocalDateTime hiredAt = LocalDateTime.of(2021, 3, 1, 9, 30);

        entityStoreService.setAttribute(alice, "hired_at", hiredAt);

        assertThat(entityStoreService.getAttributeValues(alice, "hired_at"))
                .containsExactly(AttributeValue.ofDateTime(hiredAt));
    }

    @Test
    void enforcesDefinitionConstraints() {
        Long robot = typeRegistryService.defineType("Robot", TypeKind.BASE, null, null);
        Map<String, Object> range = new HashMap<>();
        range.put("min", 0);
        range.put("max", 150);
        typeRegistryService.defineAttribute(robot, "battery", ValueType.NUMBER, false, range);
        typeRegistryService.defineAttribute(robot, "model_code", ValueType.STRING, false,
                singleton("pattern", "[A-Z]{2}-\\d+"));
        typeRegistryService.defineAttribute(robot, "status", ValueType.STRING, false,
                singleton("enum", Arrays.asList("idle", "busy")));
        Long r2 = entityStoreService.createEntity(robot, "R2", null);

        assertThatThrownBy(() -> entityStoreService.setAttribute(r2, "battery", -1))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);
        assertThatThrownBy(() -> entityStoreService.setAttribute(r2, "model_code", "r2d2"))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);
        assertThatThrownBy(() -> entityStoreService.setAttribute(r2, "status", "asleep"))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);

        entityStoreService.setAttribute(r2, "battery", 150);
        entityStoreService.setAttribute(r2, "model_code", "RD-2");
        entityStoreService.setAttribute(r2, "status", "idle");
        assertThat(entityStoreService.getAttributeValues(r2, "status")).hasSize(1);
    }

    @Test
    void baseTypeDefinitionWinsOnKeyCollision() {
        typeRegistryService.defineAttribute(manager, "nickname", ValueType.NUMBER, false);
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.assignTrait(alice, manager);

        // Person.nickname 是字符串，优先于 Manager.nickname
        entityStoreService.setAttribute(alice, "nickname", "Boss");
        assertThatThrownBy(() -> entityStoreService.setAttribute(alice, "nickname", 7))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
    }

    @Test
    void reportsMissingRequiredAttributes() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.assignTrait(alice, employee);

        assertThat(entityStoreService.findMissingRequiredAttributes(alice))
                .containsExactlyInAnyOrder("age", "employee_id");

        entityStoreService.setAttribute(alice, "age", 28);
        assertThat(entityStoreService.findMissingRequiredAttributes(alice)).containsExactly("employee_id");
    }

    @Test
    void updateRefreshesContentAndTimestamp() {
        Long alice = entityStoreService.createEntity(person, "Alice", "old");
        LocalDateTime before = entityStoreService.getEntity(alice).getUpdatedAt();

        Model updated = entityStoreService.updateEntity(alice, null, "new");

        assertThat(updated.getTitle()).isEqualTo("Alice");
        assertThat(updated.getBody()).isEqualTo("new");
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(before);
    }

    @Test
    void embeddingIsUpserted() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        assertThat(entityStoreService.getEmbedding(alice)).isEmpty();

        entityStoreService.setEmbedding(alice, "[0.1,0.2]");
        entityStoreService.setEmbedding(alice, "[0.3,0.4]");

        assertThat(entityStoreService.getEmbedding(alice)).contains("[0.3,0.4]");

        entityStoreService.setEmbedding(alice, null);
        assertThat(entityStoreService.getEmbedding(alice)).isEmpty();
    }

    @Test
    void deleteRemovesEntity() {
        Long alice = entityStoreService.createEntity(person, "Alice", null);
        entityStoreService.assignTrait(alice, employee);
        entityStoreService.setAttribute(alice, "age", 28);
        entityStoreService.setEmbedding(alice, "[1.0]");

        entityStoreService.deleteEntity(alice);

        assertThatThrownBy(() -> entityStoreService.getEntity(alice))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.ENTITY_NOT_FOUND);
        assertThat(entityStoreService.getEmbedding(alice)).isEmpty();
        assertThatThrownBy(() -> entityStoreService.deleteEntity(alice))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.ENTITY_NOT_FOUND);
    }

    private static Map<String, Object> singleton(String key, Object value) {
        Map<String, Object> map = new HashMap<>();
        map.put(key, value);
        return map;
    }
}
