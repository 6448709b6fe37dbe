package com.nexus.standardize;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseStandardizerTest {

    private final ResponseStandardizer standardizer = new ResponseStandardizer();

    @Test
    void unstructuredInputBecomesDefaultShape() {
        for (Object raw : Arrays.asList(null, 42, "not json", Collections.emptyList())) {
            Map<String, Object> full = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);

            assertThat(standardizer.validate(ShapeTag.MODEL_FULL_DATA, full)).isTrue();
            Map<?, ?> model = (Map<?, ?>) full.get("model");
            assertThat(model.get("id")).isEqualTo(0L);
            assertThat(model.get("title")).isEqualTo("Unknown");
            assertThat(model.get("body")).isNull();
            assertThat(model.get("created_at")).isInstanceOf(LocalDateTime.class);
            assertThat((Map<?, ?>) full.get("attributes")).isEmpty();
            assertThat((List<?>) full.get("relations")).isEmpty();
        }
    }

    @Test
    void fillsMissingModelFields() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "12");

        Map<String, Object> model = standardizer.standardize(ShapeTag.MODEL, raw);

        assertThat(model.get("id")).isEqualTo(12L);
        assertThat(model.get("title")).isEqualTo("Unknown");
        assertThat(model).containsKey("body");
        Map<?, ?> modelType = (Map<?, ?>) model.get("model_type");
        Map<?, ?> base = (Map<?, ?>) modelType.get("base_model");
        assertThat(base.get("id")).isEqualTo(0L);
        assertThat(base.get("name")).isEqualTo("Unknown");
        assertThat((List<?>) modelType.get("traits")).isEmpty();
    }

    @Test
    void dropsTraitsWithoutId() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("base_model", typeRef(1, "Person"));
        raw.put("traits", Arrays.asList(typeRef(2, "Employee"), Collections.singletonMap("name", "Ghost"), "junk"));

        Map<String, Object> modelType = standardizer.standardize(ShapeTag.MODEL_TYPE, raw);

        List<?> traits = (List<?>) modelType.get("traits");
        assertThat(traits).hasSize(1);
        assertThat(((Map<?, ?>) traits.get(0)).get("name")).isEqualTo("Employee");
    }

    @Test
    void oversizedTraitIdDropsOnlyThatTrait() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("base_model", typeRef(7, "Person"));
        raw.put("traits", Collections.singletonList(Collections.singletonMap("id", 1e30)));

        Map<String, Object> modelType = standardizer.standardize(ShapeTag.MODEL_TYPE, raw);

        assertThat(((Map<?, ?>) modelType.get("base_model")).get("id")).isEqualTo(7L);
        assertThat(((Map<?, ?>) modelType.get("base_model")).get("name")).isEqualTo("Person");
        assertThat((List<?>) modelType.get("traits")).isEmpty();
    }

    @Test
    void dropsMalformedRelations() {
        Map<String, Object> good = relation(7, "outgoing");
        Map<String, Object> badDirection = relation(8, "sideways");
        Map<String, Object> noId = relation(9, "incoming");
        noId.remove("relation_id");

        Map<String, Object> raw = new HashMap<>();
        raw.put("model", model(1, "Alice"));
        raw.put("attributes", new HashMap<>());
        raw.put("relations", Arrays.asList(good, badDirection, noId, 5));

        Map<String, Object> full = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);

        List<?> relations = (List<?>) full.get("relations");
        assertThat(relations).hasSize(1);
        Map<?, ?> relation = (Map<?, ?>) relations.get(0);
        assertThat(relation.get("relation_id")).isEqualTo(7L);
        assertThat(relation.get("relation_attributes")).isEqualTo(Collections.emptyMap());
    }

    @Test
    void missingRelationNameDefaultsToUnknown() {
        Map<String, Object> orphan = relation(3, "incoming");
        orphan.put("relation_name", null);
        Map<String, Object> raw = new HashMap<>();
        raw.put("model", model(1, "Alice"));
        raw.put("relations", Collections.singletonList(orphan));

        Map<String, Object> full = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);

        Map<?, ?> relation = (Map<?, ?>) ((List<?>) full.get("relations")).get(0);
        assertThat(relation.get("relation_name")).isEqualTo("Unknown");
    }

    @Test
    void normalizesAttributeScalars() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("age", new BigDecimal("28.0000000000"));
        attributes.put("height", 1.75d);
        attributes.put("active", true);
        attributes.put("hired_at", LocalDateTime.of(2021, 3, 1, 9, 30));
        attributes.put("tags", Arrays.asList("a", "b"));
        attributes.put("nothing", null);
        Map<String, Object> raw = new HashMap<>();
        raw.put("model", model(1, "Alice"));
        raw.put("attributes", attributes);
        raw.put("relations", new ArrayList<>());

        @SuppressWarnings("unchecked")
        Map<String, Object> normalized =
                (Map<String, Object>) standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw).get("attributes");

        assertThat(normalized.get("age")).isEqualTo(28L);
        assertThat(normalized.get("height")).isEqualTo(new BigDecimal("1.75"));
        assertThat(normalized.get("active")).isEqualTo(true);
        assertThat(normalized.get("hired_at")).isEqualTo("2021-03-01T09:30:00");
        assertThat(normalized).containsOnlyKeys("age", "height", "active", "hired_at");
    }

    @Test
    void parsesTimestampStrings() {
        Map<String, Object> raw = model(1, "Alice");
        raw.put("created_at", "2024-05-01T10:15:30.123456");
        raw.put("updated_at", "2024-05-01T12:15:30+02:00");

        Map<String, Object> model = standardizer.standardize(ShapeTag.MODEL, raw);

        assertThat(model.get("created_at")).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 15, 30, 123_456_000));
        assertThat(model.get("updated_at")).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 15, 30));
    }

    @Test
    void topLevelModelTypeIsUsedAsFallback() {
        Map<String, Object> model = model(1, "Alice");
        model.remove("model_type");
        Map<String, Object> modelType = new HashMap<>();
        modelType.put("base_model", typeRef(4, "Person"));
        modelType.put("traits", new ArrayList<>());
        Map<String, Object> raw = new HashMap<>();
        raw.put("model", model);
        raw.put("model_type", modelType);

        Map<String, Object> full = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);

        Map<?, ?> standardModel = (Map<?, ?>) full.get("model");
        Map<?, ?> base = (Map<?, ?>) ((Map<?, ?>) standardModel.get("model_type")).get("base_model");
        assertThat(base.get("id")).isEqualTo(4L);
    }

    @Test
    void standardizationIsIdempotent() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("model", model(1, "Alice"));
        raw.put("attributes", Collections.singletonMap("age", 28));
        raw.put("relations", Arrays.asList(relation(7, "outgoing"), "junk"));

        Map<String, Object> once = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, raw);
        Map<String, Object> twice = standardizer.standardize(ShapeTag.MODEL_FULL_DATA, once);

        assertThat(twice).isEqualTo(once);
        assertThat(standardizer.standardize(ShapeTag.MODEL_FULL_DATA, null).keySet())
                .containsExactly("model", "attributes", "relations");
    }

    @Test
    void validateRejectsWithoutMutating() {
        Map<String, Object> model = model(1, "Alice");
        model.remove("model_type");

        assertThat(standardizer.validate(ShapeTag.MODEL, model)).isFalse();
        assertThat(model).doesNotContainKey("model_type");
        assertThat(standardizer.validate(ShapeTag.MODEL_TYPE, "Person")).isFalse();
        assertThat(standardizer.validate(ShapeTag.MODEL, model(2, "Bob"))).isTrue();
    }

    @Test
    void acceptsTagCodes() {
        assertThat(standardizer.standardize("model_type", null)).containsKeys("base_model", "traits");
    }

    private static Map<String, Object> typeRef(long id, String name) {
        Map<String, Object> ref = new HashMap<>();
        ref.put("id", id);
        ref.put("name", name);
        ref.put("description", null);
        return ref;
    }

    private static Map<String, Object> model(long id, String title) {
        Map<String, Object> modelType = new HashMap<>();
        modelType.put("base_model", typeRef(1, "Person"));
        modelType.put("traits", new ArrayList<>());
        Map<String, Object> model = new HashMap<>();
        model.put("id", id);
        model.put("title", title);
        model.put("body", null);
        model.put("created_at", "2024-05-01T10:00:00");
        model.put("updated_at", "2024-05-01T10:00:00");
        model.put("model_type", modelType);
        return model;
    }

    private static Map<String, Object> relation(long id, String direction) {
        Map<String, Object> relation = new HashMap<>();
        relation.put("relation_id", id);
        relation.put("relation_name", "works_at");
        relation.put("direction", direction);
        relation.put("other_model", model(id + 100, "Acme"));
        relation.put("relation_attributes", null);
        return relation;
    }
}
