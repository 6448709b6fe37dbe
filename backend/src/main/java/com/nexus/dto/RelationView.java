package com.nexus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一跳关系视图
 */
@Data
@Builder
public class RelationView {

    @JsonProperty("relation_id")
    private Long relationId;

    @JsonProperty("relation_name")
    private String relationName;

    /**
     * outgoing / incoming
     */
    private String direction;

    @JsonProperty("other_model")
    private ModelView otherModel;

    @JsonProperty("relation_attributes")
    private Map<String, Object> relationAttributes;

    public boolean isOutgoing() {
        return "outgoing".equals(direction);
    }

    @SuppressWarnings("unchecked")
    static RelationView from(Map<?, ?> canonical) {
        return RelationView.builder()
                .relationId((Long) canonical.get("relation_id"))
                .relationName((String) canonical.get("relation_name"))
                .direction((String) canonical.get("direction"))
                .otherModel(ModelView.from((Map<?, ?>) canonical.get("other_model")))
                .relationAttributes(new LinkedHashMap<>((Map<String, Object>) canonical.get("relation_attributes")))
                .build();
    }
}
