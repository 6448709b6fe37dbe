package com.nexus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 实体块（含类型组合）
 */
@Data
@Builder
public class ModelView {

    private Long id;

    private String title;

    private String body;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("model_type")
    private ModelTypeBlock modelType;

    static ModelView from(Map<?, ?> canonical) {
        return ModelView.builder()
                .id((Long) canonical.get("id"))
                .title((String) canonical.get("title"))
                .body((String) canonical.get("body"))
                .createdAt((LocalDateTime) canonical.get("created_at"))
                .updatedAt((LocalDateTime) canonical.get("updated_at"))
                .modelType(ModelTypeBlock.from((Map<?, ?>) canonical.get("model_type")))
                .build();
    }
}
