package com.nexus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 类型组合：基础类型 + 已分配特征（特征顺序无保证）
 */
@Data
@Builder
public class ModelTypeBlock {

    @JsonProperty("base_model")
    private TypeRef baseModel;

    private List<TypeRef> traits;

    static ModelTypeBlock from(Map<?, ?> canonical) {
        List<TypeRef> traits = new ArrayList<>();
        for (Object trait : (List<?>) canonical.get("traits")) {
            traits.add(TypeRef.from((Map<?, ?>) trait));
        }
        return ModelTypeBlock.builder()
                .baseModel(TypeRef.from((Map<?, ?>) canonical.get("base_model")))
                .traits(traits)
                .build();
    }
}
