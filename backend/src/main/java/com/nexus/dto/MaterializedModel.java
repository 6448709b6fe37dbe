package com.nexus.dto;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实体物化结果
 *
 * 由规范化后的结构构建，字段一定齐全。
 */
@Data
@Builder
public class MaterializedModel {

    private ModelView model;

    /**
     * 扁平属性映射，多值属性取最后插入的值
     */
    private Map<String, Object> attributes;

    private List<RelationView> relations;

    /**
     * 从规范结构（ShapeTag.MODEL_FULL_DATA）构建
     */
    @SuppressWarnings("unchecked")
    public static MaterializedModel fromCanonical(Map<String, Object> canonical) {
        List<RelationView> relations = new ArrayList<>();
        for (Object relation : (List<?>) canonical.get("relations")) {
            relations.add(RelationView.from((Map<?, ?>) relation));
        }
        return MaterializedModel.builder()
                .model(ModelView.from((Map<?, ?>) canonical.get("model")))
                .attributes(new LinkedHashMap<>((Map<String, Object>) canonical.get("attributes")))
                .relations(relations)
                .build();
    }
}
