package com.nexus.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 类型引用 {id, name, description}
 */
@Data
@Builder
public class TypeRef {

    private Long id;

    private String name;

    private String description;

    static TypeRef from(Map<?, ?> canonical) {
        return TypeRef.builder()
                .id((Long) canonical.get("id"))
                .name((String) canonical.get("name"))
                .description((String) canonical.get("description"))
                .build();
    }
}
