package com.nexus.domain.row;

import com.nexus.domain.value.TypedValueColumns;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 属性值 + 定义键的联合查询行（实体属性和关系属性共用）
 */
@Data
public class AttributeRow implements TypedValueColumns {

    private Long id;

    private Long ownerId;

    private Long definitionId;

    private String attrKey;

    private String valueType;

    private String valueText;

    private BigDecimal valueNumber;

    private LocalDateTime valueTime;

    private Boolean valueBool;

    private String valueVector;

    private String valueKey;
}
