package com.nexus.domain.value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 带类型值列的 EAV 行（实体属性与关系属性共用）
 * 五个值列中恰好一列非空，非空列即类型标识
 */
public interface TypedValueColumns {

    String getValueText();

    void setValueText(String valueText);

    BigDecimal getValueNumber();

    void setValueNumber(BigDecimal valueNumber);

    LocalDateTime getValueTime();

    void setValueTime(LocalDateTime valueTime);

    Boolean getValueBool();

    void setValueBool(Boolean valueBool);

    String getValueVector();

    void setValueVector(String valueVector);

    String getValueKey();

    void setValueKey(String valueKey);
}
