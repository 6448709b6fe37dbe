package com.nexus.domain.value;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.domain.entity.Attribute;
import com.nexus.enums.ValueType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttributeValueTest {

    @Test
    void infersTypeFromJavaValue() {
        assertThat(AttributeValue.of("x").getType()).isEqualTo(ValueType.STRING);
        assertThat(AttributeValue.of(3).getType()).isEqualTo(ValueType.NUMBER);
        assertThat(AttributeValue.of(true).getType()).isEqualTo(ValueType.BOOLEAN);
        assertThat(AttributeValue.of(LocalDateTime.now()).getType()).isEqualTo(ValueType.DATETIME);
        assertThat(AttributeValue.of(new float[]{0.5f, 1f}).asVector()).isEqualTo("[0.5,1.0]");
        assertThatThrownBy(() -> AttributeValue.of(new Object())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AttributeValue.of(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void offsetTimesAreStoredAsUtc() {
        OffsetDateTime paris = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.ofHours(1));

        assertThat(AttributeValue.of(paris).asDateTime()).isEqualTo(LocalDateTime.of(2024, 1, 1, 11, 0));
    }

    @Test
    void nonFiniteNumbersAreRejected() {
        assertThatThrownBy(() -> AttributeValue.ofNumber(Float.NaN))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
        assertThatThrownBy(() -> AttributeValue.of(Double.NEGATIVE_INFINITY))
                .isInstanceOf(GraphStoreException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TYPE_MISMATCH);
    }

    @Test
    void numbersCompareByValue() {
        assertThat(AttributeValue.ofNumber(new BigDecimal("28.000"))).isEqualTo(AttributeValue.ofNumber(28));
        assertThat(AttributeValue.ofNumber(28).uniquenessKey())
                .isEqualTo(AttributeValue.ofNumber(28L).uniquenessKey())
                .startsWith("number:");
        assertThat(AttributeValue.ofNumber(28).toPlainValue()).isEqualTo(28L);
        assertThat(AttributeValue.ofNumber(new BigDecimal("2.50")).toPlainValue()).isEqualTo(new BigDecimal("2.5"));
    }

    @Test
    void sameTextOfDifferentTypesHasDifferentKeys() {
        assertThat(AttributeValue.ofString("true").uniquenessKey())
                .isNotEqualTo(AttributeValue.ofBoolean(true).uniquenessKey());
    }

    @Test
    void accessorRejectsOtherType() {
        assertThatThrownBy(() -> AttributeValue.ofString("x").asNumber()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void columnsHoldExactlyOneValue() {
        Attribute row = new Attribute();
        row.setValueText("stale");

        AttributeColumns.write(AttributeValue.ofBoolean(false), row);

        assertThat(row.getValueText()).isNull();
        assertThat(row.getValueBool()).isFalse();
        assertThat(row.getValueKey()).startsWith("boolean:");
        assertThat(AttributeColumns.read(row)).isEqualTo(AttributeValue.ofBoolean(false));

        row.setValueNumber(BigDecimal.ONE);
        assertThat(AttributeColumns.read(row)).isNull();
        assertThat(AttributeColumns.populatedType(row)).isNull();
    }
}
