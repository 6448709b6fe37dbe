package com.nexus.domain.value;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.enums.ValueType;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 属性值（按值类型区分的标签联合）
 *
 * 应用层只使用该类型，落库时才映射到可空的分列存储，见 {@link AttributeColumns}。
 */
public final class AttributeValue {

    private final ValueType type;
    private final Object payload;

    private AttributeValue(ValueType type, Object payload) {
        this.type = type;
        this.payload = Objects.requireNonNull(payload, "属性值不能为空");
    }

    public static AttributeValue ofString(String text) {
        return new AttributeValue(ValueType.STRING, text);
    }

    public static AttributeValue ofNumber(Number number) {
        if (isNonFinite(number)) {
            throw new GraphStoreException(ErrorCode.TYPE_MISMATCH, "数字属性值必须是有限数: " + number);
        }
        BigDecimal decimal = number instanceof BigDecimal
                ? (BigDecimal) number
                : new BigDecimal(number.toString());
        return new AttributeValue(ValueType.NUMBER, normalize(decimal));
    }

    public static AttributeValue ofDateTime(LocalDateTime time) {
        // 存储精度为微秒
        return new AttributeValue(ValueType.DATETIME, time.truncatedTo(ChronoUnit.MICROS));
    }

    public static AttributeValue ofBoolean(boolean flag) {
        return new AttributeValue(ValueType.BOOLEAN, flag);
    }

    public static AttributeValue ofVector(String opaque) {
        return new AttributeValue(ValueType.VECTOR, opaque);
    }

    public static AttributeValue ofVector(float[] components) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(components[i]);
        }
        return ofVector(sb.append(']').toString());
    }

    /**
     * 由普通 Java 值推断类型。向量必须显式使用 {@link #ofVector}（或传入 float[]）。
     */
    public static AttributeValue of(Object raw) {
        if (raw instanceof AttributeValue) {
            return (AttributeValue) raw;
        }
        if (raw instanceof String) {
            return ofString((String) raw);
        }
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        if (raw instanceof Number) {
            return ofNumber((Number) raw);
        }
        if (raw instanceof LocalDateTime) {
            return ofDateTime((LocalDateTime) raw);
        }
        if (raw instanceof OffsetDateTime) {
            return ofDateTime(((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof ZonedDateTime) {
            return ofDateTime(LocalDateTime.ofInstant(((ZonedDateTime) raw).toInstant(), ZoneOffset.UTC));
        }
        if (raw instanceof Instant) {
            return ofDateTime(LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC));
        }
        if (raw instanceof float[]) {
            return ofVector((float[]) raw);
        }
        throw new IllegalArgumentException("无法推断属性值类型: " + (raw == null ? "null" : raw.getClass().getName()));
    }

    public ValueType getType() {
        return type;
    }

    public String asString() {
        return expect(ValueType.STRING, String.class);
    }

    public BigDecimal asNumber() {
        return expect(ValueType.NUMBER, BigDecimal.class);
    }

    public LocalDateTime asDateTime() {
        return expect(ValueType.DATETIME, LocalDateTime.class);
    }

    public Boolean asBoolean() {
        return expect(ValueType.BOOLEAN, Boolean.class);
    }

    public String asVector() {
        return expect(ValueType.VECTOR, String.class);
    }

    /**
     * 物化输出用的普通值：整数型数字为 Long，其余数字为 BigDecimal，时间为 ISO-8601 文本
     */
    public Object toPlainValue() {
        switch (type) {
            case NUMBER:
                BigDecimal number = (BigDecimal) payload;
                if (number.scale() <= 0 && number.toBigInteger().bitLength() < 64) {
                    return number.longValueExact();
                }
                return number;
            case DATETIME:
                return ((LocalDateTime) payload).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            default:
                return payload;
        }
    }

    /**
     * 唯一性键：类型前缀 + 规范文本摘要（可空分列无法直接建唯一约束）
     */
    public String uniquenessKey() {
        return type.getCode() + ":" + DigestUtils.md5DigestAsHex(canonicalText().getBytes(StandardCharsets.UTF_8));
    }

    String canonicalText() {
        switch (type) {
            case NUMBER:
                return ((BigDecimal) payload).toPlainString();
            case DATETIME:
                return ((LocalDateTime) payload).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            default:
                return payload.toString();
        }
    }

    private static boolean isNonFinite(Number number) {
        if (number instanceof Double) {
            return ((Double) number).isNaN() || ((Double) number).isInfinite();
        }
        if (number instanceof Float) {
            return ((Float) number).isNaN() || ((Float) number).isInfinite();
        }
        return false;
    }

    private static BigDecimal normalize(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private <T> T expect(ValueType expected, Class<T> javaType) {
        if (type != expected) {
            throw new IllegalStateException("属性值类型为 " + type.getCode() + "，不是 " + expected.getCode());
        }
        return javaType.cast(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeValue that = (AttributeValue) o;
        return type == that.type && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return type.getCode() + "(" + canonicalText() + ")";
    }
}
