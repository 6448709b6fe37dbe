package com.nexus.standardize;

import com.nexus.enums.RelationDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 响应规范化器
 *
 * 对物化结果（以及任何来自不可信边界的实体数据）做防御性重整：
 * <ul>
 *   <li>非结构化输入替换为默认结构，从不抛异常</li>
 *   <li>缺失字段按类型填默认值：id=0, name/title="Unknown", description/body=null, 时间=当前时间, 列表=空</li>
 *   <li>不合法的子元素（缺 id 的特征、缺 relation_id 或方向非法的关系、非标量属性值）直接丢弃</li>
 *   <li>每处偏差记录 WARN 日志，但不向调用方报错</li>
 * </ul>
 * 无状态，对同一输入重复规范化结果不变。
 */
@Slf4j
@Component
public class ResponseStandardizer {

    static final String UNKNOWN = "Unknown";

    /**
     * 按结构标签规范化
     *
     * @param tag 结构标签
     * @param raw 任意输入（可以是 null、数字、残缺结构）
     * @return 规范结构（新对象，不修改输入）
     */
    public Map<String, Object> standardize(ShapeTag tag, Object raw) {
        Objects.requireNonNull(tag, "结构标签不能为空");
        try {
            switch (tag) {
                case MODEL_TYPE:
                    return standardizeModelType(raw, "model_type");
                case MODEL:
                    return standardizeModel(raw, "model", null);
                case MODEL_FULL_DATA:
                    return standardizeModelFullData(raw);
                default:
                    throw new IllegalArgumentException("未知的结构标签: " + tag);
            }
        } catch (RuntimeException e) {
            // 兜底：规范化本身出错也必须返回合法结构
            log.error("规范化 {} 时出现异常，返回默认结构: {}", tag, e.getMessage(), e);
            return standardize(tag, null);
        }
    }

    public Map<String, Object> standardize(String tagCode, Object raw) {
        return standardize(ShapeTag.fromCode(tagCode), raw);
    }

    /**
     * 校验结构是否符合规范（不修改输入），不合法时记录日志
     */
    public boolean validate(ShapeTag tag, Object value) {
        boolean valid;
        switch (tag) {
            case MODEL_TYPE:
                valid = isValidModelType(value);
                break;
            case MODEL:
                valid = isValidModel(value);
                break;
            case MODEL_FULL_DATA:
                valid = isValidModelFullData(value);
                break;
            default:
                valid = false;
        }
        if (valid) {
            log.debug("{} 结构校验通过", tag.getCode());
        } else {
            log.warn("{} 结构不合法: {}", tag.getCode(), value);
        }
        return valid;
    }

    // ---------------------------------------------------------------- 规范化

    private Map<String, Object> standardizeModelFullData(Object raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!(raw instanceof Map)) {
            log.warn("model_full_data 不是结构化数据: {}", describe(raw));
            result.put("model", standardizeModel(null, "model_full_data.model", null));
            result.put("attributes", new LinkedHashMap<String, Object>());
            result.put("relations", new ArrayList<Map<String, Object>>());
            return result;
        }
        Map<?, ?> data = (Map<?, ?>) raw;

        if (!data.containsKey("model")) {
            log.warn("model_full_data 缺少 model");
        }
        // 兼容 model_type 放在顶层的旧结构
        result.put("model", standardizeModel(data.get("model"), "model_full_data.model", data.get("model_type")));
        result.put("attributes", standardizeAttributes(data.get("attributes"), "model_full_data.attributes"));

        List<Map<String, Object>> relations = new ArrayList<>();
        Object rawRelations = data.get("relations");
        if (rawRelations != null && !(rawRelations instanceof List)) {
            log.warn("model_full_data.relations 不是列表，已替换为空列表: {}", describe(rawRelations));
        } else if (rawRelations == null) {
            log.warn("model_full_data 缺少 relations");
        } else {
            int index = 0;
            for (Object rawRelation : (List<?>) rawRelations) {
                Map<String, Object> relation = standardizeRelation(rawRelation, "model_full_data.relations[" + index + "]");
                if (relation != null) {
                    relations.add(relation);
                }
                index++;
            }
        }
        result.put("relations", relations);
        return result;
    }

    private Map<String, Object> standardizeModel(Object raw, String path, Object fallbackModelType) {
        Map<String, Object> model = new LinkedHashMap<>();
        if (!(raw instanceof Map)) {
            log.warn("{} 不是结构化数据: {}", path, describe(raw));
            LocalDateTime now = LocalDateTime.now();
            model.put("id", 0L);
            model.put("title", UNKNOWN);
            model.put("body", null);
            model.put("created_at", now);
            model.put("updated_at", now);
            model.put("model_type", standardizeModelType(fallbackModelType, path + ".model_type"));
            return model;
        }
        Map<?, ?> data = (Map<?, ?>) raw;

        model.put("id", requiredId(data, "id", path));
        model.put("title", requiredText(data, "title", path));
        model.put("body", optionalText(data, "body", path));
        model.put("created_at", requiredTimestamp(data, "created_at", path));
        model.put("updated_at", requiredTimestamp(data, "updated_at", path));

        Object modelType = data.get("model_type");
        if (modelType == null && fallbackModelType != null) {
            modelType = fallbackModelType;
        }
        model.put("model_type", standardizeModelType(modelType, path + ".model_type"));
        return model;
    }

    private Map<String, Object> standardizeModelType(Object raw, String path) {
        Map<String, Object> modelType = new LinkedHashMap<>();
        if (!(raw instanceof Map)) {
            log.warn("{} 不是结构化数据: {}", path, describe(raw));
            modelType.put("base_model", standardizeTypeRef(Collections.emptyMap(), path + ".base_model"));
            modelType.put("traits", new ArrayList<Map<String, Object>>());
            return modelType;
        }
        Map<?, ?> data = (Map<?, ?>) raw;

        Object base = data.get("base_model");
        if (!(base instanceof Map)) {
            log.warn("{}.base_model 不是结构化数据: {}", path, describe(base));
            base = Collections.emptyMap();
        }
        modelType.put("base_model", standardizeTypeRef((Map<?, ?>) base, path + ".base_model"));

        List<Map<String, Object>> traits = new ArrayList<>();
        Object rawTraits = data.get("traits");
        if (!(rawTraits instanceof List)) {
            log.warn("{}.traits 不是列表，已替换为空列表: {}", path, describe(rawTraits));
        } else {
            int index = 0;
            for (Object trait : (List<?>) rawTraits) {
                String traitPath = path + ".traits[" + index++ + "]";
                if (!(trait instanceof Map)) {
                    log.warn("{} 不是结构化数据，已丢弃: {}", traitPath, describe(trait));
                    continue;
                }
                if (toLong(((Map<?, ?>) trait).get("id")) == null) {
                    log.warn("{} 缺少有效 id，已丢弃: {}", traitPath, trait);
                    continue;
                }
                traits.add(standardizeTypeRef((Map<?, ?>) trait, traitPath));
            }
        }
        modelType.put("traits", traits);
        return modelType;
    }

    private Map<String, Object> standardizeTypeRef(Map<?, ?> data, String path) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("id", requiredId(data, "id", path));
        ref.put("name", requiredText(data, "name", path));
        ref.put("description", optionalText(data, "description", path));
        return ref;
    }

    /**
     * @return 规范化的关系；不合法时返回 null（丢弃）
     */
    private Map<String, Object> standardizeRelation(Object raw, String path) {
        if (!(raw instanceof Map)) {
            log.warn("{} 不是结构化数据，已丢弃: {}", path, describe(raw));
            return null;
        }
        Map<?, ?> data = (Map<?, ?>) raw;
        Long relationId = toLong(data.get("relation_id"));
        if (relationId == null) {
            log.warn("{} 缺少有效 relation_id，已丢弃: {}", path, data);
            return null;
        }
        Object direction = data.get("direction");
        if (!RelationDirection.isValid(direction)) {
            log.warn("{} 方向不合法，已丢弃: {}", path, direction);
            return null;
        }

        Map<String, Object> relation = new LinkedHashMap<>();
        relation.put("relation_id", relationId);
        relation.put("relation_name", requiredText(data, "relation_name", path));
        relation.put("direction", direction);
        relation.put("other_model", standardizeModel(data.get("other_model"), path + ".other_model", null));
        relation.put("relation_attributes", standardizeAttributes(data.get("relation_attributes"), path + ".relation_attributes"));
        return relation;
    }

    private Map<String, Object> standardizeAttributes(Object raw, String path) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (raw == null) {
            // 无属性时存储过程返回 null
            return attributes;
        }
        if (!(raw instanceof Map)) {
            log.warn("{} 不是键值映射，已替换为空映射: {}", path, describe(raw));
            return attributes;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            if (entry.getKey() == null) {
                log.warn("{} 含空键，已丢弃", path);
                continue;
            }
            String key = entry.getKey().toString();
            Object value = normalizeScalar(entry.getValue());
            if (value == null) {
                log.warn("{}.{} 不是标量值，已丢弃: {}", path, key, describe(entry.getValue()));
                continue;
            }
            attributes.put(key, value);
        }
        return attributes;
    }

    // ---------------------------------------------------------------- 字段

    private Long requiredId(Map<?, ?> data, String field, String path) {
        Long id = toLong(data.get(field));
        if (id == null) {
            log.warn("{}.{} 缺失或无效，使用默认值 0: {}", path, field, describe(data.get(field)));
            return 0L;
        }
        return id;
    }

    private String requiredText(Map<?, ?> data, String field, String path) {
        String text = toText(data.get(field));
        if (text == null) {
            log.warn("{}.{} 缺失或无效，使用默认值 {}: {}", path, field, UNKNOWN, describe(data.get(field)));
            return UNKNOWN;
        }
        return text;
    }

    private String optionalText(Map<?, ?> data, String field, String path) {
        Object value = data.get(field);
        if (!data.containsKey(field)) {
            log.warn("{}.{} 缺失，使用默认值 null", path, field);
            return null;
        }
        String text = toText(value);
        if (value != null && text == null) {
            log.warn("{}.{} 不是文本，使用默认值 null: {}", path, field, describe(value));
        }
        return text;
    }

    private LocalDateTime requiredTimestamp(Map<?, ?> data, String field, String path) {
        LocalDateTime time = toTimestamp(data.get(field));
        if (time == null) {
            log.warn("{}.{} 缺失或无效，使用当前时间: {}", path, field, describe(data.get(field)));
            return LocalDateTime.now();
        }
        return time;
    }

    static Long toLong(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            BigInteger big = (BigInteger) raw;
            return big.bitLength() < 64 ? big.longValue() : null;
        }
        if (raw instanceof Number) {
            BigDecimal decimal = toDecimal(raw);
            return decimal != null && fitsLong(decimal) ? decimal.longValueExact() : null;
        }
        if (raw instanceof String) {
            try {
                return Long.parseLong(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean fitsLong(BigDecimal decimal) {
        return isIntegral(decimal) && decimal.toBigInteger().bitLength() < 64;
    }

    static String toText(Object raw) {
        if (raw instanceof String) {
            return (String) raw;
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        return null;
    }

    static LocalDateTime toTimestamp(Object raw) {
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (raw instanceof ZonedDateTime) {
            return LocalDateTime.ofInstant(((ZonedDateTime) raw).toInstant(), ZoneOffset.UTC);
        }
        if (raw instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC);
        }
        if (raw instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            try {
                return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } catch (DateTimeParseException notLocal) {
                try {
                    return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                            .withOffsetSameInstant(ZoneOffset.UTC)
                            .toLocalDateTime();
                } catch (DateTimeParseException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * 属性值只保留标量：整数型数字转 Long，其余数字转 BigDecimal，时间转 ISO 文本
     */
    static Object normalizeScalar(Object raw) {
        if (raw instanceof String || raw instanceof Boolean) {
            return raw;
        }
        if (raw instanceof Number) {
            BigDecimal decimal = toDecimal(raw);
            if (decimal == null) {
                return null;
            }
            if (fitsLong(decimal)) {
                return decimal.longValueExact();
            }
            return decimal;
        }
        if (raw instanceof LocalDateTime || raw instanceof OffsetDateTime
                || raw instanceof ZonedDateTime || raw instanceof Instant) {
            return toTimestamp(raw).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        return null;
    }

    private static BigDecimal toDecimal(Object number) {
        try {
            BigDecimal decimal = number instanceof BigDecimal
                    ? (BigDecimal) number
                    : new BigDecimal(number.toString());
            BigDecimal stripped = decimal.stripTrailingZeros();
            return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
        } catch (NumberFormatException e) {
            // NaN / Infinity
            return null;
        }
    }

    private static boolean isIntegral(BigDecimal decimal) {
        return decimal.scale() <= 0;
    }

    private static String describe(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName() + "(" + raw + ")";
    }

    // ---------------------------------------------------------------- 校验

    private boolean isValidModelFullData(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> data = (Map<?, ?>) value;
        if (!isValidModel(data.get("model")) || !isValidAttributes(data.get("attributes"))) {
            return false;
        }
        Object relations = data.get("relations");
        if (!(relations instanceof List)) {
            return false;
        }
        for (Object relation : (List<?>) relations) {
            if (!isValidRelation(relation)) {
                return false;
            }
        }
        return true;
    }

    private boolean isValidRelation(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> relation = (Map<?, ?>) value;
        return relation.get("relation_id") instanceof Number
                && relation.get("relation_name") instanceof String
                && RelationDirection.isValid(relation.get("direction"))
                && isValidModel(relation.get("other_model"))
                && isValidAttributes(relation.get("relation_attributes"));
    }

    private boolean isValidModel(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> model = (Map<?, ?>) value;
        return model.get("id") instanceof Number
                && model.get("title") instanceof String
                && model.containsKey("body") && isTextOrNull(model.get("body"))
                && toTimestamp(model.get("created_at")) != null
                && toTimestamp(model.get("updated_at")) != null
                && isValidModelType(model.get("model_type"));
    }

    private boolean isValidModelType(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> modelType = (Map<?, ?>) value;
        if (!isValidTypeRef(modelType.get("base_model"))) {
            return false;
        }
        Object traits = modelType.get("traits");
        if (!(traits instanceof List)) {
            return false;
        }
        for (Object trait : (List<?>) traits) {
            if (!isValidTypeRef(trait)) {
                return false;
            }
        }
        return true;
    }

    private boolean isValidTypeRef(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> ref = (Map<?, ?>) value;
        return ref.get("id") instanceof Number
                && ref.get("name") instanceof String
                && ref.containsKey("description") && isTextOrNull(ref.get("description"));
    }

    private boolean isValidAttributes(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            Object v = entry.getValue();
            if (!(entry.getKey() instanceof String)
                    || !(v instanceof String || v instanceof Number || v instanceof Boolean)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTextOrNull(Object value) {
        return value == null || value instanceof String;
    }
}
