package com.nexus.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import com.nexus.domain.value.AttributeValue;
import com.nexus.enums.ValueType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 属性值校验：值类型必须与定义一致，并满足定义上的结构约束
 *
 * 支持的约束：min / max（数字），maxLength / pattern（字符串），enum（任意标量）
 */
@Component
public class AttributeValueChecker {

    private static final Logger logger = LoggerFactory.getLogger(AttributeValueChecker.class);

    /** 数字列为 NUMERIC(38,10) */
    static final int NUMBER_SCALE = 10;
    static final int NUMBER_INTEGER_DIGITS = 28;

    @Autowired
    private ObjectMapper objectMapper;

    public void check(String key, String declaredType, String constraintsJson, AttributeValue value) {
        ValueType declared = ValueType.fromCode(declaredType);
        if (value.getType() != declared) {
            throw new GraphStoreException(ErrorCode.TYPE_MISMATCH,
                    "属性 " + key + " 声明为 " + declared.getCode() + "，实际值类型为 " + value.getType().getCode());
        }
        if (declared == ValueType.NUMBER) {
            checkStorable(key, value.asNumber());
        }
        Map<String, Object> constraints = readConstraints(key, constraintsJson);
        if (constraints.isEmpty()) {
            return;
        }

        if (declared == ValueType.NUMBER) {
            BigDecimal number = value.asNumber();
            BigDecimal min = decimal(constraints.get("min"));
            BigDecimal max = decimal(constraints.get("max"));
            if (min != null && number.compareTo(min) < 0) {
                throw violation(key, "小于最小值 " + min.toPlainString());
            }
            if (max != null && number.compareTo(max) > 0) {
                throw violation(key, "大于最大值 " + max.toPlainString());
            }
        }

        if (declared == ValueType.STRING) {
            String text = value.asString();
            Object maxLength = constraints.get("maxLength");
            if (maxLength instanceof Number && text.length() > ((Number) maxLength).intValue()) {
                throw violation(key, "长度超过 " + maxLength);
            }
            Object pattern = constraints.get("pattern");
            if (pattern instanceof String && !Pattern.compile((String) pattern).matcher(text).matches()) {
                throw violation(key, "不匹配模式 " + pattern);
            }
        }

        Object allowed = constraints.get("enum");
        if (allowed instanceof Collection && !containsPlain((Collection<?>) allowed, value)) {
            throw violation(key, "不在允许的取值范围 " + allowed);
        }
    }

    /**
     * 超出列精度的数字会被数据库静默舍入，而唯一键按未舍入的值计算，因此直接拒绝
     */
    private static void checkStorable(String key, BigDecimal number) {
        if (number.scale() > NUMBER_SCALE) {
            throw violation(key, "小数位超过 " + NUMBER_SCALE + " 位: " + number.toPlainString());
        }
        if (number.precision() - number.scale() > NUMBER_INTEGER_DIGITS) {
            throw violation(key, "整数位超过 " + NUMBER_INTEGER_DIGITS + " 位: " + number.toPlainString());
        }
    }

    private boolean containsPlain(Collection<?> allowed, AttributeValue value) {
        Object plain = value.toPlainValue();
        for (Object candidate : allowed) {
            if (candidate == null) {
                continue;
            }
            if (candidate instanceof Number && value.getType() == ValueType.NUMBER) {
                if (decimal(candidate).compareTo(value.asNumber()) == 0) {
                    return true;
                }
            } else if (candidate.toString().equals(plain.toString())) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> readConstraints(String key, String constraintsJson) {
        if (StringUtils.isBlank(constraintsJson)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(constraintsJson, new TypeReference<Map<String, Object>>() {});
            return parsed == null ? Collections.emptyMap() : parsed;
        } catch (JsonProcessingException e) {
            // 约束损坏时不阻塞写入
            logger.warn("属性 {} 的约束无法解析，已忽略: {}", key, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private static BigDecimal decimal(Object raw) {
        if (raw instanceof Number) {
            return new BigDecimal(raw.toString());
        }
        return null;
    }

    private static GraphStoreException violation(String key, String detail) {
        return new GraphStoreException(ErrorCode.CONSTRAINT_VIOLATION, "属性 " + key + " 的值" + detail);
    }
}
