package com.sqlitesession.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sqlitesession.types.enums.ResponseCode;
import com.sqlitesession.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * JSON 编解码工具。
 * <p>
 * 实体以 snake_case 键的 JSON 文档存入 TEXT 列；Map 载荷的键原样保留。
 * 注入的 ObjectMapper 会被复制，不影响容器内其他使用方。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-01
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    /**
     * 创建 JsonCodec。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 非容器环境下使用的默认实例。
     */
    public static JsonCodec create() {
        return new JsonCodec(new ObjectMapper());
    }

    /**
     * 读取 JSON 为 Map。
     */
    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    /**
     * 读取 JSON 为指定类型。
     */
    public <T> T readValue(String json, Class<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 读取 JSON 为指定类型。
     */
    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }

    /**
     * 实体转换为键值文档。
     */
    public Map<String, Object> toDocument(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, MAP_REF);
    }

    /**
     * 键值文档转换为实体。
     */
    public <T> T fromDocument(Map<String, Object> document, Class<T> targetType) {
        if (document == null) {
            return null;
        }
        return objectMapper.convertValue(document, targetType);
    }
}
