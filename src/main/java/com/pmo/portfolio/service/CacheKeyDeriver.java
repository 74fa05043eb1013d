package com.pmo.portfolio.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.pmo.portfolio.constant.CacheConstants;
import com.pmo.portfolio.query.LevelQuery;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 缓存 Key 生成
 * <p>
 * key = pmo_query_ + hex(SHA-256(规范化 SQL + '\0' + 按 key 排序的参数 JSON))
 * 参数顺序无关；JSON 保留值类型，"1" 与 1 生成不同 Key
 */
@Component
public class CacheKeyDeriver {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char SEPARATOR = '\u0000';

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    public String derive(LevelQuery query) {
        return derive(query.sql(), query.parameters());
    }

    public String derive(String queryText, Map<String, ?> params) {
        String material = normalize(queryText) + SEPARATOR + canonicalize(params);
        return CacheConstants.QUERY_KEY_PREFIX + sha256Hex(material);
    }

    static String normalize(String queryText) {
        return queryText == null ? "" : WHITESPACE.matcher(queryText.strip()).replaceAll(" ");
    }

    private String canonicalize(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "{}";
        }
        try {
            return canonicalMapper.writeValueAsString(new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Query parameters are not serializable", e);
        }
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
