package com.tokenrelay.gateway.transport;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 发往上游的请求（不可变）
 * <p>
 * 除 Authorization 外，头和请求体原样透传
 *
 * @param method  HTTP 方法
 * @param uri     目标地址
 * @param headers 请求头（大小写不敏感）
 * @param body    请求体，可能为空数组
 */
public record RelayRequest(String method, URI uri, Map<String, List<String>> headers, byte[] body) {

    public static final String AUTHORIZATION = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    public RelayRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = copyHeaders(headers);
        body = body != null ? body : new byte[0];
    }

    public static RelayRequest get(URI uri) {
        return new RelayRequest("GET", uri, Map.of(), null);
    }

    /**
     * 替换 Authorization 头
     */
    public RelayRequest withBearer(String accessToken) {
        Map<String, List<String>> copy = copyHeaders(headers);
        copy.put(AUTHORIZATION, List.of(BEARER_PREFIX + accessToken));
        return new RelayRequest(method, uri, copy, body);
    }

    public RelayRequest withoutAuthorization() {
        if (!headers.containsKey(AUTHORIZATION)) {
            return this;
        }
        Map<String, List<String>> copy = copyHeaders(headers);
        copy.remove(AUTHORIZATION);
        return new RelayRequest(method, uri, copy, body);
    }

    /**
     * 当前附带的 Bearer token，没有时返回 null
     */
    public String bearerToken() {
        String value = header(AUTHORIZATION);
        if (value == null || !value.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return value.substring(BEARER_PREFIX.length());
    }

    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Override
    public Map<String, List<String>> headers() {
        return Collections.unmodifiableMap(headers);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        return copy;
    }
}
