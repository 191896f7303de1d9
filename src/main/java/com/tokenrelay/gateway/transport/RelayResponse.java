package com.tokenrelay.gateway.transport;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 上游响应
 *
 * @param statusCode HTTP 状态码
 * @param headers    响应头
 * @param body       响应体
 */
public record RelayResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public RelayResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : new byte[0];
    }

    public static RelayResponse ok(String body) {
        return new RelayResponse(200, Map.of("Content-Type", List.of("application/json")),
                body.getBytes(StandardCharsets.UTF_8));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
