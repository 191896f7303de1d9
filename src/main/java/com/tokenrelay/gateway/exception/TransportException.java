package com.tokenrelay.gateway.exception;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 上游调用异常
 * <p>
 * 4xx/5xx 响应以及网络错误都会转换为此异常，401 由认证拦截器处理，其余原样透传。
 * 响应体保留原始字节
 */
@Getter
public class TransportException extends RelayGatewayException {

    private static final int MESSAGE_BODY_LIMIT = 200;

    private final byte[] responseBody;
    // 上游响应的 Content-Type，网络错误时为 null
    private final String contentType;

    public TransportException(int statusCode, byte[] responseBody, String contentType) {
        super("上游错误: " + statusCode + " - " + preview(responseBody), statusCode);
        this.responseBody = responseBody != null ? responseBody : new byte[0];
        this.contentType = contentType;
    }

    public TransportException(int statusCode, String responseBody) {
        this(statusCode, responseBody.getBytes(StandardCharsets.UTF_8), null);
    }

    public TransportException(int statusCode, String responseBody, Throwable cause) {
        super("上游错误: " + statusCode + " - " + responseBody, statusCode, cause);
        this.responseBody = responseBody.getBytes(StandardCharsets.UTF_8);
        this.contentType = null;
    }

    public String responseBodyAsString() {
        return new String(responseBody, StandardCharsets.UTF_8);
    }

    public boolean isUnauthorized() {
        return getStatusCode() == 401;
    }

    public boolean isServerError() {
        return getStatusCode() >= 500;
    }

    private static String preview(byte[] body) {
        if (body == null) {
            return "";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > MESSAGE_BODY_LIMIT ? text.substring(0, MESSAGE_BODY_LIMIT) + "..." : text;
    }
}
