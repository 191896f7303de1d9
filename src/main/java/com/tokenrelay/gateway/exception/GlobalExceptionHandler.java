package com.tokenrelay.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;


/**
 * 全局异常处理器
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({RefreshException.class, SessionTerminatedException.class})
    public ResponseEntity<String> handleSessionExpired(RelayGatewayException e) {
        log.warn("会话已失效: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "session_expired", e.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<String> handleUnauthorized(UnauthorizedException e) {
        log.warn("认证失败: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "authentication_error", e.getMessage());
    }

    /**
     * 上游非 401 错误原样透传
     */
    @ExceptionHandler(TransportException.class)
    public ResponseEntity<byte[]> handleTransport(TransportException e) {
        log.warn("上游错误透传: status={}", e.getStatusCode());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatusCode.valueOf(e.getStatusCode()));
        if (e.getContentType() != null) {
            builder.header(HttpHeaders.CONTENT_TYPE, e.getContentType());
        }
        return builder.body(e.getResponseBody());
    }

    @ExceptionHandler(RelayGatewayException.class)
    public ResponseEntity<String> handleGateway(RelayGatewayException e) {
        if (e.getStatusCode() >= 500) {
            log.error("网关异常: {}", e.getMessage(), e);
        } else {
            log.warn("请求无效: {}", e.getMessage());
        }
        return buildErrorResponse(e.getStatusCode(), "gateway_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(statusCode, statusCode == 404 ? "not_found_error" : "http_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject body = JSONObject.of(
                "type", "error", //
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
