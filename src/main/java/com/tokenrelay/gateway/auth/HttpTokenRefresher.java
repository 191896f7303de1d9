package com.tokenrelay.gateway.auth;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.tokenrelay.gateway.exception.RefreshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 通过身份服务的 refresh 端点刷新 Token
 * <p>
 * 请求体 {"refreshToken": "..."}，响应 {"accessToken", "refreshToken", "expiresIn"}
 */
public class HttpTokenRefresher implements TokenRefresher {

    private static final Logger log = LoggerFactory.getLogger(HttpTokenRefresher.class);
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final URI tokenEndpoint;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpTokenRefresher(URI tokenEndpoint, HttpClient httpClient, Duration requestTimeout) {
        this.tokenEndpoint = tokenEndpoint;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<TokenResult> refresh(String refreshToken) {
        JSONObject body = JSONObject.of(
                "refreshToken", refreshToken //
        );

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(tokenEndpoint)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()));
        // 非正数超时表示不限制
        if (requestTimeout != null && !requestTimeout.isZero() && !requestTimeout.isNegative()) {
            builder.timeout(requestTimeout);
        }
        HttpRequest request = builder.build();

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
                .map(response -> parse(response, refreshToken))
                .onErrorMap(e -> !(e instanceof RefreshException),
                        e -> new RefreshException("Token 刷新异常: " + e.getMessage(), e));
    }

    private TokenResult parse(HttpResponse<String> response, String refreshToken) {
        if (response.statusCode() != 200) {
            log.error("Token 刷新失败: status={}, body={}", response.statusCode(), response.body());
            throw new RefreshException("Token 刷新失败: " + response.statusCode());
        }

        JSONObject json;
        try {
            json = JSONObject.parseObject(response.body());
        } catch (JSONException e) {
            throw new RefreshException("Token 刷新响应不是合法 JSON", e);
        }
        if (json == null) {
            throw new RefreshException("Token 刷新响应为空");
        }

        String accessToken = json.getString("accessToken");
        String newRefreshToken = json.getString("refreshToken");
        long expiresIn = json.getLongValue("expiresIn", DEFAULT_EXPIRES_IN);

        if (accessToken == null || accessToken.isEmpty()) {
            throw new RefreshException("刷新未返回 accessToken");
        }

        log.debug("Token 刷新成功: expiresIn={}s", expiresIn);
        return new TokenResult(accessToken, newRefreshToken != null ? newRefreshToken : refreshToken, expiresIn);
    }
}
