package com.tokenrelay.gateway.controller;

import com.tokenrelay.gateway.config.RelayProperties;
import com.tokenrelay.gateway.interceptor.RelayClient;
import com.tokenrelay.gateway.transport.RelayRequest;
import com.tokenrelay.gateway.transport.RelayResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 上游转发端点
 * <p>
 * /relay/** 转发到 relay.upstream.base-url，由 {@link RelayClient} 附加凭证并处理 401 刷新
 */
@RestController
public class RelayController {

    private static final Logger log = LoggerFactory.getLogger(RelayController.class);
    private static final String PREFIX = "/relay";
    // 不转发给上游的请求头，Authorization 由认证拦截器负责
    private static final Set<String> SKIPPED_HEADERS = Set.of("host", "authorization", "content-length", "connection");
    // 不回传给调用方的逐跳响应头，长度和分块由本服务重新决定
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "transfer-encoding", "content-length", "upgrade");

    private final RelayClient relayClient;
    private final RelayProperties properties;

    public RelayController(RelayClient relayClient, RelayProperties properties) {
        this.relayClient = relayClient;
        this.properties = properties;
    }

    @RequestMapping(PREFIX + "/**")
    public Mono<ResponseEntity<byte[]>> relay(@RequestBody(required = false) byte[] body, ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        URI target = buildTarget(request);

        Map<String, List<String>> headers = new LinkedHashMap<>();
        request.getHeaders().forEach((name, values) -> {
            if (!SKIPPED_HEADERS.contains(name.toLowerCase())) {
                headers.put(name, values);
            }
        });

        RelayRequest relayRequest = new RelayRequest(request.getMethod().name(), target, headers, body);
        log.debug("转发请求: {}", relayRequest);

        return relayClient.exchange(relayRequest).map(RelayController::toEntity);
    }

    private URI buildTarget(ServerHttpRequest request) {
        String path = request.getPath().pathWithinApplication().value().substring(PREFIX.length());
        String query = request.getURI().getRawQuery();

        String baseUrl = properties.getUpstream().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return URI.create(baseUrl + path + (query != null ? "?" + query : ""));
    }

    private static ResponseEntity<byte[]> toEntity(RelayResponse response) {
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach((name, values) -> {
            // HTTP/2 伪头以冒号开头
            if (!name.startsWith(":") && !HOP_BY_HOP_HEADERS.contains(name.toLowerCase())) {
                headers.addAll(name, values);
            }
        });
        return ResponseEntity.status(HttpStatusCode.valueOf(response.statusCode()))
                .headers(headers)
                .body(response.body());
    }
}
