package com.tokenrelay.gateway.transport;

import com.tokenrelay.gateway.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 基于 JDK HttpClient 的异步传输
 */
public class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    // JDK HttpClient 不允许手动设置的头
    private static final Set<String> RESTRICTED_HEADERS = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    static {
        RESTRICTED_HEADERS.addAll(List.of("connection", "content-length", "expect", "host", "upgrade"));
    }

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<RelayResponse> send(RelayRequest request) {
        return Mono.fromFuture(() -> httpClient.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray()))
                .onErrorMap(e -> !(e instanceof TransportException),
                        e -> new TransportException(502, "上游请求失败: " + e.getMessage(), e))
                .flatMap(response -> {
                    int statusCode = response.statusCode();
                    if (statusCode >= 400) {
                        log.debug("上游返回错误: {} -> status={}", request, statusCode);
                        String contentType = response.headers().firstValue("Content-Type").orElse(null);
                        return Mono.error(new TransportException(statusCode, response.body(), contentType));
                    }
                    return Mono.just(new RelayResponse(statusCode, response.headers().map(), response.body()));
                });
    }

    private HttpRequest buildRequest(RelayRequest request) {
        HttpRequest.BodyPublisher publisher = request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method(), publisher);
        // HttpRequest 不接受非正数超时，此时不限制
        if (requestTimeout != null && !requestTimeout.isZero() && !requestTimeout.isNegative()) {
            builder.timeout(requestTimeout);
        }

        for (Map.Entry<String, List<String>> header : request.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey())) {
                continue;
            }
            for (String value : header.getValue()) {
                builder.header(header.getKey(), value);
            }
        }
        return builder.build();
    }
}
