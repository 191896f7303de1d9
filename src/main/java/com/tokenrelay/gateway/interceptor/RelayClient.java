package com.tokenrelay.gateway.interceptor;

import com.tokenrelay.gateway.transport.RelayRequest;
import com.tokenrelay.gateway.transport.RelayResponse;
import com.tokenrelay.gateway.transport.Transport;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 调用方入口：依次经过拦截器链后交给底层传输
 */
public class RelayClient {

    private final Transport transport;
    private final List<RequestInterceptor> interceptors;

    public RelayClient(Transport transport, List<RequestInterceptor> interceptors) {
        this.transport = transport;
        this.interceptors = List.copyOf(interceptors);
    }

    public Mono<RelayResponse> exchange(RelayRequest request) {
        return proceed(request, 0);
    }

    private Mono<RelayResponse> proceed(RelayRequest request, int index) {
        if (index >= interceptors.size()) {
            return transport.send(request);
        }
        return interceptors.get(index).intercept(request, next -> proceed(next, index + 1));
    }
}
