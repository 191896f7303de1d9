package com.tokenrelay.gateway.interceptor;

import com.tokenrelay.gateway.transport.RelayRequest;
import com.tokenrelay.gateway.transport.RelayResponse;
import com.tokenrelay.gateway.transport.Transport;
import reactor.core.publisher.Mono;

/**
 * 请求拦截器
 * <p>
 * {@code next} 可被调用多次（重放）
 */
public interface RequestInterceptor {

    Mono<RelayResponse> intercept(RelayRequest request, Transport next);
}
