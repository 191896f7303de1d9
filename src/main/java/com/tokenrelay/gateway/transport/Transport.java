package com.tokenrelay.gateway.transport;

import reactor.core.publisher.Mono;

/**
 * 底层传输
 * <p>
 * 非成功状态以 {@link com.tokenrelay.gateway.exception.TransportException} 结束，
 * 调用方通过 {@code isUnauthorized()} 识别 401
 */
@FunctionalInterface
public interface Transport {

    Mono<RelayResponse> send(RelayRequest request);
}
