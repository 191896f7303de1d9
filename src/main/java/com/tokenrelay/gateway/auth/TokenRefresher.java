package com.tokenrelay.gateway.auth;

import reactor.core.publisher.Mono;

/**
 * Token 刷新接口
 * <p>
 * 不同身份服务实现不同的刷新逻辑
 */
public interface TokenRefresher {

    /**
     * 刷新 access token
     *
     * @param refreshToken 刷新令牌
     * @return 刷新结果，失败时以 {@link com.tokenrelay.gateway.exception.RefreshException} 结束
     */
    Mono<TokenResult> refresh(String refreshToken);

    /**
     * 刷新结果
     *
     * @param accessToken      新的访问令牌
     * @param refreshToken     新的刷新令牌（部分服务会轮换）
     * @param expiresInSeconds 过期时间（秒）
     */
    record TokenResult(String accessToken, String refreshToken, long expiresInSeconds) {}
}
