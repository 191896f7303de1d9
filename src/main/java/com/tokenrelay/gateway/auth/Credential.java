package com.tokenrelay.gateway.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * 当前会话凭证
 * <p>
 * 判断是否过期（stale）只比较 accessToken，refreshToken / expiresAt 仅供刷新使用
 *
 * @param accessToken  Bearer 访问令牌
 * @param refreshToken 刷新令牌（可能为空）
 * @param expiresAt    过期时间（可能为空）
 */
public record Credential(String accessToken, String refreshToken, Instant expiresAt) {

    public Credential {
        Objects.requireNonNull(accessToken, "accessToken");
        if (accessToken.isEmpty()) {
            throw new IllegalArgumentException("accessToken 不能为空");
        }
    }

    public static Credential of(String accessToken, String refreshToken) {
        return new Credential(accessToken, refreshToken, null);
    }

    public boolean sameToken(Credential other) {
        return other != null && accessToken.equals(other.accessToken);
    }

    public String maskedAccessToken() {
        return mask(accessToken);
    }

    // 脱敏 token，只保留前8位
    public static String mask(String token) {
        if (token == null) {
            return "none";
        }
        return token.length() > 8 ? token.substring(0, 8) + "***" : "***";
    }

    @Override
    public String toString() {
        return "Credential[accessToken=" + mask(accessToken)
                + ", refreshToken=" + (refreshToken != null ? "***" : "none")
                + ", expiresAt=" + expiresAt + "]";
    }
}
