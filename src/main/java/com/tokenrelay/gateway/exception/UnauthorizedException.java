package com.tokenrelay.gateway.exception;

/**
 * 无法恢复的 401（未登录、重放次数耗尽等）
 * <p>
 * 单次 401 不会触发登出，只会以此异常转交给调用方
 */
public class UnauthorizedException extends RelayGatewayException {

    public UnauthorizedException(String message) {
        super(message, 401);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, 401, cause);
    }
}
