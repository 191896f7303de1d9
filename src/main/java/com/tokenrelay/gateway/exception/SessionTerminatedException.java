package com.tokenrelay.gateway.exception;

/**
 * 会话已结束（未登录或已登出），无法再为请求附加凭证
 */
public class SessionTerminatedException extends RelayGatewayException {

    public SessionTerminatedException(String message) {
        super(message, 401);
    }

    public SessionTerminatedException(String message, Throwable cause) {
        super(message, 401, cause);
    }
}
