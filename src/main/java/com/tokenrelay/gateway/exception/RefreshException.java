package com.tokenrelay.gateway.exception;

/**
 * 凭证刷新失败
 * <p>
 * 同一刷新周期内的所有等待者收到的是同一个实例
 */
public class RefreshException extends RelayGatewayException {

    public RefreshException(String message) {
        super(message, 401);
    }

    public RefreshException(String message, Throwable cause) {
        super(message, 401, cause);
    }
}
