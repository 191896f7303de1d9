package com.tokenrelay.gateway.exception;

import lombok.Getter;

/**
 * Token Relay 异常基类
 */
@Getter
public class RelayGatewayException extends RuntimeException {

    private final int statusCode;

    public RelayGatewayException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public RelayGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RelayGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public RelayGatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
