package com.tokenrelay.gateway.interceptor;

/**
 * 刷新进行中时新请求的处理方式（全局统一，不按请求路径混用）
 */
public enum QueueStrategy {

    /**
     * 照常发送，收到 401 后再加入刷新周期
     */
    RETRY_AFTER_UNAUTHORIZED,

    /**
     * 有刷新在途时先排队，周期结算后携带新凭证只发送一次；刷新失败则不发送
     */
    HOLD_WHILE_REFRESHING;

    public static QueueStrategy of(String name) {
        return switch (name.toLowerCase().replace('_', '-')) {
            case "retry-after-unauthorized", "retry" -> RETRY_AFTER_UNAUTHORIZED;
            case "hold-while-refreshing", "hold" -> HOLD_WHILE_REFRESHING;
            default -> throw new IllegalArgumentException("不支持的排队策略: " + name);
        };
    }
}
