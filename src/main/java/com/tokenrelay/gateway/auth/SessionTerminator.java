package com.tokenrelay.gateway.auth;

/**
 * 会话终止能力（登出）
 * <p>
 * 每个失败的刷新周期只调用一次
 */
public interface SessionTerminator {

    void logout();
}
