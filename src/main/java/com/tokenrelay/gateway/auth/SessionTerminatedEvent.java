package com.tokenrelay.gateway.auth;

import java.time.Instant;

/**
 * 会话终止事件，供重定向 / 登录页等上层监听
 *
 * @param reason       终止原因
 * @param terminatedAt 终止时间
 */
public record SessionTerminatedEvent(String reason, Instant terminatedAt) {}
