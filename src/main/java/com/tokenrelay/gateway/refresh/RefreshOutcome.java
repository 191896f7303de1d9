package com.tokenrelay.gateway.refresh;

import com.tokenrelay.gateway.auth.Credential;

/**
 * 协调器交给等待者的结果
 *
 * @param generation 产生该凭证的刷新周期编号（登录得到的凭证为 0）
 * @param credential 用于重放的凭证
 * @param refreshed  true 表示来自一次刚结算的刷新周期；false 表示请求持有的凭证已过期，直接使用当前凭证
 */
public record RefreshOutcome(long generation, Credential credential, boolean refreshed) {

    static RefreshOutcome refreshed(long generation, Credential credential) {
        return new RefreshOutcome(generation, credential, true);
    }

    static RefreshOutcome stale(long generation, Credential current) {
        return new RefreshOutcome(generation, current, false);
    }
}
