package com.tokenrelay.gateway.interceptor;

import com.tokenrelay.gateway.transport.RelayRequest;

/**
 * 单个调用方请求在拦截器中的状态
 * <p>
 * 同一请求的各次尝试在响应式链上串行执行，不存在并发访问
 */
final class PendingRequest {

    private final RelayRequest original;
    private final long arrivalOrder;

    private int attempts;
    private int replays;
    // 最近一次据以重放的刷新周期编号
    private long lastReplayedGeneration = -1;

    PendingRequest(RelayRequest original, long arrivalOrder) {
        this.original = original;
        this.arrivalOrder = arrivalOrder;
    }

    RelayRequest original() {
        return original;
    }

    void recordAttempt() {
        attempts++;
    }

    int attempts() {
        return attempts;
    }

    int replays() {
        return replays;
    }

    /**
     * 是否已经用该周期（或更早周期）的结果重放过
     */
    boolean alreadyReplayedFor(long generation) {
        return generation <= lastReplayedGeneration;
    }

    void markReplayed(long generation) {
        replays++;
        lastReplayedGeneration = generation;
    }

    void markRedispatched() {
        replays++;
    }

    @Override
    public String toString() {
        return "#" + arrivalOrder + " " + original;
    }
}
