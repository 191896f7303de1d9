package com.tokenrelay.gateway.refresh;

import reactor.core.publisher.MonoSink;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次刷新尝试
 * <p>
 * 状态只能 IDLE → IN_FLIGHT → SUCCEEDED / FAILED / ABANDONED 单向流转，只结算一次。
 * 非线程安全，所有方法都在 {@link RefreshCoordinator} 的锁内调用
 */
final class RefreshCycle {

    private final long generation;
    private final List<MonoSink<RefreshOutcome>> waiters = new ArrayList<>();

    private RefreshState state = RefreshState.IDLE;
    private long startedAtMs;

    RefreshCycle(long generation) {
        this.generation = generation;
    }

    void start() {
        if (state != RefreshState.IDLE) {
            throw new IllegalStateException("刷新周期 #" + generation + " 已启动: " + state);
        }
        state = RefreshState.IN_FLIGHT;
        startedAtMs = System.currentTimeMillis();
    }

    /**
     * 追加等待者（FIFO）
     *
     * @return 该等待者在本周期中的序号，从 1 开始
     */
    int register(MonoSink<RefreshOutcome> waiter) {
        if (state != RefreshState.IN_FLIGHT) {
            throw new IllegalStateException("刷新周期 #" + generation + " 不接受新的等待者: " + state);
        }
        waiters.add(waiter);
        return waiters.size();
    }

    /**
     * 标记成功并交出全部等待者
     */
    List<MonoSink<RefreshOutcome>> succeed() {
        settle(RefreshState.SUCCEEDED);
        return drainWaiters();
    }

    /**
     * 标记失败并交出全部等待者
     */
    List<MonoSink<RefreshOutcome>> fail() {
        settle(RefreshState.FAILED);
        return drainWaiters();
    }

    /**
     * 会话在刷新期间被替换或结束：交出全部等待者，之后到达的刷新结果不再生效
     */
    List<MonoSink<RefreshOutcome>> abandon() {
        settle(RefreshState.ABANDONED);
        return drainWaiters();
    }

    private void settle(RefreshState target) {
        if (state != RefreshState.IN_FLIGHT) {
            throw new IllegalStateException("刷新周期 #" + generation + " 无法从 " + state + " 结算为 " + target);
        }
        state = target;
    }

    private List<MonoSink<RefreshOutcome>> drainWaiters() {
        List<MonoSink<RefreshOutcome>> released = List.copyOf(waiters);
        waiters.clear();
        return released;
    }

    long generation() {
        return generation;
    }

    RefreshState state() {
        return state;
    }

    long elapsedMs() {
        return System.currentTimeMillis() - startedAtMs;
    }
}
