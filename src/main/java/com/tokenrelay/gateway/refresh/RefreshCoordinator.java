package com.tokenrelay.gateway.refresh;

import com.tokenrelay.gateway.auth.Credential;
import com.tokenrelay.gateway.auth.CredentialStore;
import com.tokenrelay.gateway.auth.SessionTerminator;
import com.tokenrelay.gateway.exception.RefreshException;
import com.tokenrelay.gateway.exception.SessionTerminatedException;
import com.tokenrelay.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 凭证刷新协调器（single-flight）
 * <p>
 * - 同一时间最多一个刷新周期在途，期间所有 401 请求加入同一周期的等待队列（FIFO）
 * <p>
 * - 周期结算时一次性广播结果：成功时所有等待者拿到同一个凭证实例，失败时拿到同一个异常实例
 * <p>
 * - 刷新失败清除凭证并只登出一次，与等待者数量无关
 * <p>
 * - 凭证只经由本类写入：登录 {@link #install}、登出 {@link #endSession} 与周期结算。
 * 刷新在途时登录或登出会放弃该周期，之后到达的刷新结果直接丢弃
 * <p>
 * 过期判断、周期注册、结算以及登录登出都在同一把锁内完成，不会出现两个请求同时看到“无在途周期”而重复刷新
 */
public class RefreshCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final CredentialStore credentialStore;
    private final SessionTerminator sessionTerminator;
    private final Duration refreshTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    // 以下字段受 lock 保护
    private RefreshCycle inFlight;
    private long nextGeneration = 1;
    private long lastSettledGeneration;
    private long completedCycles;

    /**
     * @param refreshTimeout 刷新调用超时，null 或 0 表示不限制
     */
    public RefreshCoordinator(CredentialStore credentialStore, SessionTerminator sessionTerminator,
                              Duration refreshTimeout) {
        this.credentialStore = credentialStore;
        this.sessionTerminator = sessionTerminator;
        this.refreshTimeout = refreshTimeout;
    }

    /**
     * 触发或加入刷新
     * <p>
     * 若 {@code credentialAtSend} 已不是当前凭证（其他请求已完成刷新），直接返回当前凭证，不发起刷新；
     * 否则加入在途周期，没有在途周期时新建一个并调用 {@link CredentialStore#refresh()}
     *
     * @param credentialAtSend 收到 401 的那次请求所携带的凭证，未携带时为 null
     * @return 刷新结果；刷新失败时以共享的 {@link RefreshException} 结束，会话已结束时以
     * {@link SessionTerminatedException} 结束
     */
    public Mono<RefreshOutcome> triggerOrJoin(Credential credentialAtSend) {
        return Mono.create(sink -> {
            RefreshOutcome immediate = null;
            RefreshCycle started = null;
            boolean terminated = false;

            lock.lock();
            try {
                Optional<Credential> current = credentialStore.current();
                if (current.isEmpty()) {
                    terminated = true;
                } else if (!current.get().sameToken(credentialAtSend)) {
                    immediate = RefreshOutcome.stale(lastSettledGeneration, current.get());
                } else {
                    if (inFlight == null) {
                        inFlight = new RefreshCycle(nextGeneration++);
                        inFlight.start();
                        started = inFlight;
                    }
                    int position = inFlight.register(sink);
                    log.debug("加入刷新周期 #{}: 第 {} 个等待者", inFlight.generation(), position);
                }
            } finally {
                lock.unlock();
            }

            // 回调放到锁外，避免下游在持锁状态下继续发请求
            if (terminated) {
                sink.error(new SessionTerminatedException("会话已结束，无法刷新凭证"));
            } else if (immediate != null) {
                log.debug("凭证已被其他请求刷新，跳过刷新: {} -> {}",
                        credentialAtSend != null ? credentialAtSend.maskedAccessToken() : "none",
                        immediate.credential().maskedAccessToken());
                sink.success(immediate);
            } else if (started != null) {
                launch(started);
            }
        });
    }

    /**
     * 等待在途周期的结果
     * <p>
     * 没有在途周期时立即以空结束，调用方照常发送请求
     */
    public Mono<RefreshOutcome> awaitInFlight() {
        return Mono.create(sink -> {
            boolean joined = false;
            lock.lock();
            try {
                if (inFlight != null) {
                    int position = inFlight.register(sink);
                    joined = true;
                    log.debug("刷新进行中，请求排队等待周期 #{}: 第 {} 个等待者", inFlight.generation(), position);
                }
            } finally {
                lock.unlock();
            }
            if (!joined) {
                sink.success();
            }
        });
    }

    /**
     * 登录：写入新凭证
     * <p>
     * 刷新在途时该周期被放弃，等待者直接拿到新凭证（按过期凭证处理，重发一次）
     */
    public void install(Credential credential) {
        RefreshCycle abandoned;
        List<MonoSink<RefreshOutcome>> waiters;
        RefreshOutcome outcome;

        lock.lock();
        try {
            credentialStore.setCredential(credential);
            outcome = RefreshOutcome.stale(lastSettledGeneration, credential);
            abandoned = inFlight;
            waiters = abandonInFlight();
        } finally {
            lock.unlock();
        }

        if (abandoned != null) {
            log.info("重新登录，放弃在途刷新周期 #{}: 等待者 {} 个改用新凭证", abandoned.generation(), waiters.size());
        }
        for (MonoSink<RefreshOutcome> waiter : waiters) {
            waiter.success(outcome);
        }
    }

    /**
     * 主动登出：清除凭证
     * <p>
     * 刷新在途时该周期被放弃，等待者以 {@link SessionTerminatedException} 结束，刷新结果不会写回
     *
     * @return 登出前是否存在会话
     */
    public boolean endSession() {
        boolean hadSession;
        RefreshCycle abandoned;
        List<MonoSink<RefreshOutcome>> waiters;

        lock.lock();
        try {
            hadSession = credentialStore.current().isPresent();
            credentialStore.clear();
            abandoned = inFlight;
            waiters = abandonInFlight();
        } finally {
            lock.unlock();
        }

        if (abandoned != null) {
            log.info("主动登出，放弃在途刷新周期 #{}: 等待者 {} 个", abandoned.generation(), waiters.size());
            SessionTerminatedException terminated = new SessionTerminatedException("会话已登出");
            for (MonoSink<RefreshOutcome> waiter : waiters) {
                waiter.error(terminated);
            }
        }
        return hadSession;
    }

    public boolean isRefreshing() {
        lock.lock();
        try {
            return inFlight != null;
        } finally {
            lock.unlock();
        }
    }

    public long completedCycles() {
        lock.lock();
        try {
            return completedCycles;
        } finally {
            lock.unlock();
        }
    }

    private void launch(RefreshCycle cycle) {
        log.info("开始刷新凭证: 周期 #{}", cycle.generation());

        Mono<Credential> refresh = Mono.defer(credentialStore::refresh);
        if (refreshTimeout != null && !refreshTimeout.isZero() && !refreshTimeout.isNegative()) {
            refresh = refresh.timeout(refreshTimeout);
        }

        refresh.switchIfEmpty(Mono.error(() -> new RefreshException("刷新未返回凭证")))
                .subscribe(
                        credential -> settleSuccess(cycle, credential),
                        error -> settleFailure(cycle, error)
                );
    }

    private void settleSuccess(RefreshCycle cycle, Credential credential) {
        RefreshOutcome outcome = RefreshOutcome.refreshed(cycle.generation(), credential);
        List<MonoSink<RefreshOutcome>> waiters = null;

        // 写入凭证与退役周期在同一临界区，之后到达的 401 要么看到新凭证（过期判断），要么开启新周期
        lock.lock();
        try {
            if (!cycle.state().isSettled()) {
                credentialStore.setCredential(credential);
                waiters = cycle.succeed();
                retire(cycle);
            }
        } finally {
            lock.unlock();
        }

        if (waiters == null) {
            discard(cycle, "成功");
            return;
        }

        Metrics.instance().recordRefresh(true, waiters.size(), cycle.elapsedMs());
        log.info("凭证刷新成功: 周期 #{}, 新 token={}, 等待者 {} 个, 耗时 {}ms",
                cycle.generation(), credential.maskedAccessToken(), waiters.size(), cycle.elapsedMs());

        for (MonoSink<RefreshOutcome> waiter : waiters) {
            waiter.success(outcome);
        }
    }

    private void settleFailure(RefreshCycle cycle, Throwable error) {
        RefreshException failure = toRefreshException(error);
        List<MonoSink<RefreshOutcome>> waiters = null;

        lock.lock();
        try {
            if (!cycle.state().isSettled()) {
                credentialStore.clear();
                waiters = cycle.fail();
                retire(cycle);
            }
        } finally {
            lock.unlock();
        }

        if (waiters == null) {
            discard(cycle, "失败: " + failure.getMessage());
            return;
        }

        Metrics.instance().recordRefresh(false, waiters.size(), cycle.elapsedMs());
        log.error("凭证刷新失败: 周期 #{}, 等待者 {} 个, 原因: {}",
                cycle.generation(), waiters.size(), failure.getMessage());

        // 每个失败周期只登出一次；登出异常不能阻止等待者被释放
        try {
            sessionTerminator.logout();
        } catch (RuntimeException e) {
            log.error("执行登出失败: 周期 #{}", cycle.generation(), e);
        }

        for (MonoSink<RefreshOutcome> waiter : waiters) {
            waiter.error(failure);
        }
    }

    // 调用方持有 lock
    private List<MonoSink<RefreshOutcome>> abandonInFlight() {
        if (inFlight == null) {
            return List.of();
        }
        List<MonoSink<RefreshOutcome>> waiters = inFlight.abandon();
        inFlight = null;
        return waiters;
    }

    private void discard(RefreshCycle cycle, String result) {
        Metrics.instance().increment("refresh_discarded_total");
        log.info("刷新周期 #{} 已被放弃，丢弃刷新结果（{}）", cycle.generation(), result);
    }

    private void retire(RefreshCycle cycle) {
        if (inFlight == cycle) {
            inFlight = null;
        }
        lastSettledGeneration = cycle.generation();
        completedCycles++;
    }

    private static RefreshException toRefreshException(Throwable error) {
        if (error instanceof RefreshException refreshException) {
            return refreshException;
        }
        if (error instanceof TimeoutException) {
            return new RefreshException("凭证刷新超时", error);
        }
        return new RefreshException("凭证刷新失败: " + error.getMessage(), error);
    }
}
