package com.tokenrelay.gateway.interceptor;

import com.tokenrelay.gateway.auth.Credential;
import com.tokenrelay.gateway.auth.CredentialStore;
import com.tokenrelay.gateway.exception.TransportException;
import com.tokenrelay.gateway.exception.UnauthorizedException;
import com.tokenrelay.gateway.refresh.RefreshCoordinator;
import com.tokenrelay.gateway.refresh.RefreshOutcome;
import com.tokenrelay.gateway.transport.RelayRequest;
import com.tokenrelay.gateway.transport.RelayResponse;
import com.tokenrelay.gateway.transport.Transport;
import com.tokenrelay.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 认证拦截器
 * <p>
 * 附加当前凭证 → 发送 → 401 时：
 * <p>
 * 1. 发送时的凭证已被替换：直接用当前凭证重发，不触发刷新
 * <p>
 * 2. 否则交给 {@link RefreshCoordinator} 触发或加入刷新，拿到新凭证后重放；刷新失败则不再重试，
 * 以协调器广播的异常结束（登出已由协调器完成）
 * <p>
 * 本类从不写入凭证
 */
public class AuthInterceptor implements RequestInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthInterceptor.class);

    private final CredentialStore credentialStore;
    private final RefreshCoordinator coordinator;
    private final QueueStrategy queueStrategy;
    private final int maxReplays;
    private final AtomicLong arrivalSequence = new AtomicLong();

    /**
     * @param maxReplays 单个请求最多重放次数（包括过期凭证的直接重发）
     */
    public AuthInterceptor(CredentialStore credentialStore, RefreshCoordinator coordinator,
                           QueueStrategy queueStrategy, int maxReplays) {
        this.credentialStore = credentialStore;
        this.coordinator = coordinator;
        this.queueStrategy = queueStrategy;
        this.maxReplays = maxReplays;
    }

    @Override
    public Mono<RelayResponse> intercept(RelayRequest request, Transport next) {
        return Mono.defer(() -> {
            PendingRequest pending = new PendingRequest(request, arrivalSequence.incrementAndGet());
            return initialCredential(pending)
                    .flatMap(credential -> dispatch(pending, credential.orElse(null), next));
        });
    }

    private Mono<Optional<Credential>> initialCredential(PendingRequest pending) {
        Mono<Optional<Credential>> current = Mono.fromSupplier(credentialStore::current);
        if (queueStrategy != QueueStrategy.HOLD_WHILE_REFRESHING) {
            return current;
        }
        // 刷新在途时先排队，结算后用新凭证发送；刷新失败时排队的请求一并失败
        return coordinator.awaitInFlight()
                .doOnNext(outcome -> {
                    Metrics.instance().increment("requests_held");
                    log.debug("请求 {} 排队结束，使用周期 #{} 的凭证发送", pending, outcome.generation());
                })
                .map(outcome -> Optional.of(outcome.credential()))
                .switchIfEmpty(current);
    }

    private Mono<RelayResponse> dispatch(PendingRequest pending, Credential credential, Transport next) {
        RelayRequest outgoing = credential != null
                ? pending.original().withBearer(credential.accessToken())
                : pending.original().withoutAuthorization();
        pending.recordAttempt();

        return next.send(outgoing)
                .onErrorResume(AuthInterceptor::isUnauthorized,
                        e -> recover(pending, credential, (TransportException) e, next));
    }

    private Mono<RelayResponse> recover(PendingRequest pending, Credential credentialAtSend,
                                        TransportException unauthorized, Transport next) {
        if (credentialAtSend == null && credentialStore.current().isEmpty()) {
            return Mono.error(new UnauthorizedException("请求未携带凭证且当前没有会话", unauthorized));
        }
        if (pending.replays() >= maxReplays) {
            log.warn("请求 {} 已重放 {} 次仍返回 401，不再重试", pending, pending.replays());
            return Mono.error(new UnauthorizedException("重放 " + pending.replays() + " 次后仍未授权", unauthorized));
        }

        return coordinator.triggerOrJoin(credentialAtSend)
                .flatMap(outcome -> replay(pending, outcome, unauthorized, next));
    }

    private Mono<RelayResponse> replay(PendingRequest pending, RefreshOutcome outcome,
                                       TransportException unauthorized, Transport next) {
        if (!outcome.refreshed()) {
            pending.markRedispatched();
            Metrics.instance().increment("requests_stale_redispatched");
            log.debug("请求 {} 的凭证已过期，使用当前凭证 {} 重发", pending, outcome.credential().maskedAccessToken());
            return dispatch(pending, outcome.credential(), next);
        }

        if (pending.alreadyReplayedFor(outcome.generation())) {
            log.warn("请求 {} 已使用周期 #{} 的凭证重放过，不再重试", pending, outcome.generation());
            return Mono.error(new UnauthorizedException("刷新后仍未授权", unauthorized));
        }

        pending.markReplayed(outcome.generation());
        Metrics.instance().increment("requests_replayed");
        log.debug("请求 {} 使用周期 #{} 的新凭证重放（第 {} 次尝试）",
                pending, outcome.generation(), pending.attempts() + 1);
        return dispatch(pending, outcome.credential(), next);
    }

    private static boolean isUnauthorized(Throwable error) {
        return error instanceof TransportException transportException && transportException.isUnauthorized();
    }
}
