package com.tokenrelay.gateway.interceptor;

import com.tokenrelay.gateway.auth.Credential;
import com.tokenrelay.gateway.auth.InMemoryCredentialStore;
import com.tokenrelay.gateway.auth.SessionService;
import com.tokenrelay.gateway.auth.SessionTerminator;
import com.tokenrelay.gateway.auth.TokenRefresher;
import com.tokenrelay.gateway.exception.RefreshException;
import com.tokenrelay.gateway.exception.SessionTerminatedException;
import com.tokenrelay.gateway.exception.TransportException;
import com.tokenrelay.gateway.exception.UnauthorizedException;
import com.tokenrelay.gateway.refresh.RefreshCoordinator;
import com.tokenrelay.gateway.support.ControllableTokenRefresher;
import com.tokenrelay.gateway.support.FakeTransport;
import com.tokenrelay.gateway.transport.RelayRequest;
import com.tokenrelay.gateway.transport.RelayResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("[Interceptor] 认证拦截器")
class AuthInterceptorTest {

    private static final String T0 = "access-T0";
    private static final String T1 = "access-T1";
    private static final String T2 = "access-T2";

    private FakeTransport transport;
    private ControllableTokenRefresher refresher;
    private InMemoryCredentialStore store;
    private SessionTerminator terminator;
    private RefreshCoordinator coordinator;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        refresher = new ControllableTokenRefresher();
        store = new InMemoryCredentialStore(refresher);
        terminator = mock(SessionTerminator.class);
        coordinator = new RefreshCoordinator(store, terminator, Duration.ZERO);
    }

    private RelayClient client(QueueStrategy strategy) {
        return client(strategy, 3);
    }

    private RelayClient client(QueueStrategy strategy, int maxReplays) {
        AuthInterceptor interceptor = new AuthInterceptor(store, coordinator, strategy, maxReplays);
        return new RelayClient(transport, List.of(interceptor));
    }

    private void authenticate() {
        store.setCredential(Credential.of(T0, "refresh-T0"));
    }

    private static RelayRequest get(String path) {
        return RelayRequest.get(URI.create("http://upstream.test" + path));
    }

    @Test
    @DisplayName("发送时附加 Authorization 头")
    void attaches_authorization_header() {
        authenticate();
        transport.accept(T0);

        StepVerifier.create(client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(get("/api")))
                .assertNext(response -> assertThat(response.statusCode()).isEqualTo(200))
                .verifyComplete();

        assertThat(transport.sent()).singleElement()
                .satisfies(r -> assertThat(r.header("Authorization")).isEqualTo("Bearer " + T0));
    }

    @Test
    @DisplayName("未登录时不附加凭证，调用方的 Authorization 头也会被移除")
    void sends_without_credential_when_not_authenticated() {
        RelayRequest withForeignHeader = get("/public").withBearer("caller-supplied");
        transport.failWith("/public", new TransportException(404, "missing"));

        client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(withForeignHeader).onErrorResume(e -> Mono.empty()).block();

        assertThat(transport.sent()).singleElement()
                .satisfies(r -> assertThat(r.headers()).doesNotContainKey("Authorization"));
    }

    @Test
    @DisplayName("两个请求同时 401：只刷新一次，按到达顺序用新 token 重放并都成功")
    void concurrent_unauthorized_requests_share_one_refresh() {
        authenticate();
        transport.accept(T1);
        RelayClient client = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED);

        CompletableFuture<RelayResponse> r1 = client.exchange(get("/r1")).toFuture();
        CompletableFuture<RelayResponse> r2 = client.exchange(get("/r2")).toFuture();

        assertThat(refresher.calls()).isEqualTo(1);
        assertThat(r1).isNotDone();
        assertThat(r2).isNotDone();

        refresher.succeed(T1);

        assertThat(r1.join().bodyAsString()).contains("/r1");
        assertThat(r2.join().bodyAsString()).contains("/r2");
        assertThat(refresher.calls()).isEqualTo(1);
        assertThat(transport.sent()).extracting(r -> r.uri().getPath())
                .containsExactly("/r1", "/r2", "/r1", "/r2");
        assertThat(transport.tokensSent()).containsExactly(T0, T0, T1, T1);
        assertThat(T1).isNotEqualTo(T0);
        verify(terminator, never()).logout();
    }

    @Test
    @DisplayName("刷新失败：登出一次，请求以刷新异常结束且不再重试")
    void failed_refresh_fails_request_without_retry() {
        authenticate();
        IllegalStateException cause = new IllegalStateException("Bad word!");

        CompletableFuture<RelayResponse> r1 = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(get("/r1")).toFuture();
        refresher.fail(cause);

        Throwable error = catchThrowable(r1::join).getCause();
        assertThat(error).isInstanceOf(RefreshException.class).hasCause(cause);
        assertThat(transport.sent()).hasSize(1);
        assertThat(store.current()).isEmpty();
        verify(terminator, times(1)).logout();
    }

    @Test
    @DisplayName("刷新失败时多个等待请求收到同一个异常，登出只执行一次")
    void failed_refresh_with_many_waiters_logs_out_once() {
        authenticate();
        RelayClient client = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED);

        CompletableFuture<RelayResponse> r1 = client.exchange(get("/r1")).toFuture();
        CompletableFuture<RelayResponse> r2 = client.exchange(get("/r2")).toFuture();
        CompletableFuture<RelayResponse> r3 = client.exchange(get("/r3")).toFuture();
        refresher.fail(new IllegalStateException("identity service down"));

        Throwable first = catchThrowable(r1::join).getCause();
        assertThat(catchThrowable(r2::join).getCause()).isSameAs(first);
        assertThat(catchThrowable(r3::join).getCause()).isSameAs(first);
        assertThat(transport.sent()).hasSize(3);
        verify(terminator, times(1)).logout();
    }

    @Test
    @DisplayName("新 token 仍 401 且仍是当前凭证：合法地开启第二个刷新周期")
    void unauthorized_after_refresh_starts_second_cycle() {
        authenticate();
        transport.accept(T2);

        CompletableFuture<RelayResponse> r1 = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(get("/r1")).toFuture();
        refresher.succeed(T1);

        assertThat(refresher.calls()).isEqualTo(2);
        assertThat(r1).isNotDone();

        refresher.succeed(T2);

        assertThat(r1.join().statusCode()).isEqualTo(200);
        assertThat(transport.tokensSent()).containsExactly(T0, T1, T2);
        verify(terminator, never()).logout();
    }

    @Test
    @DisplayName("401 到达时凭证已被其他请求刷新：不触发刷新，直接用当前凭证重发")
    void stale_unauthorized_redispatches_without_refresh() {
        authenticate();
        transport.accept(T1);
        RelayClient client = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED);

        Sinks.One<RelayResponse> slowResponse = transport.holdNext("/slow");
        CompletableFuture<RelayResponse> slow = client.exchange(get("/slow")).toFuture();
        CompletableFuture<RelayResponse> fast = client.exchange(get("/fast")).toFuture();

        refresher.succeed(T1);
        assertThat(fast.join().statusCode()).isEqualTo(200);

        // 慢请求带着 T0 的 401 此时才到
        slowResponse.tryEmitError(FakeTransport.unauthorized()).orThrow();

        assertThat(slow.join().statusCode()).isEqualTo(200);
        assertThat(refresher.calls()).isEqualTo(1);
        assertThat(transport.sentTo("/slow")).containsExactly(T0, T1);
    }

    @Test
    @DisplayName("非 401 错误原样透传，不触发刷新")
    void other_transport_errors_pass_through() {
        authenticate();
        TransportException serverError = new TransportException(503, "maintenance");
        transport.failWith("/busy", serverError);

        StepVerifier.create(client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(get("/busy")))
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(serverError))
                .verify();

        assertThat(refresher.calls()).isZero();
    }

    @Test
    @DisplayName("未登录请求收到 401：直接转交，不刷新也不登出")
    void unauthorized_without_session_is_forwarded() {
        StepVerifier.create(client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED).exchange(get("/private")))
                .expectError(UnauthorizedException.class)
                .verify();

        assertThat(refresher.calls()).isZero();
        verify(terminator, never()).logout();
    }

    @Test
    @DisplayName("刷新总能成功但上游始终 401：达到最大重放次数后转交失败，不登出")
    void replay_limit_stops_refresh_loop() {
        AtomicInteger issued = new AtomicInteger();
        TokenRefresher alwaysSucceeds = refreshToken -> Mono.just(
                new TokenRefresher.TokenResult("access-loop-" + issued.incrementAndGet(), refreshToken, 60));
        store = new InMemoryCredentialStore(alwaysSucceeds);
        coordinator = new RefreshCoordinator(store, terminator, Duration.ZERO);
        authenticate();

        StepVerifier.create(client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED, 2).exchange(get("/forbidden")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UnauthorizedException.class)
                        .hasCauseInstanceOf(TransportException.class))
                .verify();

        assertThat(issued.get()).isEqualTo(2);
        assertThat(transport.sent()).hasSize(3);
        verify(terminator, never()).logout();
    }

    @Test
    @DisplayName("会话因刷新失败结束后，新请求不带凭证发送，401 直接转交")
    void requests_after_logout_are_not_refreshed() {
        authenticate();
        RelayClient client = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED);
        client.exchange(get("/r1")).onErrorResume(e -> Mono.empty()).subscribe();
        refresher.fail(new IllegalStateException("expired"));

        StepVerifier.create(client.exchange(get("/r2")))
                .expectError(UnauthorizedException.class)
                .verify();

        assertThat(transport.sentTo("/r2")).containsExactly("null");
        assertThat(refresher.calls()).isEqualTo(1);
    }

    @Nested
    @DisplayName("刷新进行中先排队")
    class HoldWhileRefreshing {

        @Test
        @DisplayName("刷新在途时新请求不发送，结算后携带新凭证各发送一次")
        void queues_requests_while_refreshing() {
            authenticate();
            transport.accept(T1);
            RelayClient client = client(QueueStrategy.HOLD_WHILE_REFRESHING);

            CompletableFuture<RelayResponse> first = client.exchange(get("/first")).toFuture();
            CompletableFuture<RelayResponse> a = client.exchange(get("/a")).toFuture();
            CompletableFuture<RelayResponse> b = client.exchange(get("/b")).toFuture();
            CompletableFuture<RelayResponse> c = client.exchange(get("/c")).toFuture();

            assertThat(transport.sent()).hasSize(1);

            refresher.succeed(T1);

            assertThat(List.of(first, a, b, c)).allSatisfy(f -> assertThat(f.join().statusCode()).isEqualTo(200));
            assertThat(transport.sentTo("/a")).containsExactly(T1);
            assertThat(transport.sentTo("/b")).containsExactly(T1);
            assertThat(transport.sentTo("/c")).containsExactly(T1);
            assertThat(transport.sentTo("/first")).containsExactly(T0, T1);
            assertThat(refresher.calls()).isEqualTo(1);
        }

        @Test
        @DisplayName("刷新失败时排队的请求一并失败且从未发送")
        void queued_requests_fail_with_refresh() {
            authenticate();
            RelayClient client = client(QueueStrategy.HOLD_WHILE_REFRESHING);

            CompletableFuture<RelayResponse> first = client.exchange(get("/first")).toFuture();
            CompletableFuture<RelayResponse> queued = client.exchange(get("/queued")).toFuture();
            refresher.fail(new IllegalStateException("revoked"));

            assertThat(catchThrowable(queued::join).getCause())
                    .isSameAs(catchThrowable(first::join).getCause())
                    .isInstanceOf(RefreshException.class);
            assertThat(transport.sentTo("/queued")).isEmpty();
            verify(terminator, times(1)).logout();
        }

        @Test
        @DisplayName("没有刷新在途时照常发送")
        void sends_immediately_when_idle() {
            authenticate();
            transport.accept(T0);

            StepVerifier.create(client(QueueStrategy.HOLD_WHILE_REFRESHING).exchange(get("/idle")))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(transport.sentTo("/idle")).containsExactly(T0);
        }
    }

    @Nested
    @DisplayName("刷新期间会话变更")
    class SessionChangedDuringRefresh {

        private SessionService sessions;

        @BeforeEach
        void setUp() {
            sessions = new SessionService(store, coordinator, terminator);
            sessions.authenticate(Credential.of(T0, "refresh-T0"));
        }

        @Test
        @DisplayName("刷新在途时主动登出：等待中的请求以会话结束失败，迟到的刷新结果不会恢复会话")
        void logout_during_refresh_is_not_undone_by_late_result() {
            transport.accept(T1);
            CompletableFuture<RelayResponse> r1 = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED)
                    .exchange(get("/r1")).toFuture();
            assertThat(refresher.calls()).isEqualTo(1);

            sessions.logout();

            assertThat(catchThrowable(r1::join).getCause()).isInstanceOf(SessionTerminatedException.class);

            refresher.succeed(T1);

            assertThat(store.current()).isEmpty();
            assertThat(sessions.status().authenticated()).isFalse();
            assertThat(coordinator.isRefreshing()).isFalse();
            assertThat(transport.tokensSent()).containsExactly(T0);
            verify(terminator, times(1)).logout();
        }

        @Test
        @DisplayName("刷新在途时主动登出后刷新失败：不再清除或重复登出")
        void failure_after_logout_is_ignored() {
            CompletableFuture<RelayResponse> r1 = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED)
                    .exchange(get("/r1")).toFuture();

            sessions.logout();
            refresher.fail(new IllegalStateException("revoked"));

            assertThat(r1).isCompletedExceptionally();
            verify(terminator, times(1)).logout();
        }

        @Test
        @DisplayName("刷新在途时重新登录：等待中的请求改用新凭证，迟到的刷新结果被丢弃")
        void login_during_refresh_supersedes_cycle() {
            String fresh = "access-N";
            transport.accept(fresh);
            CompletableFuture<RelayResponse> r1 = client(QueueStrategy.RETRY_AFTER_UNAUTHORIZED)
                    .exchange(get("/r1")).toFuture();

            sessions.authenticate(Credential.of(fresh, "refresh-N"));

            assertThat(r1.join().statusCode()).isEqualTo(200);

            refresher.succeed(T1);

            assertThat(store.current()).hasValueSatisfying(c -> assertThat(c.accessToken()).isEqualTo(fresh));
            assertThat(transport.tokensSent()).containsExactly(T0, fresh);
            verify(terminator, never()).logout();
        }
    }
}
