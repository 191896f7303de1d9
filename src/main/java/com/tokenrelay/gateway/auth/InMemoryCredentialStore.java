package com.tokenrelay.gateway.auth;

import com.tokenrelay.gateway.exception.RefreshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于内存的凭证存储
 * <p>
 * 读取无锁（AtomicReference 快照），刷新委托给 {@link TokenRefresher}
 */
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

    private final AtomicReference<Credential> credential = new AtomicReference<>();
    private final TokenRefresher refresher;

    public InMemoryCredentialStore(TokenRefresher refresher) {
        this.refresher = refresher;
    }

    @Override
    public Optional<Credential> current() {
        return Optional.ofNullable(credential.get());
    }

    @Override
    public void setCredential(Credential newCredential) {
        Credential previous = credential.getAndSet(newCredential);
        log.debug("凭证已更新: {} -> {}",
                previous != null ? previous.maskedAccessToken() : "none", newCredential.maskedAccessToken());
    }

    @Override
    public void clear() {
        Credential previous = credential.getAndSet(null);
        if (previous != null) {
            log.debug("凭证已清除: {}", previous.maskedAccessToken());
        }
    }

    @Override
    public Mono<Credential> refresh() {
        return Mono.defer(() -> {
            Credential snapshot = credential.get();
            if (snapshot == null) {
                return Mono.error(new RefreshException("当前没有会话，无法刷新凭证"));
            }
            String refreshToken = snapshot.refreshToken();
            if (refreshToken == null || refreshToken.isEmpty()) {
                return Mono.error(new RefreshException("会话缺少 refreshToken"));
            }
            return refresher.refresh(refreshToken)
                    .map(result -> new Credential(
                            result.accessToken(),
                            result.refreshToken() != null ? result.refreshToken() : refreshToken,
                            Instant.now().plusSeconds(result.expiresInSeconds())
                    ));
        });
    }
}
