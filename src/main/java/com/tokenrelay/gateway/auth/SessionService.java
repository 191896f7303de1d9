package com.tokenrelay.gateway.auth;

import com.tokenrelay.gateway.refresh.RefreshCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * 会话服务
 * <p>
 * 登录、主动登出、查询会话状态。凭证写入统一交给 {@link RefreshCoordinator}，与在途刷新互斥
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final CredentialStore credentialStore;
    private final RefreshCoordinator refreshCoordinator;
    private final SessionTerminator sessionTerminator;

    public SessionService(CredentialStore credentialStore, RefreshCoordinator refreshCoordinator,
                          SessionTerminator sessionTerminator) {
        this.credentialStore = credentialStore;
        this.refreshCoordinator = refreshCoordinator;
        this.sessionTerminator = sessionTerminator;
    }

    /**
     * 登录：写入初始凭证
     */
    public void authenticate(Credential credential) {
        refreshCoordinator.install(credential);
        log.info("会话已建立: token={}, 过期时间: {}", credential.maskedAccessToken(), credential.expiresAt());
    }

    /**
     * 主动登出
     */
    public void logout() {
        if (refreshCoordinator.endSession()) {
            log.info("用户主动登出");
            sessionTerminator.logout();
        }
    }

    public SessionStatus status() {
        return credentialStore.current()
                .map(c -> new SessionStatus(true, c.maskedAccessToken(), c.expiresAt()))
                .orElse(new SessionStatus(false, null, null));
    }

    /**
     * 会话状态
     *
     * @param authenticated 是否已登录
     * @param maskedToken   脱敏后的 access token
     * @param expiresAt     过期时间
     */
    public record SessionStatus(boolean authenticated, String maskedToken, Instant expiresAt) {}
}
