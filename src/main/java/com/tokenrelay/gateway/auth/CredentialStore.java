package com.tokenrelay.gateway.auth;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * 凭证存储
 * <p>
 * 会话凭证的唯一持有者。请求路径只读快照；写入（刷新成功后设置、刷新失败后清除）只发生在
 * {@link com.tokenrelay.gateway.refresh.RefreshCoordinator} 的结算路径里，登录除外
 */
public interface CredentialStore {

    /**
     * 当前凭证快照，未登录或已登出时为空
     */
    Optional<Credential> current();

    void setCredential(Credential credential);

    /**
     * 清除凭证（登出）
     */
    void clear();

    /**
     * 向身份服务换取新凭证
     * <p>
     * 只负责调用远端，不会自行写入存储；调用代价高，由协调器保证同一时间最多一次
     *
     * @return 新凭证，失败时以 {@link com.tokenrelay.gateway.exception.RefreshException} 结束
     */
    Mono<Credential> refresh();
}
