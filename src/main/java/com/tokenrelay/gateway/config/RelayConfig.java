package com.tokenrelay.gateway.config;

import com.tokenrelay.gateway.auth.CredentialStore;
import com.tokenrelay.gateway.auth.HttpTokenRefresher;
import com.tokenrelay.gateway.auth.InMemoryCredentialStore;
import com.tokenrelay.gateway.auth.SessionTerminator;
import com.tokenrelay.gateway.auth.TokenRefresher;
import com.tokenrelay.gateway.interceptor.AuthInterceptor;
import com.tokenrelay.gateway.interceptor.QueueStrategy;
import com.tokenrelay.gateway.interceptor.RelayClient;
import com.tokenrelay.gateway.refresh.RefreshCoordinator;
import com.tokenrelay.gateway.transport.JdkHttpTransport;
import com.tokenrelay.gateway.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * 凭证存储、刷新协调器、认证拦截器的装配
 */
@Configuration
public class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    @Bean
    public TokenRefresher tokenRefresher(RelayProperties properties, HttpClient relayHttpClient) {
        return new HttpTokenRefresher(
                URI.create(properties.getAuth().getTokenEndpoint()),
                relayHttpClient,
                Duration.ofMillis(properties.getHttp().getRequestTimeoutMs()));
    }

    @Bean
    public CredentialStore credentialStore(TokenRefresher tokenRefresher) {
        return new InMemoryCredentialStore(tokenRefresher);
    }

    @Bean
    public RefreshCoordinator refreshCoordinator(CredentialStore credentialStore, SessionTerminator sessionTerminator,
                                                 RelayProperties properties) {
        return new RefreshCoordinator(credentialStore, sessionTerminator,
                Duration.ofMillis(properties.getAuth().getRefreshTimeoutMs()));
    }

    @Bean
    public AuthInterceptor authInterceptor(CredentialStore credentialStore, RefreshCoordinator refreshCoordinator,
                                           RelayProperties properties) {
        RelayProperties.AuthConfig auth = properties.getAuth();
        QueueStrategy strategy = QueueStrategy.of(auth.getQueueStrategy());
        log.info("认证拦截器: 排队策略={}, 最大重放次数={}", strategy, auth.getMaxReplays());
        return new AuthInterceptor(credentialStore, refreshCoordinator, strategy, auth.getMaxReplays());
    }

    @Bean
    public Transport transport(HttpClient relayHttpClient, RelayProperties properties) {
        return new JdkHttpTransport(relayHttpClient, Duration.ofMillis(properties.getHttp().getRequestTimeoutMs()));
    }

    @Bean
    public RelayClient relayClient(Transport transport, AuthInterceptor authInterceptor) {
        return new RelayClient(transport, List.of(authInterceptor));
    }
}
