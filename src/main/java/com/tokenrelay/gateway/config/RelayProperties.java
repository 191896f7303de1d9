package com.tokenrelay.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private AuthConfig auth = new AuthConfig();
    private HttpConfig http = new HttpConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class AuthConfig {
        // 身份服务刷新端点
        private String tokenEndpoint = "http://localhost:9000/auth/refreshToken";
        // hold-while-refreshing / retry-after-unauthorized
        private String queueStrategy = "hold-while-refreshing";
        private int maxReplays = 3;
        // 0 表示不限制
        private long refreshTimeoutMs = 30000;
    }

    @Data
    public static class HttpConfig {
        private long connectTimeoutMs = 30000;
        private long requestTimeoutMs = 60000;
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class UpstreamConfig {
        private String baseUrl = "http://localhost:9000";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
    }
}
