package com.tokenrelay.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.tokenrelay.gateway.auth.SessionService;
import com.tokenrelay.gateway.refresh.RefreshCoordinator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final SessionService sessionService;
    private final RefreshCoordinator refreshCoordinator;

    public HealthController(SessionService sessionService, RefreshCoordinator refreshCoordinator) {
        this.sessionService = sessionService;
        this.refreshCoordinator = refreshCoordinator;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        boolean authenticated = sessionService.status().authenticated();
        JSONObject result = new JSONObject();
        result.put("status", authenticated ? "ok" : "unauthenticated");
        result.put("version", "1.0.0");
        result.put("authenticated", authenticated);
        result.put("refreshing", refreshCoordinator.isRefreshing());
        result.put("refreshCycles", refreshCoordinator.completedCycles());
        return Mono.just(result.toJSONString());
    }
}
