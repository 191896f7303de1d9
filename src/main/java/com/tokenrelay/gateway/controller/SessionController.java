package com.tokenrelay.gateway.controller;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.tokenrelay.gateway.auth.Credential;
import com.tokenrelay.gateway.auth.SessionService;
import com.tokenrelay.gateway.exception.RelayGatewayException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * 会话管理端点
 * <p>
 * POST /session 登录，GET /session 查询，DELETE /session 登出
 */
@RestController
@RequestMapping(value = "/session", produces = MediaType.APPLICATION_JSON_VALUE)
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public Mono<String> authenticate(@RequestBody String body) {
        JSONObject req;
        try {
            req = JSONObject.parseObject(body);
        } catch (JSONException e) {
            return Mono.error(new RelayGatewayException("请求体不是合法 JSON", 400, e));
        }
        String accessToken = req != null ? req.getString("accessToken") : null;
        if (accessToken == null || accessToken.isEmpty()) {
            return Mono.error(new RelayGatewayException("缺少 accessToken", 400));
        }
        long expiresIn = req.getLongValue("expiresIn", 0);
        Instant expiresAt = expiresIn > 0 ? Instant.now().plusSeconds(expiresIn) : null;

        sessionService.authenticate(new Credential(accessToken, req.getString("refreshToken"), expiresAt));
        return status();
    }

    @GetMapping
    public Mono<String> status() {
        SessionService.SessionStatus status = sessionService.status();
        JSONObject result = new JSONObject();
        result.put("authenticated", status.authenticated());
        result.put("token", status.maskedToken());
        result.put("expiresAt", status.expiresAt() != null ? status.expiresAt().toString() : null);
        return Mono.just(result.toJSONString());
    }

    @DeleteMapping
    public Mono<String> logout() {
        sessionService.logout();
        return Mono.just(JSONObject.of("success", true).toJSONString());
    }
}
