package com.tokenrelay.gateway.auth;

import com.tokenrelay.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 通过 Spring 事件广播会话终止
 */
@Component
public class EventPublishingSessionTerminator implements SessionTerminator {

    private static final Logger log = LoggerFactory.getLogger(EventPublishingSessionTerminator.class);

    private final ApplicationEventPublisher publisher;

    public EventPublishingSessionTerminator(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void logout() {
        log.warn("会话已终止，需要重新登录");
        Metrics.instance().increment("session_logout_total");
        publisher.publishEvent(new SessionTerminatedEvent("session_terminated", Instant.now()));
    }
}
