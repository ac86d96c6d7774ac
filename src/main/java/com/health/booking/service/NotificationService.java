package com.health.booking.service;

import com.health.booking.entity.Appointment;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget delivery of appointment events. Failures are logged and never reach the caller.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final RestTemplate restTemplate;
    private final Executor executor;

    @Value("${notification.webhook-url:}")
    private String webhookUrl;

    public NotificationService(RestTemplateBuilder builder,
                               @Qualifier("notificationExecutor") Executor executor) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(2))
                .setReadTimeout(Duration.ofSeconds(5))
                .build();
        this.executor = executor;
    }

    public void notify(NotificationEvent event, Long appointmentId, Long recipientId) {
        try {
            CompletableFuture
                    .runAsync(() -> deliver(event, appointmentId, recipientId), executor)
                    .exceptionally(ex -> {
                        log.warn("Notification {} for appointment {} to {} failed: {}",
                                event, appointmentId, recipientId, ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Notification {} for appointment {} dropped: {}", event, appointmentId, e.getMessage());
        }
    }

    /** Patient and doctor both hear about the event. */
    public void notifyParticipants(NotificationEvent event, Appointment appointment) {
        notify(event, appointment.getId(), appointment.getUserId());
        notify(event, appointment.getId(), appointment.getDoctorId());
    }

    void deliver(NotificationEvent event, Long appointmentId, Long recipientId) {
        if (StringUtils.isBlank(webhookUrl)) {
            log.info("Notification {} appointment={} recipient={}", event, appointmentId, recipientId);
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", event.name());
        payload.put("appointmentId", appointmentId);
        payload.put("recipientId", recipientId);
        restTemplate.postForEntity(webhookUrl, payload, Void.class);
        log.debug("Delivered {} for appointment {} to {}", event, appointmentId, recipientId);
    }
}
