package com.health.booking.service;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class NotificationServiceTest {

    @Test
    void deliversOnTheNotificationExecutor() {
        List<Runnable> submitted = new ArrayList<>();
        Executor recording = submitted::add;
        NotificationService service = new NotificationService(new RestTemplateBuilder(), recording);

        service.notify(NotificationEvent.BOOKING_CREATED, 1L, 2L);

        assertThat(submitted).hasSize(1);
        assertThatCode(() -> submitted.get(0).run()).doesNotThrowAnyException();
    }

    @Test
    void webhookFailureDoesNotReachCaller() {
        NotificationService service = new NotificationService(new RestTemplateBuilder(), Runnable::run);
        ReflectionTestUtils.setField(service, "webhookUrl", "http://127.0.0.1:1/hook");

        assertThatCode(() -> service.notify(NotificationEvent.BOOKING_CANCELLED, 1L, 2L))
                .doesNotThrowAnyException();
    }

    @Test
    void fullExecutorDropsNotification() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        NotificationService service = new NotificationService(new RestTemplateBuilder(), full);

        assertThatCode(() -> service.notify(NotificationEvent.REFUND_PROCESSED, 1L, 2L))
                .doesNotThrowAnyException();
    }
}
