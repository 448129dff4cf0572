package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.testutil.RecordingDeliveryTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DeliveryDispatcherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<Long> sleeps = new ArrayList<>();

    private DeliveryDispatcher dispatcher(DeliveryTarget... targets) {
        return new DeliveryDispatcher(List.of(targets), new CallScribeMetrics(registry), sleeps::add);
    }

    private static DeliveryMessage message() {
        return new DeliveryMessage("report", null);
    }

    @Test
    void retriesWithPolicyDelaysUntilSuccess() {
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 2, 2);

        DispatchReport report = dispatcher(telegram).dispatch(message());

        assertThat(report.allSucceeded()).isTrue();
        assertThat(report.outcomes().get(0).attempts()).isEqualTo(3);
        assertThat(sleeps).containsExactly(100L, 200L);
        assertThat(registry.get("callscribe.delivery").tag("target", "telegram").tag("result", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void optionalFailureDoesNotFailDispatch() {
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 2, 0);
        RecordingDeliveryTarget slack = RecordingDeliveryTarget.alwaysFailing("slack", false, 1);

        DispatchReport report = dispatcher(telegram, slack).dispatch(message());

        assertThat(report.allSucceeded()).isFalse();
        assertThat(report.deliveredCount()).isEqualTo(1);
        DispatchReport.TargetOutcome slackOutcome = report.outcomes().get(1);
        assertThat(slackOutcome.success()).isFalse();
        assertThat(slackOutcome.attempts()).isEqualTo(2);
        assertThat(slackOutcome.error()).isEqualTo("slack: HTTP 502 from slack");
    }

    @Test
    void requiredFailureThrowsAfterEveryTargetWasTried() {
        RecordingDeliveryTarget telegram = RecordingDeliveryTarget.alwaysFailing("telegram", true, 0);
        RecordingDeliveryTarget webhook = new RecordingDeliveryTarget("webhook", false, 0, 0);

        RequiredDeliveryFailedException e = catchThrowableOfType(
                () -> dispatcher(telegram, webhook).dispatch(message()), RequiredDeliveryFailedException.class);

        assertThat(e.getTarget()).isEqualTo("telegram");
        assertThat(e.getReport().outcomes()).hasSize(2);
        assertThat(webhook.delivered()).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedBackoffEndsRetries() {
        RecordingDeliveryTarget telegram = RecordingDeliveryTarget.alwaysFailing("telegram", true, 3);
        DeliveryDispatcher dispatcher = new DeliveryDispatcher(List.of(telegram),
                new CallScribeMetrics(registry), ms -> {
                    throw new InterruptedException();
                });

        try {
            assertThatThrownBy(() -> dispatcher.dispatch(message()))
                    .isInstanceOf(RequiredDeliveryFailedException.class)
                    .hasMessageContaining("interrupted");
            assertThat(telegram.attempts()).isEqualTo(1);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void alertsGoOnceToAlertTargetsAndNeverThrow() {
        RecordingDeliveryTarget telegram = RecordingDeliveryTarget.alwaysFailing("telegram", true, 5);
        RecordingDeliveryTarget alertsOk = new RecordingDeliveryTarget("ops", false, true, 5, 0);
        RecordingDeliveryTarget failingAlerts = new RecordingDeliveryTarget("ops2", false, true, 5, 1);

        dispatcher(telegram, alertsOk, failingAlerts).sendAlert("STT failed");

        assertThat(telegram.attempts()).isZero();
        assertThat(alertsOk.delivered()).singleElement()
                .satisfies(m -> assertThat(m.payload().getString("alert")).isEqualTo("STT failed"));
        assertThat(failingAlerts.attempts()).isEqualTo(1);
        assertThat(failingAlerts.delivered()).isEmpty();
    }
}
