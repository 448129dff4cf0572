package com.phillippitts.callscribe.service.events;

import com.phillippitts.callscribe.config.properties.AlertProperties;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.session.event.SegmentFailureEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OperationalAlertListenerTest {

    @Mock
    private DeliveryDispatcher dispatcher;

    private static SegmentFailureEvent failure(SegmentFailureEvent.Stage stage, String error) {
        return new SegmentFailureEvent("s-1", "Standup", stage, "whisper", error, Instant.now());
    }

    @Test
    void sttFailureAlertsOncePerCooldown() {
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, new AlertProperties());

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "whisper exited with code 1"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "whisper exited with code 1"));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(dispatcher, times(1)).sendAlert(text.capture());
        assertThat(text.getValue())
                .startsWith("callScribe: STT failure\n")
                .contains("Channel: Standup")
                .contains("Error: whisper exited with code 1");
    }

    @Test
    void zeroCooldownAlertsEveryTime() {
        AlertProperties properties = new AlertProperties();
        properties.setSttErrorCooldown(Duration.ZERO);
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, properties);

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "a"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "b"));

        verify(dispatcher, times(2)).sendAlert(anyString());
    }

    @Test
    void decodeFailureAlertsWithItsOwnTitle() {
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, new AlertProperties());

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.DECODE, "truncated frame"));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(dispatcher).sendAlert(text.capture());
        assertThat(text.getValue())
                .startsWith("callScribe: audio decode failure\n")
                .contains("Error: truncated frame");
    }

    @Test
    void decodeAndSttFailuresHaveSeparateCooldowns() {
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, new AlertProperties());

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "a"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.DECODE, "b"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.DECODE, "c"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "d"));

        verify(dispatcher, times(2)).sendAlert(anyString());
    }

    @Test
    void disabledAlertsAreIgnored() {
        AlertProperties disabled = new AlertProperties();
        disabled.setSttErrorNotify(false);
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, disabled);

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT, "boom"));
        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.DECODE, "boom"));

        verify(dispatcher, never()).sendAlert(anyString());
    }

    @Test
    void simultaneousFailuresGrantOneAlertPerWindow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < 50; round++) {
                OperationalAlertListener listener =
                        new OperationalAlertListener(dispatcher, new AlertProperties());
                CyclicBarrier start = new CyclicBarrier(threads);
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await(5, TimeUnit.SECONDS);
                        return listener.shouldAlert(OperationalAlertListener.STT_KEY);
                    }));
                }
                int granted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        granted++;
                    }
                }
                assertThat(granted).as("alerts granted in round %d", round).isEqualTo(1);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void temporaryPathsAreRedacted() {
        OperationalAlertListener listener = new OperationalAlertListener(dispatcher, new AlertProperties());
        String tmp = System.getProperty("java.io.tmpdir").replaceAll("/+$", "");

        listener.onSegmentFailure(failure(SegmentFailureEvent.Stage.STT,
                "cannot open " + tmp + "/callscribe-123.wav"));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(dispatcher).sendAlert(text.capture());
        assertThat(text.getValue()).contains("cannot open <tmpfile>").doesNotContain("callscribe-123");
    }
}
