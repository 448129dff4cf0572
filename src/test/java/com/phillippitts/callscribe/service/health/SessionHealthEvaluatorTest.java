package com.phillippitts.callscribe.service.health;

import com.phillippitts.callscribe.service.health.SessionHealthEvaluator.CaptureHealth;
import com.phillippitts.callscribe.service.session.SessionMetricsSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionHealthEvaluatorTest {

    private final SessionHealthEvaluator evaluator = new SessionHealthEvaluator(10.0);

    private static SessionMetricsSnapshot metrics(double audioSeconds, long accepted, long decodeFailures,
                                                  long sttFailures) {
        return new SessionMetricsSnapshot(5, accepted, 0, 0, decodeFailures, sttFailures, 0, 0,
                audioSeconds, null, null, null, null);
    }

    @Test
    void idleBeforeFirstSession() {
        assertThat(evaluator.evaluate(null)).isEqualTo(CaptureHealth.IDLE);
    }

    @Test
    void notJudgedBelowAudioThreshold() {
        assertThat(evaluator.evaluate(metrics(10.0, 0, 0, 3))).isEqualTo(CaptureHealth.OK);
    }

    @Test
    void anyAcceptedSegmentIsHealthy() {
        assertThat(evaluator.evaluate(metrics(60, 1, 4, 4))).isEqualTo(CaptureHealth.OK);
    }

    @Test
    void sttFailuresTakePrecedenceOverDecodeFailures() {
        assertThat(evaluator.evaluate(metrics(60, 0, 2, 1))).isEqualTo(CaptureHealth.STT_FAILING);
        assertThat(evaluator.evaluate(metrics(60, 0, 2, 0))).isEqualTo(CaptureHealth.DECODE_FAILING);
        assertThat(CaptureHealth.STT_FAILING.isDegraded()).isTrue();
    }

    @Test
    void audioWithoutTextOrErrorsIsNoSpeech() {
        CaptureHealth health = evaluator.evaluate(metrics(60, 0, 0, 0));

        assertThat(health).isEqualTo(CaptureHealth.NO_SPEECH);
        assertThat(health.isDegraded()).isFalse();
        assertThat(health.reason()).isEqualTo("no-speech");
    }
}
