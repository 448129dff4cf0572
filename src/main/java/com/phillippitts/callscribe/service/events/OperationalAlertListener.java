package com.phillippitts.callscribe.service.events;

import com.phillippitts.callscribe.config.properties.AlertProperties;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.session.event.SegmentFailureEvent;
import com.phillippitts.callscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns decode and transcription failures into operator alerts. Each stage is throttled on its
 * own, so a broken engine or decoder produces one message per cooldown rather than one per segment.
 */
@Component
class OperationalAlertListener {

    private static final Logger LOG = LogManager.getLogger(OperationalAlertListener.class);
    static final int MAX_ERROR_CHARS = 800;
    static final String STT_KEY = "stt-failure";
    static final String DECODE_KEY = "decode-failure";

    private final DeliveryDispatcher dispatcher;
    private final boolean notifyEnabled;
    private final Duration cooldown;
    private final Map<String, Instant> lastAlert = new ConcurrentHashMap<>();

    OperationalAlertListener(DeliveryDispatcher dispatcher, AlertProperties properties) {
        this.dispatcher = dispatcher;
        this.notifyEnabled = properties.isSttErrorNotify();
        this.cooldown = properties.getSttErrorCooldown();
    }

    @EventListener
    void onSegmentFailure(SegmentFailureEvent e) {
        boolean stt = e.stage() == SegmentFailureEvent.Stage.STT;
        if (!notifyEnabled || !shouldAlert(stt ? STT_KEY : DECODE_KEY)) {
            return;
        }
        String channel = LogSanitizer.sanitizeLabel(e.channelName(), 80);
        String error = LogSanitizer.redactError(e.error(), MAX_ERROR_CHARS);
        LOG.warn("{} failing in {} (engine={}); sending operator alert", e.stage(), channel, e.engine());
        dispatcher.sendAlert(stt ? sttAlertText(channel, error) : decodeAlertText(channel, error));
    }

    static String sttAlertText(String channel, String error) {
        return "callScribe: STT failure\n"
                + "Channel: " + channel + "\n"
                + "Error: " + error + "\n"
                + "Hint: check stt.* settings and logs.";
    }

    static String decodeAlertText(String channel, String error) {
        return "callScribe: audio decode failure\n"
                + "Channel: " + channel + "\n"
                + "Error: " + error + "\n"
                + "Hint: check the voice transport's audio format and logs.";
    }

    /**
     * Claims the alert slot for {@code key} when the cooldown has elapsed. Check and update are
     * one atomic step, so concurrent failures on several capture threads yield a single alert.
     */
    boolean shouldAlert(String key) {
        Instant now = Instant.now();
        boolean[] granted = new boolean[1];
        lastAlert.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(cooldown) >= 0) {
                granted[0] = true;
                return now;
            }
            return prev;
        });
        return granted[0];
    }
}
