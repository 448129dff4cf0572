package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.config.properties.SessionProperties;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.delivery.DeliveryMessage;
import com.phillippitts.callscribe.service.delivery.DispatchReport;
import com.phillippitts.callscribe.service.delivery.RequiredDeliveryFailedException;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.service.summary.MapReduceSummarizer;
import com.phillippitts.callscribe.service.summary.SummaryResult;
import com.phillippitts.callscribe.service.transcript.TranscriptDocument;
import com.phillippitts.callscribe.service.transcript.TranscriptStore;
import com.phillippitts.callscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Archives, summarizes and delivers one sealed session. Runs on the finalize executor.
 *
 * <p>{@link #finalizeSession} never throws: a failing required target yields
 * {@link FinalizeResult.Outcome#FAILED} so the coordinator can always reset.
 */
@Component
public class SessionFinalizer {

    private static final Logger LOG = LogManager.getLogger(SessionFinalizer.class);
    static final String NO_SPEECH = "(no speech captured)";

    private final TranscriptStore store;
    private final MapReduceSummarizer summarizer;
    private final DeliveryDispatcher dispatcher;
    private final CallScribeMetrics metrics;
    private final Duration skipEmptyCallUnder;

    public SessionFinalizer(SessionProperties properties,
                            TranscriptStore store,
                            MapReduceSummarizer summarizer,
                            DeliveryDispatcher dispatcher,
                            CallScribeMetrics metrics) {
        this.store = store;
        this.summarizer = summarizer;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.skipEmptyCallUnder = properties.getSkipEmptyCallUnder();
    }

    public FinalizeResult finalizeSession(FinalizeRequest request) {
        try {
            return run(request);
        } catch (RuntimeException e) {
            LOG.error("Finalize failed for session {}", request.sessionId(), e);
            return FinalizeResult.failed(e.toString());
        }
    }

    private FinalizeResult run(FinalizeRequest request) {
        String body = request.hasSpeech() ? request.transcript() : NO_SPEECH;
        Path file = archive(request, body);

        if (!request.hasSpeech() && request.duration().compareTo(skipEmptyCallUnder) < 0) {
            LOG.info("Skipping empty short call in {} ({} ms)",
                    LogSanitizer.sanitizeLabel(request.channelName(), 80), request.duration().toMillis());
            return new FinalizeResult(FinalizeResult.Outcome.SKIPPED, file, null, null, null);
        }

        SummaryResult summary = summarizer.summarize(request.transcript());
        metrics.recordSummary(summary.source().name().toLowerCase(Locale.ROOT));
        LOG.info("Summary ready: source={}, chunks={}, omitted={}, chars={}",
                summary.source(), summary.chunks(), summary.omittedChunks(), summary.text().length());

        DeliveryMessage message = new DeliveryMessage(
                ReportFormatter.text(request, summary), ReportFormatter.payload(request, summary));
        try {
            DispatchReport report = dispatcher.dispatch(message);
            return new FinalizeResult(FinalizeResult.Outcome.DELIVERED, file, summary.source(), report, null);
        } catch (RequiredDeliveryFailedException e) {
            LOG.error("Report for session {} not delivered: {}", request.sessionId(), e.getMessage());
            return new FinalizeResult(FinalizeResult.Outcome.FAILED, file, summary.source(), e.getReport(),
                    e.getMessage());
        }
    }

    private Path archive(FinalizeRequest request, String body) {
        try {
            return store.save(new TranscriptDocument(request.channelName(), request.startedAt(),
                    request.endedAt(), request.participants(), body));
        } catch (UncheckedIOException e) {
            LOG.warn("Failed to archive transcript for session {}: {}", request.sessionId(), e.getMessage());
            return null;
        }
    }
}
