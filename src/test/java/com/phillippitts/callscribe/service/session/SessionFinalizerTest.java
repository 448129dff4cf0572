package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.config.properties.SessionProperties;
import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.delivery.DeliveryMessage;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.service.summary.ExtractiveSummarizer;
import com.phillippitts.callscribe.service.summary.MapReduceSummarizer;
import com.phillippitts.callscribe.service.summary.PromptTemplates;
import com.phillippitts.callscribe.service.summary.SummaryClient;
import com.phillippitts.callscribe.service.summary.SummaryResult;
import com.phillippitts.callscribe.service.summary.UnavailableSummaryClient;
import com.phillippitts.callscribe.service.transcript.RetentionPruner;
import com.phillippitts.callscribe.service.transcript.TranscriptStore;
import com.phillippitts.callscribe.testutil.FakeSummaryClient;
import com.phillippitts.callscribe.testutil.RecordingDeliveryTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionFinalizerTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private CallScribeMetrics metrics;
    private SessionProperties properties;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CallScribeMetrics(registry);
        properties = new SessionProperties();
    }

    private SessionFinalizer finalizer(SummaryClient client, Path archiveDir, RecordingDeliveryTarget... targets) {
        SummaryProperties summary = new SummaryProperties();
        MapReduceSummarizer summarizer = new MapReduceSummarizer(client,
                new PromptTemplates(new DefaultResourceLoader(), summary.getPrompt()),
                new ExtractiveSummarizer(summary.getFallback()), summary);
        return new SessionFinalizer(properties, new TranscriptStore(archiveDir, new RetentionPruner(0, 0)),
                summarizer, new DeliveryDispatcher(List.of(targets), metrics, ms -> { }), metrics);
    }

    private static FinalizeRequest request(long seconds, String transcript, int entries) {
        return new FinalizeRequest("s-1", "c1", "Standup", START, START.plusSeconds(seconds),
                List.of("Alice", "Bob"), transcript, entries, false, 0);
    }

    @Test
    void emptyShortCallIsArchivedButNotDelivered() throws IOException {
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 0, 0);

        FinalizeResult result = finalizer(new FakeSummaryClient(), dir, telegram)
                .finalizeSession(request(5, "", 0));

        assertThat(result.outcome()).isEqualTo(FinalizeResult.Outcome.SKIPPED);
        assertThat(result.summarySource()).isNull();
        assertThat(telegram.attempts()).isZero();
        assertThat(Files.readString(result.transcriptFile())).contains(SessionFinalizer.NO_SPEECH);
    }

    @Test
    void emptyLongCallIsStillReported() {
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 0, 0);
        FakeSummaryClient client = new FakeSummaryClient();

        FinalizeResult result = finalizer(client, dir, telegram).finalizeSession(request(60, "", 0));

        assertThat(result.outcome()).isEqualTo(FinalizeResult.Outcome.DELIVERED);
        assertThat(result.summarySource()).isEqualTo(SummaryResult.Source.NONE);
        assertThat(client.prompts()).isEmpty();
        assertThat(telegram.delivered()).hasSize(1);
    }

    @Test
    void reportCarriesHeaderAndModelSummary() {
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 0, 0);

        FinalizeResult result = finalizer(new FakeSummaryClient(), dir, telegram)
                .finalizeSession(request(120, "[Alice] we ship friday", 1));

        assertThat(result.outcome()).isEqualTo(FinalizeResult.Outcome.DELIVERED);
        DeliveryMessage message = telegram.delivered().get(0);
        assertThat(message.text()).isEqualTo(ReportFormatter.TITLE + "\nChannel: Standup\n"
                + "Started: 2026-03-01T10:00:00Z\nEnded: 2026-03-01T10:02:00Z\n"
                + "Participants: Alice, Bob\n\nreply 1");
        assertThat(message.payload().getString("summarySource")).isEqualTo("llm");
        assertThat(message.payload().getJSONArray("participants").length()).isEqualTo(2);
        assertThat(registry.get("callscribe.summaries").tag("source", "llm").counter().count()).isEqualTo(1.0);
    }

    @Test
    void requiredTargetFailureYieldsFailedOutcomeAfterOptionalTargetsTried() {
        RecordingDeliveryTarget telegram = RecordingDeliveryTarget.alwaysFailing("telegram", true, 1);
        RecordingDeliveryTarget slack = new RecordingDeliveryTarget("slack", false, 0, 0);

        FinalizeResult result = finalizer(new UnavailableSummaryClient("none"), dir, telegram, slack)
                .finalizeSession(request(120, "[Alice] the release is blocked by a failing migration.", 1));

        assertThat(result.outcome()).isEqualTo(FinalizeResult.Outcome.FAILED);
        assertThat(result.summarySource()).isEqualTo(SummaryResult.Source.FALLBACK);
        assertThat(result.error()).contains("telegram").contains("2 attempt(s)");
        assertThat(telegram.attempts()).isEqualTo(2);
        assertThat(slack.delivered()).hasSize(1);
        assertThat(result.dispatch().outcomes()).hasSize(2);
    }

    @Test
    void archiveFailureDoesNotBlockDelivery() throws IOException {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        RecordingDeliveryTarget telegram = new RecordingDeliveryTarget("telegram", true, 0, 0);

        FinalizeResult result = finalizer(new FakeSummaryClient(), blocker.resolve("sub"), telegram)
                .finalizeSession(request(120, "[Alice] hello there everyone", 1));

        assertThat(result.transcriptFile()).isNull();
        assertThat(result.outcome()).isEqualTo(FinalizeResult.Outcome.DELIVERED);
    }
}
