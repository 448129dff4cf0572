package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.service.summary.SummaryResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Renders the delivered report, as chat text and as the webhook JSON payload.
 */
final class ReportFormatter {

    static final String TITLE = "callScribe call summary";

    private ReportFormatter() {
    }

    static String text(FinalizeRequest request, SummaryResult summary) {
        return TITLE + "\n"
                + "Channel: " + request.channelName() + "\n"
                + "Started: " + request.startedAt() + "\n"
                + "Ended: " + request.endedAt() + "\n"
                + "Participants: " + participants(request) + "\n\n"
                + summary.text();
    }

    static JSONObject payload(FinalizeRequest request, SummaryResult summary) {
        return new JSONObject()
                .put("sessionId", request.sessionId())
                .put("channel", request.channelName())
                .put("startedAt", request.startedAt().toString())
                .put("endedAt", request.endedAt().toString())
                .put("participants", new JSONArray(request.participants()))
                .put("summary", summary.text())
                .put("summarySource", summary.source().name().toLowerCase(Locale.ROOT))
                .put("transcriptEntries", request.transcriptEntries());
    }

    private static String participants(FinalizeRequest request) {
        return request.participants().isEmpty() ? "(none)" : String.join(", ", request.participants());
    }
}
