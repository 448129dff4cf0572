package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.exception.SummarizationException;

/**
 * Used when no language model is configured. Every summary comes from the extractive fallback.
 */
public class UnavailableSummaryClient implements SummaryClient {

    private final String reason;

    public UnavailableSummaryClient(String reason) {
        this.reason = reason;
    }

    @Override
    public String complete(String prompt) {
        throw new SummarizationException("No summary provider: " + reason);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String name() {
        return "none";
    }
}
