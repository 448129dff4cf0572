package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.exception.SummarizationException;

/**
 * A language model able to turn a prompt into a completion.
 */
public interface SummaryClient {

    /**
     * @return trimmed, non-empty completion text
     * @throws SummarizationException when the call fails or the model returns nothing
     */
    String complete(String prompt);

    /** Whether calls can succeed at all; {@code false} sends every summary to the fallback. */
    boolean isAvailable();

    String name();
}
