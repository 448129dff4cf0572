package com.phillippitts.callscribe.service.summary;

/**
 * A finished summary and how it was produced.
 *
 * @param text report body
 * @param source producer of the text
 * @param chunks chunks summarized by the model, 1 for a single call, 0 when the model was not used
 * @param omittedChunks oldest chunks left out because of the chunk cap
 */
public record SummaryResult(String text, Source source, int chunks, int omittedChunks) {

    public enum Source {
        LLM,
        /** Extractive summary after the model failed or was unavailable. */
        FALLBACK,
        /** Nothing was said; no summary attempted. */
        NONE
    }
}
