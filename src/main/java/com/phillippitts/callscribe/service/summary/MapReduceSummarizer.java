package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.exception.SummarizationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Summarizes a transcript with the language model, chunk by chunk when it is long.
 *
 * <p>Short transcripts take a single call. Longer ones are split on line boundaries, each chunk
 * is summarized on its own, and one merge call combines the partial summaries. Any model failure
 * switches the whole transcript to the {@link ExtractiveSummarizer}; this class never throws.
 */
public class MapReduceSummarizer {

    private static final Logger LOG = LogManager.getLogger(MapReduceSummarizer.class);

    private final SummaryClient client;
    private final PromptTemplates prompts;
    private final ExtractiveSummarizer fallback;
    private final int chunkChars;
    private final int maxChunks;

    public MapReduceSummarizer(SummaryClient client,
                               PromptTemplates prompts,
                               ExtractiveSummarizer fallback,
                               SummaryProperties properties) {
        this.client = Objects.requireNonNull(client, "client");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.chunkChars = properties.getChunkChars();
        this.maxChunks = properties.getMaxChunks();
    }

    public SummaryResult summarize(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return new SummaryResult(fallback.report(""), SummaryResult.Source.NONE, 0, 0);
        }
        if (!client.isAvailable()) {
            LOG.info("Summary provider unavailable; using extractive summary");
            return new SummaryResult(fallback.report(transcript), SummaryResult.Source.FALLBACK, 0, 0);
        }
        try {
            if (transcript.length() <= chunkChars) {
                return new SummaryResult(client.complete(prompts.summary(transcript)), SummaryResult.Source.LLM, 1, 0);
            }
            return mapReduce(transcript);
        } catch (SummarizationException e) {
            LOG.warn("LLM summary failed; falling back to extractive summary: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Unexpected summarizer failure; falling back to extractive summary", e);
        }
        return new SummaryResult(fallback.report(transcript), SummaryResult.Source.FALLBACK, 0, 0);
    }

    private SummaryResult mapReduce(String transcript) {
        TranscriptChunker.Chunks chunks = TranscriptChunker.chunk(transcript, chunkChars, maxChunks);
        List<String> parts = chunks.parts();
        LOG.info("Summarizing transcript in {} chunks ({} chars, {} omitted)",
                parts.size(), transcript.length(), chunks.omitted());

        List<String> partials = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            String partial = client.complete(prompts.chunk(i + 1, parts.size(), parts.get(i)));
            partials.add("Part " + (i + 1) + "/" + parts.size() + ":\n" + partial);
        }
        String merged = client.complete(prompts.merge(String.join("\n\n", partials), omittedNote(chunks.omitted())));
        return new SummaryResult(merged, SummaryResult.Source.LLM, parts.size(), chunks.omitted());
    }

    static String omittedNote(int omitted) {
        if (omitted == 0) {
            return "";
        }
        return "Note: the first " + omitted + " part(s) of the call were too long to include and are not covered below.";
    }
}
