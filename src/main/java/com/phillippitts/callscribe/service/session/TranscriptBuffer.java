package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.util.LogSanitizer;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only transcript of the active session, bounded by entry count.
 *
 * <p>When full, the oldest entry is dropped; order of the remaining entries is preserved.
 * Not thread-safe: owned by the session loop.
 */
public final class TranscriptBuffer {

    static final int MAX_LABEL_CHARS = 64;

    private final int maxItems;
    private final int maxTextChars;
    private final Deque<TranscriptEntry> entries = new ArrayDeque<>();
    private long dropped;

    public TranscriptBuffer(int maxItems, int maxTextChars) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be >= 1");
        }
        this.maxItems = maxItems;
        this.maxTextChars = maxTextChars;
    }

    /**
     * Appends an utterance; blank text is ignored.
     *
     * @return whether an entry was added
     */
    public boolean append(Instant timestamp, String speakerLabel, String text, double seconds) {
        String cleanText = LogSanitizer.sanitizeLabel(text, maxTextChars);
        if (cleanText.isEmpty()) {
            return false;
        }
        String label = LogSanitizer.sanitizeLabel(speakerLabel, MAX_LABEL_CHARS);
        entries.addLast(new TranscriptEntry(timestamp, label.isEmpty() ? "unknown" : label, cleanText, seconds));
        while (entries.size() > maxItems) {
            entries.removeFirst();
            dropped++;
        }
        return true;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Entries dropped because the buffer was full. */
    public long droppedCount() {
        return dropped;
    }

    public List<TranscriptEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * @return one {@code [speaker] text} line per entry, or "" when empty
     */
    public String render() {
        return entries.stream().map(TranscriptEntry::line).collect(Collectors.joining("\n"));
    }
}
