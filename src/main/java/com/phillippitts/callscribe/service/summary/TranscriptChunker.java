package com.phillippitts.callscribe.service.summary;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs transcript lines into chunks no longer than a character budget.
 */
final class TranscriptChunker {

    /**
     * @param parts chunks in transcript order
     * @param omitted leading chunks dropped because of the chunk cap
     */
    record Chunks(List<String> parts, int omitted) {
    }

    private TranscriptChunker() {
    }

    /**
     * Splits on line boundaries; a single line longer than {@code chunkChars} is hard split.
     * When more than {@code maxChunks} chunks result, only the most recent ones are kept.
     */
    static Chunks chunk(String transcript, int chunkChars, int maxChunks) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : transcript.split("\n")) {
            for (String piece : hardSplit(line, chunkChars)) {
                int needed = current.length() == 0 ? piece.length() : current.length() + 1 + piece.length();
                if (needed > chunkChars && current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(piece);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        int omitted = Math.max(0, parts.size() - maxChunks);
        if (omitted > 0) {
            parts = new ArrayList<>(parts.subList(omitted, parts.size()));
        }
        return new Chunks(List.copyOf(parts), omitted);
    }

    private static List<String> hardSplit(String line, int max) {
        if (line.length() <= max) {
            return List.of(line);
        }
        List<String> pieces = new ArrayList<>();
        for (int i = 0; i < line.length(); i += max) {
            pieces.add(line.substring(i, Math.min(line.length(), i + max)));
        }
        return pieces;
    }
}
