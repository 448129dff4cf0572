package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Local summary used when the language model is unavailable or fails.
 *
 * <p>Picks the highest scoring transcript sentences as bullets and renders them in a fixed
 * four-section report. Never throws.
 */
public class ExtractiveSummarizer {

    static final String NO_SPEECH = "(no recognized speech)";
    static final String BULLET = "• ";

    private static final Pattern SPEAKER_TAG = Pattern.compile("\\[[^\\]]+\\]\\s*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?…])\\s+|\\n+");
    private static final Pattern DIGITS = Pattern.compile("[0-9]{1,4}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_SENTENCE_CHARS = 20;
    private static final int DEDUPE_KEY_CHARS = 80;

    private final int minBullets;
    private final int maxBullets;
    private final List<String> cueWords;
    private final Pattern filler;

    public ExtractiveSummarizer(SummaryProperties.Fallback settings) {
        this.minBullets = settings.getMinBullets();
        this.maxBullets = Math.max(settings.getMinBullets(), settings.getMaxBullets());
        this.cueWords = settings.getCueWords().stream()
                .map(w -> w.toLowerCase(Locale.ROOT).trim())
                .filter(w -> !w.isEmpty())
                .toList();
        this.filler = fillerPattern(settings.getFillerWords());
    }

    /**
     * @return the four-section fallback report
     */
    public String report(String transcript) {
        return "1. Summary\n" + String.join("\n", bullets(transcript)) + "\n\n"
                + "2. Decisions\nNone recorded.\n\n"
                + "3. Action items\n(could not be extracted automatically)\n\n"
                + "4. Risks / blockers\nNone.";
    }

    /**
     * @return between {@code minBullets} and {@code maxBullets} bullets when the transcript has
     *         enough sentences, fewer otherwise; a single placeholder for an empty transcript
     */
    List<String> bullets(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return List.of(NO_SPEECH);
        }
        String text = SPEAKER_TAG.matcher(transcript).replaceAll("");
        List<String> sentences = new ArrayList<>();
        for (String s : SENTENCE_BREAK.split(text)) {
            String trimmed = s.trim();
            if (trimmed.length() >= MIN_SENTENCE_CHARS) {
                sentences.add(trimmed);
            }
        }
        if (sentences.isEmpty()) {
            return List.of(NO_SPEECH);
        }

        List<Scored> ranked = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            ranked.add(new Scored(sentences.get(i), i, score(sentences.get(i))));
        }
        ranked.sort(Comparator.comparingInt(Scored::score).reversed().thenComparingInt(Scored::index));

        List<String> picked = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Scored candidate : ranked) {
            if (picked.size() >= maxBullets) {
                break;
            }
            if (seen.add(dedupeKey(candidate.sentence()))) {
                picked.add(candidate.sentence());
            }
        }
        // pad with leading sentences when dedupe left too few
        for (String s : sentences) {
            if (picked.size() >= minBullets) {
                break;
            }
            if (!picked.contains(s)) {
                picked.add(s);
            }
        }
        return picked.stream()
                .limit(maxBullets)
                .map(s -> BULLET + WHITESPACE.matcher(s).replaceAll(" "))
                .collect(Collectors.toList());
    }

    int score(String sentence) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        int score = 0;
        if (sentence.length() <= 180) {
            score += 2;
        }
        if (sentence.length() <= 120) {
            score += 2;
        }
        for (String cue : cueWords) {
            if (lower.contains(cue)) {
                score += 4;
            }
        }
        if (DIGITS.matcher(sentence).find()) {
            score += 1;
        }
        if (filler != null && filler.matcher(lower).find()) {
            score -= 1;
        }
        return score;
    }

    private static String dedupeKey(String sentence) {
        String normalized = WHITESPACE.matcher(sentence.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return normalized.length() <= DEDUPE_KEY_CHARS ? normalized : normalized.substring(0, DEDUPE_KEY_CHARS);
    }

    private static Pattern fillerPattern(List<String> words) {
        String alternatives = words.stream()
                .map(w -> w.toLowerCase(Locale.ROOT).trim())
                .filter(w -> !w.isEmpty())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return alternatives.isEmpty() ? null : Pattern.compile("\\b(?:" + alternatives + ")\\b");
    }

    private record Scored(String sentence, int index, int score) {
    }
}
