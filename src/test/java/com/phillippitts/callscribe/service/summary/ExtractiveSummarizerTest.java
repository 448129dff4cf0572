package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractiveSummarizerTest {

    private final SummaryProperties.Fallback settings = new SummaryProperties.Fallback();

    @Test
    void prefersSentencesWithCueWords() {
        settings.setMinBullets(1);
        settings.setMaxBullets(1);
        ExtractiveSummarizer summarizer = new ExtractiveSummarizer(settings);

        List<String> bullets = summarizer.bullets(
                "[Alice] The weather was nice this weekend.\n[Bob] We decided to release version 2 on Monday.");

        assertThat(bullets).containsExactly("• We decided to release version 2 on Monday.");
    }

    @Test
    void fillerWordsLowerTheScore() {
        ExtractiveSummarizer summarizer = new ExtractiveSummarizer(settings);

        assertThat(summarizer.score("um so the coffee machine is broken"))
                .isLessThan(summarizer.score("so the coffee machine is broken"));
    }

    @Test
    void duplicatesAreCollapsedAndSpeakerTagsRemoved() {
        settings.setMinBullets(1);
        ExtractiveSummarizer summarizer = new ExtractiveSummarizer(settings);

        List<String> bullets = summarizer.bullets(
                "[Alice] We must fix the login issue today.\n[Bob] We must fix the login issue today.");

        assertThat(bullets).containsExactly("• We must fix the login issue today.");
    }

    @Test
    void shortFragmentsOnlyYieldPlaceholder() {
        ExtractiveSummarizer summarizer = new ExtractiveSummarizer(settings);

        assertThat(summarizer.bullets("[Alice] hi\n[Bob] ok")).containsExactly(ExtractiveSummarizer.NO_SPEECH);
        assertThat(summarizer.bullets(null)).containsExactly(ExtractiveSummarizer.NO_SPEECH);
    }

    @Test
    void reportHasFourSections() {
        String report = new ExtractiveSummarizer(settings).report("[Alice] The plan is to deploy on Thursday.");

        assertThat(report).startsWith("1. Summary\n• The plan is to deploy on Thursday.")
                .contains("\n\n2. Decisions\nNone recorded.")
                .contains("\n\n3. Action items\n(could not be extracted automatically)")
                .endsWith("4. Risks / blockers\nNone.");
    }
}
