package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.exception.SummarizationException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTemplatesTest {

    @Test
    void substitutesInOnePassWithoutExpandingValues() {
        String rendered = PromptTemplates.render("A {{TRANSCRIPT}} B {{OTHER}}",
                Map.of("TRANSCRIPT", "said {{OTHER}} and $1"));

        assertThat(rendered).isEqualTo("A said {{OTHER}} and $1 B {{OTHER}}");
    }

    @Test
    void loadsBundledTemplates() {
        PromptTemplates templates = new PromptTemplates(new DefaultResourceLoader(),
                new SummaryProperties.Prompt());

        assertThat(templates.chunk(2, 5, "[Bob] hi")).contains("part 2 of 5").endsWith("[Bob] hi\n");
        assertThat(templates.merge("P", "")).contains("Partial summaries:\nP");
    }

    @Test
    void missingTemplateRaisesSummarizationException() {
        SummaryProperties.Prompt locations = new SummaryProperties.Prompt();
        locations.setSummary("classpath:prompts/missing.txt");
        PromptTemplates templates = new PromptTemplates(new DefaultResourceLoader(), locations);

        assertThatThrownBy(() -> templates.summary("x"))
                .isInstanceOf(SummarizationException.class)
                .hasMessageContaining("missing.txt");
    }
}
