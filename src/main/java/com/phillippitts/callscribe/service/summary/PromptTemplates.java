package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.exception.SummarizationException;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the summary, chunk and merge prompt templates and fills in their {@code {{NAME}}}
 * placeholders. Templates are read once and cached.
 */
public class PromptTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)}}");

    private final ResourceLoader resourceLoader;
    private final SummaryProperties.Prompt locations;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public PromptTemplates(ResourceLoader resourceLoader, SummaryProperties.Prompt locations) {
        this.resourceLoader = resourceLoader;
        this.locations = locations;
    }

    public String summary(String transcript) {
        return render(load(locations.getSummary()), Map.of("TRANSCRIPT", transcript));
    }

    public String chunk(int part, int total, String transcript) {
        return render(load(locations.getChunk()), Map.of(
                "PART", String.valueOf(part),
                "TOTAL", String.valueOf(total),
                "TRANSCRIPT", transcript));
    }

    public String merge(String partials, String omittedNote) {
        return render(load(locations.getMerge()), Map.of(
                "PARTIALS", partials,
                "OMITTED_NOTE", omittedNote));
    }

    /**
     * Replaces every known placeholder in one pass, so placeholder-like text inside values is
     * left alone. Unknown placeholders are kept verbatim.
     */
    static String render(String template, Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String load(String location) {
        return cache.computeIfAbsent(location, loc -> {
            Resource resource = resourceLoader.getResource(loc);
            try (InputStream in = resource.getInputStream()) {
                return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new SummarizationException("Cannot read prompt template " + loc, e);
            }
        });
    }
}
