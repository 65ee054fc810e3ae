package com.phillippitts.jobverdict.service.prompt;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Slot values for the constrained location adjudication prompt.
 *
 * @param metadataLocation location declared in the job metadata
 * @param gazetteerNote    what the deterministic pass found
 * @param jobExcerpt       truncated job description
 */
public record LocationAdjudicationPrompt(String metadataLocation, String gazetteerNote, String jobExcerpt) {

    public static final Set<String> SLOTS = Set.of("metadataLocation", "gazetteerNote", "jobExcerpt");

    public LocationAdjudicationPrompt {
        Objects.requireNonNull(metadataLocation, "metadataLocation must not be null");
        Objects.requireNonNull(gazetteerNote, "gazetteerNote must not be null");
        Objects.requireNonNull(jobExcerpt, "jobExcerpt must not be null");
    }

    public String render(PromptTemplate template) {
        return template.render(Map.of(
                "metadataLocation", metadataLocation,
                "gazetteerNote", gazetteerNote,
                "jobExcerpt", jobExcerpt));
    }
}
