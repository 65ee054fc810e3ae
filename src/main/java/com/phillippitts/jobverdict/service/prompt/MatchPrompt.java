package com.phillippitts.jobverdict.service.prompt;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Slot values for the candidate-to-role match prompt.
 */
public record MatchPrompt(String candidateProfile, String jobDescription) {

    public static final Set<String> SLOTS = Set.of("candidateProfile", "jobDescription");

    public MatchPrompt {
        Objects.requireNonNull(candidateProfile, "candidateProfile must not be null");
        Objects.requireNonNull(jobDescription, "jobDescription must not be null");
    }

    public String render(PromptTemplate template) {
        return template.render(Map.of(
                "candidateProfile", candidateProfile,
                "jobDescription", jobDescription));
    }
}
