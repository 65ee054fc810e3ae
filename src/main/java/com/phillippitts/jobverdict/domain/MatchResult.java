package com.phillippitts.jobverdict.domain;

import java.util.List;
import java.util.Objects;

/**
 * Conservative verdict combined from several evaluation runs.
 *
 * <p>Successful results always carry a level, a content type and content text, and the content type
 * is {@link ContentType#APPLICATION_NARRATIVE} exactly when the level is {@link MatchLevel#GOOD}.
 * Failed results carry {@link #error()} and no level or content.
 *
 * @param finalMatchLevel            consensus level after corrections (null on error)
 * @param domainKnowledgeAssessment  assessment passage of the representative run (empty if absent)
 * @param contentType                narrative or rationale (null on error)
 * @param contentText                the narrative or rationale text (null on error)
 * @param runs                       one record per logical run, in run order
 * @param error                      set only when no run produced a level
 * @param domainGap                  heuristic reading of the assessment
 * @param adjustment                 post-consensus correction that was applied
 */
public record MatchResult(
        MatchLevel finalMatchLevel,
        String domainKnowledgeAssessment,
        ContentType contentType,
        String contentText,
        List<EvaluationRun> runs,
        ErrorKind error,
        DomainGapReport domainGap,
        MatchAdjustment adjustment
) {

    public MatchResult {
        runs = List.copyOf(Objects.requireNonNull(runs, "runs must not be null"));
        domainKnowledgeAssessment = domainKnowledgeAssessment == null ? "" : domainKnowledgeAssessment;
        domainGap = domainGap == null ? DomainGapReport.EMPTY : domainGap;
        adjustment = adjustment == null ? MatchAdjustment.NONE : adjustment;
        if (error != null) {
            if (finalMatchLevel != null || contentType != null || contentText != null) {
                throw new IllegalArgumentException("Error results must not carry a level or content");
            }
        } else {
            Objects.requireNonNull(finalMatchLevel, "finalMatchLevel must not be null");
            Objects.requireNonNull(contentType, "contentType must not be null");
            Objects.requireNonNull(contentText, "contentText must not be null");
            if (contentType != ContentType.forLevel(finalMatchLevel)) {
                throw new IllegalArgumentException(
                        "contentType " + contentType + " does not fit match level " + finalMatchLevel);
            }
        }
    }

    public static MatchResult of(MatchLevel level, String assessment, String contentText, List<EvaluationRun> runs,
                                 DomainGapReport domainGap, MatchAdjustment adjustment) {
        return new MatchResult(level, assessment, ContentType.forLevel(level), contentText, runs, null,
                domainGap, adjustment);
    }

    public static MatchResult extractionFailure(List<EvaluationRun> runs) {
        return new MatchResult(null, "", null, null, runs, ErrorKind.EXTRACTION_FAILURE, null, null);
    }

    public boolean hasError() {
        return error != null;
    }

    public long extractedRunCount() {
        return runs.stream().filter(EvaluationRun::hasMatchLevel).count();
    }
}
