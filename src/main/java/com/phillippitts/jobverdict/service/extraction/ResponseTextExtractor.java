package com.phillippitts.jobverdict.service.extraction;

import com.phillippitts.jobverdict.domain.ContentType;
import com.phillippitts.jobverdict.domain.MatchLevel;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a single free-text match evaluation into its parts: the categorical match level, the
 * domain knowledge assessment passage, and the application narrative or no-go rationale.
 *
 * <p>Expected response layout (markdown emphasis optional, case-insensitive):
 * <pre>
 * Domain knowledge assessment: ...
 * CV-to-role match: Good match
 * Application narrative: ...      (Good)
 * No-go rationale: ...            (Low / Moderate)
 * </pre>
 *
 * <p>All methods are pure and total: they never throw, and return {@link Extraction#notFound()}
 * when the text does not contain what was asked for.
 */
public final class ResponseTextExtractor {

    static final String REASONS_PREFIX =
            "I have compared my CV and the role description and decided not to apply due to the following reasons: ";
    static final String DECLINE_PREFIX = "I have compared my CV and the role description and decided not to apply ";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // Labelled forms win over bare markers so that "Good match" inside a narrative cannot shadow the verdict
    private static final List<Pattern> LEVEL_PATTERNS = List.of(
            Pattern.compile("CV-to-role match\\W*(low|moderate|good)\\b", FLAGS),
            Pattern.compile("match level\\W*(?:is\\W*)?(low|moderate|good)\\b", FLAGS),
            Pattern.compile("\\b(low|moderate|good)\\s+match\\b", FLAGS)
    );

    private static final String NEXT_HEADER =
            "\\n[\\s*#]*(?:application narrative|no[- ]?go rationale|domain knowledge assessment|cv-to-role match)";

    private static final Pattern ASSESSMENT = Pattern.compile(
            "domain knowledge assessment\\s*\\**\\s*:\\s*\\**\\s*(.*?)(?=\\n\\s*\\n|" + NEXT_HEADER + "|\\z)",
            FLAGS | Pattern.DOTALL);

    private static final Pattern NARRATIVE = Pattern.compile(
            "application narrative\\s*\\**\\s*:\\s*\\**\\s*(.*?)(?=" + NEXT_HEADER + "|\\z)",
            FLAGS | Pattern.DOTALL);

    private static final Pattern RATIONALE = Pattern.compile(
            "no[- ]?go rationale\\s*\\**\\s*:\\s*\\**\\s*(.*?)(?=" + NEXT_HEADER + "|\\z)",
            FLAGS | Pattern.DOTALL);

    private static final Pattern DUE_TO = Pattern.compile(
            "decided not to apply\\s+(due to\\s+.+?)(?=\\n\\s*\\n|\\z)", FLAGS | Pattern.DOTALL);

    private ResponseTextExtractor() {
    }

    /**
     * Finds the categorical match level.
     */
    public static Extraction<MatchLevel> extractMatchLevel(String response) {
        if (isBlank(response)) {
            return Extraction.notFound();
        }
        for (Pattern pattern : LEVEL_PATTERNS) {
            Matcher m = pattern.matcher(response);
            if (m.find()) {
                return Extraction.found(MatchLevel.fromLabel(m.group(1)));
            }
        }
        return Extraction.notFound();
    }

    /**
     * Captures the passage after the "Domain knowledge assessment:" header, up to a blank line,
     * the next known header, or the end of text. The found value may be empty if the header has no body.
     */
    public static Extraction<String> extractDomainAssessment(String response) {
        return firstGroup(ASSESSMENT, response);
    }

    /**
     * Extracts the narrative (for {@link MatchLevel#GOOD}) or rationale (for other levels).
     *
     * <p>When only the other kind of section is present, it is returned with
     * {@link NarrativeExtraction#mismatch()} set. For non-Good levels a stray narrative is rewritten
     * into rationale form; for Good a stray rationale is returned as a rationale.
     */
    public static Extraction<NarrativeExtraction> extractNarrativeOrRationale(String response, MatchLevel level) {
        if (isBlank(response) || level == null) {
            return Extraction.notFound();
        }
        Extraction<String> narrative = nonEmpty(firstGroup(NARRATIVE, response));
        Extraction<String> rationale = nonEmpty(firstGroup(RATIONALE, response));

        if (level == MatchLevel.GOOD) {
            if (narrative.isFound()) {
                return Extraction.found(
                        new NarrativeExtraction(ContentType.APPLICATION_NARRATIVE, narrative.value(), false));
            }
            return rationale.map(text -> new NarrativeExtraction(ContentType.NO_GO_RATIONALE, text, true));
        }

        if (rationale.isFound()) {
            return Extraction.found(new NarrativeExtraction(ContentType.NO_GO_RATIONALE, rationale.value(), false));
        }
        if (narrative.isFound()) {
            String converted = REASONS_PREFIX
                    + "[Extracted from incorrectly formatted narrative: " + narrative.value() + "]";
            return Extraction.found(new NarrativeExtraction(ContentType.NO_GO_RATIONALE, converted, true));
        }
        return firstGroup(DUE_TO, response)
                .map(dueTo -> new NarrativeExtraction(ContentType.NO_GO_RATIONALE, DECLINE_PREFIX + dueTo, false));
    }

    private static Extraction<String> firstGroup(Pattern pattern, String response) {
        if (isBlank(response)) {
            return Extraction.notFound();
        }
        Matcher m = pattern.matcher(response);
        if (!m.find()) {
            return Extraction.notFound();
        }
        return Extraction.found(clean(m.group(1)));
    }

    private static Extraction<String> nonEmpty(Extraction<String> e) {
        return e.isFound() && !e.value().isEmpty() ? e : Extraction.notFound();
    }

    // Strips leftover markdown emphasis and surrounding whitespace
    private static String clean(String s) {
        return s.replaceAll("^[\\s*]+|[\\s*]+$", "");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
