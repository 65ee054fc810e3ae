package com.phillippitts.jobverdict.service.domaingap;

import com.phillippitts.jobverdict.domain.DomainGapReport;

import java.util.List;
import java.util.Locale;

/**
 * Phrase-counting heuristic over a domain knowledge assessment passage.
 *
 * <p>Biased toward flagging: a false downgrade of a Good match costs less than recommending an
 * application the candidate cannot fulfil. Stateless and thread-safe.
 */
public final class DomainGapAnalyzer {

    static final List<String> CRITICAL_GAP_PHRASES = List.of(
            "lacks domain-specific knowledge",
            "missing industry experience",
            "no direct experience in",
            "lacks experience in the",
            "does not demonstrate",
            "significant gap in",
            "would take 3+ years",
            "does not show experience",
            "missing domain knowledge",
            "lack of sector-specific experience",
            "industry knowledge is absent",
            "does not have specific experience",
            "specialized knowledge that the cv doesn't show",
            "required expertise is missing",
            "limited exposure to"
    );

    static final List<String> REQUIREMENT_PHRASES = List.of(
            "alternative products",
            "asset classes",
            "investment products",
            "asset management",
            "financial products",
            "regulatory framework",
            "market trends",
            "industry-specific",
            "sector-specific",
            "specialized technical skills",
            "requires extensive experience",
            "domain-specific knowledge",
            "specific regulatory framework",
            "industry standards",
            "market-specific"
    );

    static final List<String> MODERATE_SIGNAL_WORDS = List.of("experience", "skill", "knowledge");

    /**
     * Analyzes an assessment passage. Null or blank input yields {@link DomainGapReport#EMPTY}.
     */
    public DomainGapReport analyze(String assessment) {
        if (assessment == null || assessment.isBlank()) {
            return DomainGapReport.EMPTY;
        }
        String text = assessment.toLowerCase(Locale.ROOT);

        int severity = countAll(text, CRITICAL_GAP_PHRASES);
        int requirementMentions = countAll(text, REQUIREMENT_PHRASES);
        int words = wordCount(text);
        double density = words == 0 ? 0.0 : 100.0 * requirementMentions / words;

        boolean mentionsGap = text.contains("gap");
        boolean moderateSignals = requirementMentions > 0
                || MODERATE_SIGNAL_WORDS.stream().anyMatch(text::contains);

        return new DomainGapReport(severity, requirementMentions > 0, density, mentionsGap, moderateSignals);
    }

    static int countAll(String text, List<String> phrases) {
        int total = 0;
        for (String phrase : phrases) {
            int from = 0;
            int idx;
            while ((idx = text.indexOf(phrase, from)) >= 0) {
                total++;
                from = idx + phrase.length();
            }
        }
        return total;
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
