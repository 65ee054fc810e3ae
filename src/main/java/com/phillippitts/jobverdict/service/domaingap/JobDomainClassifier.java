package com.phillippitts.jobverdict.service.domaingap;

import com.phillippitts.jobverdict.domain.JobDomainProfile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a job description into an industry domain and lists the domain-specific requirements it
 * states. Informational only: the result is reported alongside the verdict and never changes it.
 */
public final class JobDomainClassifier {

    private static final int MAX_REQUIREMENTS = 10;

    private static final Map<String, List<String>> DOMAIN_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put("finance", List.of("banking", "investment", "financial", "asset management",
                "wealth management", "trader", "trading"));
        DOMAIN_KEYWORDS.put("technology", List.of("software", "it", "programming", "developer", "engineering",
                "technology", "cloud"));
        DOMAIN_KEYWORDS.put("healthcare", List.of("health", "medical", "clinical", "hospital", "patient",
                "pharma"));
        DOMAIN_KEYWORDS.put("manufacturing", List.of("manufacturing", "production", "factory", "assembly",
                "industrial"));
        DOMAIN_KEYWORDS.put("consulting", List.of("consulting", "consultant", "advisory"));
        DOMAIN_KEYWORDS.put("legal", List.of("legal", "law", "attorney", "lawyer", "counsel", "compliance",
                "regulatory"));
        DOMAIN_KEYWORDS.put("marketing", List.of("marketing", "advertising", "brand", "market research"));
        DOMAIN_KEYWORDS.put("retail", List.of("retail", "store", "merchandising", "e-commerce"));
        DOMAIN_KEYWORDS.put("education", List.of("education", "teaching", "academic", "school", "university"));
        DOMAIN_KEYWORDS.put("human resources", List.of("hr", "human resources", "recruitment", "talent"));
    }

    private static final Map<String, List<Pattern>> DOMAIN_PATTERNS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.forEach((domain, keywords) -> DOMAIN_PATTERNS.put(domain, keywords.stream()
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList()));
    }

    private static final Pattern YEARS_REQUIREMENT = Pattern.compile(
            "(\\d+)\\s*(?:-\\s*(\\d+)|\\+)?\\s*years?\\s+(?:of\\s+)?experience\\s+(?:in|with)\\s+([^,.;\\n]+)",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PHRASE_REQUIREMENTS = List.of(
            Pattern.compile("knowledge of\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("expertise (?:in|with)\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("background (?:in|with)\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("understanding of\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("familiarity with\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("certification in\\s+([^,.;\\n]+)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> INDUSTRY_KEYWORDS = List.of(
            "financial services", "banking", "investment", "insurance", "healthcare", "pharmaceuticals",
            "manufacturing", "automotive", "aerospace", "energy", "oil and gas", "utilities",
            "telecommunications", "retail", "consumer goods", "media", "hospitality", "real estate",
            "construction", "consulting", "government", "transportation", "logistics");

    public JobDomainProfile classify(String jobDescription) {
        if (jobDescription == null || jobDescription.isBlank()) {
            return JobDomainProfile.unclassified();
        }
        return new JobDomainProfile(primaryDomain(jobDescription), requirements(jobDescription));
    }

    String primaryDomain(String text) {
        String best = JobDomainProfile.UNCLASSIFIED;
        int bestCount = 0;
        for (Map.Entry<String, List<Pattern>> entry : DOMAIN_PATTERNS.entrySet()) {
            int count = 0;
            for (Pattern p : entry.getValue()) {
                Matcher m = p.matcher(text);
                while (m.find()) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best;
    }

    List<String> requirements(String text) {
        Set<String> found = new LinkedHashSet<>();

        Matcher years = YEARS_REQUIREMENT.matcher(text);
        while (years.find()) {
            int min = Integer.parseInt(years.group(1));
            // Three or more years marks a domain-specific rather than general requirement
            if (min >= 3) {
                String range = years.group(2) != null ? min + "-" + years.group(2) : min + "+";
                found.add(normalize(years.group(3)) + " (" + range + " years)");
            }
        }
        for (Pattern p : PHRASE_REQUIREMENTS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                found.add(normalize(m.group(1)));
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : INDUSTRY_KEYWORDS) {
            if (lower.contains(keyword)) {
                found.add(keyword + " industry knowledge");
            }
        }

        List<String> result = new ArrayList<>(found);
        return result.size() > MAX_REQUIREMENTS ? result.subList(0, MAX_REQUIREMENTS) : result;
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
