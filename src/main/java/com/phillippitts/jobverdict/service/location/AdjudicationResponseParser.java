package com.phillippitts.jobverdict.service.location;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant parser for the adjudicator's three-field answer:
 * <pre>
 * CONFLICT: YES|NO
 * LOCATION: &lt;where the work happens&gt;
 * REASONING: &lt;one or two sentences&gt;
 * </pre>
 * Markdown emphasis, surrounding chatter and TRUE/FALSE instead of YES/NO are accepted.
 */
public final class AdjudicationResponseParser {

    private static final Pattern CONFLICT = Pattern.compile(
            "(?im)^[\\s*#_-]*CONFLICT[\\s*_]*[:=]\\s*\\**\\s*(YES|NO|TRUE|FALSE)\\b");
    private static final Pattern LOCATION = Pattern.compile(
            "(?im)^[\\s*#_-]*(?:AUTHORITATIVE[ _])?LOCATION[\\s*_]*[:=]\\s*\\**\\s*(.+?)\\s*\\**\\s*$");
    private static final Pattern REASONING = Pattern.compile(
            "(?is)REASONING[\\s*_]*[:=]\\s*\\**\\s*(.+?)\\s*(?=\\n[\\s*#_-]*[A-Z_]{4,}\\s*:|\\z)");

    /**
     * Parsed answer; any field may be null when absent.
     */
    public record Answer(Boolean conflict, String location, String reasoning) {

        public boolean isComplete() {
            return conflict != null && location != null && !location.isBlank();
        }

        public String reasoningOrEmpty() {
            return reasoning == null ? "" : reasoning;
        }
    }

    private AdjudicationResponseParser() {
    }

    public static Answer parse(String response) {
        if (response == null || response.isBlank()) {
            return new Answer(null, null, null);
        }
        Boolean conflict = null;
        Matcher c = CONFLICT.matcher(response);
        if (c.find()) {
            String v = c.group(1).toUpperCase(Locale.ROOT);
            conflict = v.equals("YES") || v.equals("TRUE");
        }
        String location = null;
        Matcher l = LOCATION.matcher(response);
        if (l.find()) {
            location = l.group(1).trim();
        }
        String reasoning = null;
        Matcher r = REASONING.matcher(response);
        if (r.find()) {
            reasoning = r.group(1).trim();
        }
        return new Answer(conflict, location, reasoning);
    }
}
