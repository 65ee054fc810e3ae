package com.phillippitts.jobverdict.service.location;

import java.util.List;
import java.util.Objects;

/**
 * Deterministic first pass of location validation: compares the declared location with the places the
 * gazetteer finds in the job description.
 *
 * <p>Confidence ladder, first matching rule wins:
 * <table>
 *   <caption>Phase-1 outcomes</caption>
 *   <tr><th>Condition</th><th>Confidence</th><th>Conflict</th></tr>
 *   <tr><td>description names no city and no unknown place</td><td>0.95</td><td>no</td></tr>
 *   <tr><td>declared location has no recognisable city</td><td>0.5</td><td>no</td></tr>
 *   <tr><td>description mentions the declared city</td><td>0.95</td><td>no</td></tr>
 *   <tr><td>description mentions only other known cities</td><td>0.85</td><td>yes</td></tr>
 *   <tr><td>description mentions only unknown places</td><td>0.6</td><td>no</td></tr>
 * </table>
 */
public final class GazetteerLocationCheck {

    static final double NO_PLACES_CONFIDENCE = 0.95;
    static final double UNKNOWN_METADATA_CONFIDENCE = 0.5;
    static final double CITY_CONFIRMED_CONFIDENCE = 0.95;
    static final double OTHER_CITY_CONFIDENCE = 0.85;
    static final double UNKNOWN_PLACES_CONFIDENCE = 0.6;

    /**
     * Outcome of the deterministic pass.
     *
     * @param authoritativeLocation where the work is judged to happen
     * @param conflictDetected      whether the description contradicts the declared location
     * @param confidence            0..1
     * @param reasoning             human-readable evidence; names the authoritative location on conflict
     * @param mentions              everything recognised in the description
     */
    public record Verdict(String authoritativeLocation, boolean conflictDetected, double confidence,
                          String reasoning, LocationMentions mentions) {
        public List<String> extractedLocations() {
            return mentions.asList();
        }
    }

    private final Gazetteer gazetteer;

    public GazetteerLocationCheck(Gazetteer gazetteer) {
        this.gazetteer = Objects.requireNonNull(gazetteer, "gazetteer");
    }

    public Verdict check(String metadataLocation, String jobDescription) {
        String declared = metadataLocation == null ? "" : metadataLocation;
        LocationMentions mentions = gazetteer.extractMentions(jobDescription);

        if (mentions.hasNoPlaces()) {
            return new Verdict(declared, false, NO_PLACES_CONFIDENCE,
                    "Job description names no specific city; declared location kept", mentions);
        }

        NormalizedLocation declaredLocation = gazetteer.normalize(declared);
        if (!declaredLocation.hasCity()) {
            return new Verdict(declared, false, UNKNOWN_METADATA_CONFIDENCE,
                    "Declared location '" + declared + "' has no recognisable city; description mentions "
                            + String.join(", ", mentions.asList()), mentions);
        }

        String declaredCity = declaredLocation.city();
        if (mentions.mentionsCity(declaredCity)) {
            return new Verdict(declared, false, CITY_CONFIRMED_CONFIDENCE,
                    "Job description mentions the declared city " + declaredCity
                            + " (" + times(mentions.count(declaredCity)) + ")", mentions);
        }

        if (!mentions.cityCounts().isEmpty()) {
            String city = mentions.mostMentionedCity().orElseThrow();
            String authoritative = gazetteer.city(city)
                    .map(c -> new NormalizedLocation(c.name(), c.state(), c.country()).display())
                    .orElse(city);
            return new Verdict(authoritative, true, OTHER_CITY_CONFIDENCE,
                    "Job description mentions " + authoritative + " (" + times(mentions.count(city))
                            + ") but not the declared city " + declaredCity, mentions);
        }

        return new Verdict(declared, false, UNKNOWN_PLACES_CONFIDENCE,
                "Job description names places the gazetteer does not know: "
                        + String.join(", ", mentions.unresolvedPlaces()), mentions);
    }

    private static String times(int count) {
        return count == 1 ? "1 time" : count + " times";
    }
}
