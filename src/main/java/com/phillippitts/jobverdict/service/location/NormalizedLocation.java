package com.phillippitts.jobverdict.service.location;

import java.util.StringJoiner;

/**
 * A location resolved against the gazetteer. Any component may be null when it could not be
 * resolved; a city always carries its own state and country.
 *
 * @param city    canonical city name, or null
 * @param state   canonical state or region name, or null
 * @param country canonical country name, or null
 */
public record NormalizedLocation(String city, String state, String country) {

    public static final NormalizedLocation EMPTY = new NormalizedLocation(null, null, null);

    public boolean isEmpty() {
        return city == null && state == null && country == null;
    }

    public boolean hasCity() {
        return city != null;
    }

    /**
     * Canonical "City, State, Country" text with unresolved parts omitted. Normalising this text again
     * yields an equal location.
     */
    public String canonical() {
        StringJoiner joiner = new StringJoiner(", ");
        if (city != null) {
            joiner.add(city);
        }
        if (state != null) {
            joiner.add(state);
        }
        if (country != null) {
            joiner.add(country);
        }
        return joiner.toString();
    }

    /**
     * Short display form used in reasoning texts, e.g. "Pune, India".
     */
    public String display() {
        if (city != null) {
            return country == null ? city : city + ", " + country;
        }
        return canonical();
    }
}
