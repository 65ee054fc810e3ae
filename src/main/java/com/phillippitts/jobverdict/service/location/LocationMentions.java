package com.phillippitts.jobverdict.service.location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Places recognised in a free-text job description.
 *
 * @param cityCounts       canonical city name to number of mentions, in order of first appearance
 * @param states           canonical state names mentioned
 * @param countries        canonical country names mentioned
 * @param unresolvedPlaces capitalised place names after location cues that the gazetteer does not know
 */
public record LocationMentions(
        Map<String, Integer> cityCounts,
        Set<String> states,
        Set<String> countries,
        Set<String> unresolvedPlaces
) {

    public LocationMentions {
        cityCounts = Collections.unmodifiableMap(new LinkedHashMap<>(cityCounts));
        states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        countries = Collections.unmodifiableSet(new LinkedHashSet<>(countries));
        unresolvedPlaces = Collections.unmodifiableSet(new LinkedHashSet<>(unresolvedPlaces));
    }

    public Set<String> cities() {
        return cityCounts.keySet();
    }

    public boolean mentionsCity(String canonicalCity) {
        return canonicalCity != null && cityCounts.containsKey(canonicalCity);
    }

    public boolean hasNoPlaces() {
        return cityCounts.isEmpty() && unresolvedPlaces.isEmpty();
    }

    /**
     * The most frequently mentioned city; ties go to the first mentioned.
     */
    public Optional<String> mostMentionedCity() {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : cityCounts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    public int count(String canonicalCity) {
        return cityCounts.getOrDefault(canonicalCity, 0);
    }

    /**
     * Flat list for reporting: recognised cities first, then unresolved places.
     */
    public List<String> asList() {
        List<String> all = new ArrayList<>(cityCounts.keySet());
        all.addAll(unresolvedPlaces);
        return all;
    }
}
