package com.phillippitts.jobverdict.service.location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable lookup tables of known countries, states and cities with their spelling variants.
 *
 * <p>Offers two operations:
 * <ul>
 *   <li>{@link #normalize(String)} resolves a short location string such as "Frankfurt am Main, DE"</li>
 *   <li>{@link #extractMentions(String)} scans free text for whole-word mentions of known places</li>
 * </ul>
 *
 * <p>All patterns are compiled once at construction. Instances are thread-safe.
 *
 * @see GazetteerLoader
 */
public final class Gazetteer {

    /**
     * Known country.
     *
     * @param codes short codes accepted only as a complete location component, never in free text
     */
    public record Country(String name, String continent, List<String> variants, List<String> codes) {
        public Country {
            Objects.requireNonNull(name, "name");
            variants = List.copyOf(variants);
            codes = List.copyOf(codes);
        }
    }

    public record State(String name, String country, List<String> variants) {
        public State {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(country, "country");
            variants = List.copyOf(variants);
        }
    }

    public record City(String name, String state, String country, List<String> variants) {
        public City {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(country, "country");
            variants = List.copyOf(variants);
        }
    }

    private static final Pattern PARTS = Pattern.compile("[,;/|()]|\\s+-\\s+");
    private static final Pattern CITY_SUFFIXES = Pattern.compile(
            "\\s+am\\s+main\\b|\\s*/\\s*main\\b|\\s+a\\.\\s?m\\.|\\s+upon\\s+[\\p{L}-]+|\\s+city\\b");
    private static final Pattern POSTAL_CODE = Pattern.compile("\\b\\d{4,6}\\b");
    private static final Pattern PLACE_CUE = Pattern.compile(
            "(?i:based in|located in|offices? in|headquartered in|relocate to|work from|site in)\\s+"
                    + "(\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+){0,2})");
    private static final Set<String> NON_PLACE_WORDS = Set.of("the", "a", "an", "our", "your", "one", "this", "home");

    private final Map<String, Country> countries;
    private final Map<String, State> states;
    private final Map<String, City> cities;

    private final Map<String, Country> countryByVariant = new HashMap<>();
    private final Map<String, State> stateByVariant = new HashMap<>();
    private final Map<String, City> cityByVariant = new HashMap<>();

    private final Map<String, Pattern> cityPatterns = new LinkedHashMap<>();
    private final Map<String, Pattern> statePatterns = new LinkedHashMap<>();
    private final Map<String, Pattern> countryPatterns = new LinkedHashMap<>();

    public Gazetteer(List<Country> countries, List<State> states, List<City> cities) {
        Map<String, Country> countryMap = new LinkedHashMap<>();
        for (Country c : countries) {
            countryMap.put(c.name(), c);
            for (String v : withCanonical(c.name(), c.variants())) {
                countryByVariant.put(v, c);
            }
            for (String code : c.codes()) {
                countryByVariant.putIfAbsent(code.toLowerCase(Locale.ROOT), c);
            }
            countryPatterns.put(c.name(), wholeWord(withCanonical(c.name(), c.variants())));
        }
        Map<String, State> stateMap = new LinkedHashMap<>();
        for (State s : states) {
            requireCountry(countryMap, s.country(), "state " + s.name());
            stateMap.put(s.name(), s);
            for (String v : withCanonical(s.name(), s.variants())) {
                stateByVariant.put(v, s);
            }
            statePatterns.put(s.name(), wholeWord(withCanonical(s.name(), s.variants())));
        }
        Map<String, City> cityMap = new LinkedHashMap<>();
        for (City c : cities) {
            requireCountry(countryMap, c.country(), "city " + c.name());
            if (c.state() != null && !stateMap.containsKey(c.state())) {
                throw new IllegalArgumentException("City " + c.name() + " references unknown state " + c.state());
            }
            cityMap.put(c.name(), c);
            for (String v : withCanonical(c.name(), c.variants())) {
                cityByVariant.put(v, c);
            }
            cityPatterns.put(c.name(), wholeWord(withCanonical(c.name(), c.variants())));
        }
        this.countries = Collections.unmodifiableMap(countryMap);
        this.states = Collections.unmodifiableMap(stateMap);
        this.cities = Collections.unmodifiableMap(cityMap);
    }

    /**
     * Resolves a short location string. Components are matched exactly against known variants first,
     * then the whole text is scanned for embedded place names. A resolved city determines its own
     * state and country.
     *
     * @return resolved location, {@link NormalizedLocation#EMPTY} when nothing is recognised
     */
    public NormalizedLocation normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedLocation.EMPTY;
        }
        String cleaned = clean(text);
        City city = null;
        State state = null;
        Country country = null;
        for (String raw : PARTS.split(cleaned)) {
            String part = raw.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (city == null && cityByVariant.containsKey(part)) {
                city = cityByVariant.get(part);
            } else if (state == null && stateByVariant.containsKey(part)) {
                state = stateByVariant.get(part);
            } else if (country == null && countryByVariant.containsKey(part)) {
                country = countryByVariant.get(part);
            }
        }
        if (city == null) {
            city = firstMention(cleaned, cityPatterns).map(cities::get).orElse(null);
        }
        if (city == null && state == null) {
            state = firstMention(cleaned, statePatterns).map(states::get).orElse(null);
        }
        if (country == null) {
            country = firstMention(cleaned, countryPatterns).map(countries::get).orElse(null);
        }

        if (city != null) {
            return new NormalizedLocation(city.name(), city.state(), city.country());
        }
        if (state != null) {
            return new NormalizedLocation(null, state.name(), state.country());
        }
        if (country != null) {
            return new NormalizedLocation(null, null, country.name());
        }
        return NormalizedLocation.EMPTY;
    }

    /**
     * Counts whole-word mentions of every known place in free text and collects capitalised names
     * after location cues ("based in", "office in", ...) that the tables do not know.
     */
    public LocationMentions extractMentions(String text) {
        if (text == null || text.isBlank()) {
            return new LocationMentions(Map.of(), Set.of(), Set.of(), Set.of());
        }
        Map<String, Integer> cityCounts = countByFirstAppearance(text, cityPatterns);
        Set<String> stateNames = countByFirstAppearance(text, statePatterns).keySet();
        Set<String> countryNames = countByFirstAppearance(text, countryPatterns).keySet();

        Set<String> unresolved = new LinkedHashSet<>();
        Matcher m = PLACE_CUE.matcher(text);
        while (m.find()) {
            String place = m.group(1).trim();
            String firstWord = place.split("\\s+")[0].toLowerCase(Locale.ROOT);
            if (NON_PLACE_WORDS.contains(firstWord)) {
                continue;
            }
            if (normalize(place).isEmpty()) {
                unresolved.add(place);
            }
        }
        return new LocationMentions(cityCounts, stateNames, countryNames, unresolved);
    }

    public Optional<City> city(String canonicalName) {
        return Optional.ofNullable(canonicalName == null ? null : cities.get(canonicalName));
    }

    public int size() {
        return countries.size() + states.size() + cities.size();
    }

    private static String clean(String text) {
        String lower = text.toLowerCase(Locale.ROOT).trim();
        lower = CITY_SUFFIXES.matcher(lower).replaceAll("");
        lower = POSTAL_CODE.matcher(lower).replaceAll(" ");
        return lower.replaceAll("\\s+", " ").trim();
    }

    private static Optional<String> firstMention(String text, Map<String, Pattern> patterns) {
        String best = null;
        int bestStart = Integer.MAX_VALUE;
        for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            if (m.find() && m.start() < bestStart) {
                best = e.getKey();
                bestStart = m.start();
            }
        }
        return Optional.ofNullable(best);
    }

    private static Map<String, Integer> countByFirstAppearance(String text, Map<String, Pattern> patterns) {
        List<Map.Entry<String, int[]>> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            int count = 0;
            int first = -1;
            while (m.find()) {
                if (count == 0) {
                    first = m.start();
                }
                count++;
            }
            if (count > 0) {
                found.add(Map.entry(e.getKey(), new int[] {first, count}));
            }
        }
        found.sort(Comparator.comparingInt(e -> e.getValue()[0]));
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> e : found) {
            ordered.put(e.getKey(), e.getValue()[1]);
        }
        return ordered;
    }

    private static List<String> withCanonical(String name, List<String> variants) {
        Set<String> all = new LinkedHashSet<>();
        all.add(name.toLowerCase(Locale.ROOT));
        for (String v : variants) {
            all.add(v.toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(all);
    }

    // Longest variant first so "frankfurt am main" is one mention, not also "frankfurt"
    private static Pattern wholeWord(List<String> variants) {
        List<String> sorted = new ArrayList<>(variants);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alternation = new StringBuilder();
        for (String v : sorted) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(v));
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static void requireCountry(Map<String, Country> countries, String country, String owner) {
        if (!countries.containsKey(country)) {
            throw new IllegalArgumentException(owner + " references unknown country " + country);
        }
    }
}
