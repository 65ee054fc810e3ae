package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.exception.GazetteerLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads gazetteer tables from a classpath JSON document:
 * <pre>
 * {
 *   "countries": [{"name": "Germany", "continent": "Europe", "variants": [...], "codes": [...]}],
 *   "states":    [{"name": "Hesse", "country": "Germany", "variants": [...]}],
 *   "cities":    [{"name": "Frankfurt", "state": "Hesse", "country": "Germany", "variants": [...]}]
 * }
 * </pre>
 */
public final class GazetteerLoader {

    private static final Logger LOG = LogManager.getLogger(GazetteerLoader.class);

    private GazetteerLoader() {
    }

    /**
     * @throws GazetteerLoadException if the resource is missing, unreadable or malformed
     */
    public static Gazetteer fromClasspath(String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new GazetteerLoadException(resourcePath, "resource not found on classpath");
        }
        String json;
        try (InputStream in = resource.getInputStream()) {
            json = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GazetteerLoadException(resourcePath, e);
        }
        Gazetteer gazetteer = parse(resourcePath, json);
        LOG.info("Gazetteer loaded from {}: {} entries", resourcePath, gazetteer.size());
        return gazetteer;
    }

    static Gazetteer parse(String source, String json) {
        try {
            JSONObject root = new JSONObject(json);
            List<Gazetteer.Country> countries = new ArrayList<>();
            JSONArray countryArray = root.getJSONArray("countries");
            for (int i = 0; i < countryArray.length(); i++) {
                JSONObject c = countryArray.getJSONObject(i);
                countries.add(new Gazetteer.Country(c.getString("name"), c.optString("continent", null),
                        strings(c.optJSONArray("variants")), strings(c.optJSONArray("codes"))));
            }
            List<Gazetteer.State> states = new ArrayList<>();
            JSONArray stateArray = root.optJSONArray("states");
            for (int i = 0; stateArray != null && i < stateArray.length(); i++) {
                JSONObject s = stateArray.getJSONObject(i);
                states.add(new Gazetteer.State(s.getString("name"), s.getString("country"),
                        strings(s.optJSONArray("variants"))));
            }
            List<Gazetteer.City> cities = new ArrayList<>();
            JSONArray cityArray = root.getJSONArray("cities");
            for (int i = 0; i < cityArray.length(); i++) {
                JSONObject c = cityArray.getJSONObject(i);
                cities.add(new Gazetteer.City(c.getString("name"), c.optString("state", null),
                        c.getString("country"), strings(c.optJSONArray("variants"))));
            }
            return new Gazetteer(countries, states, cities);
        } catch (JSONException | IllegalArgumentException e) {
            throw new GazetteerLoadException(source, e);
        }
    }

    private static List<String> strings(JSONArray array) {
        List<String> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            out.add(array.getString(i));
        }
        return out;
    }
}
