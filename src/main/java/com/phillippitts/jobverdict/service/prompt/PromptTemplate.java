package com.phillippitts.jobverdict.service.prompt;

import com.phillippitts.jobverdict.exception.PromptTemplateException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt text with named {@code {{slot}}} placeholders.
 *
 * <p>Every slot found in the text is required: rendering fails with {@link PromptTemplateException}
 * if a value is missing, and {@link #requireSlots(Set)} lets typed prompt records verify at startup that
 * the template declares exactly the slots they fill. Immutable and thread-safe.
 */
public final class PromptTemplate {

    private static final Pattern SLOT = Pattern.compile("\\{\\{\\s*([a-zA-Z][a-zA-Z0-9_]*)\\s*}}");

    private final String name;
    private final String text;
    private final Set<String> slots;

    private PromptTemplate(String name, String text) {
        this.name = name;
        this.text = text;
        Set<String> found = new LinkedHashSet<>();
        Matcher m = SLOT.matcher(text);
        while (m.find()) {
            found.add(m.group(1));
        }
        this.slots = Collections.unmodifiableSet(found);
    }

    public static PromptTemplate of(String name, String text) {
        Objects.requireNonNull(name, "name");
        if (text == null || text.isBlank()) {
            throw new PromptTemplateException(name, "template text is empty");
        }
        return new PromptTemplate(name, text);
    }

    /**
     * Loads a UTF-8 template from the classpath.
     *
     * @throws PromptTemplateException if the resource is missing or unreadable
     */
    public static PromptTemplate fromClasspath(String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new PromptTemplateException(resourcePath, "resource not found on classpath");
        }
        try (InputStream in = resource.getInputStream()) {
            return of(resourcePath, StreamUtils.copyToString(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PromptTemplateException(resourcePath, "resource could not be read", e);
        }
    }

    /**
     * Fails fast unless the template declares exactly the expected slots.
     *
     * @return this template, for chaining at wiring time
     */
    public PromptTemplate requireSlots(Set<String> expected) {
        if (!slots.equals(expected)) {
            throw new PromptTemplateException(name, "declares slots " + slots + " but " + expected + " are required");
        }
        return this;
    }

    /**
     * Substitutes every slot.
     *
     * @throws PromptTemplateException if a slot has no value
     */
    public String render(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        for (String slot : slots) {
            if (values.get(slot) == null) {
                throw new PromptTemplateException(name, "missing value for slot '" + slot + "'");
            }
        }
        Matcher m = SLOT.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 256);
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(values.get(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public String name() {
        return name;
    }

    public Set<String> slots() {
        return slots;
    }
}
