package com.peirce.eg.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunables of the editor and translator.
 *
 * <p>
 * Read from the classpath resource {@value #RESOURCE} when present; any field
 * missing from the file keeps its default. Example:
 *
 * <pre>
 * { "variablePrefix": "x", "maxCanonicalRounds": 8, "maxDeiterationCandidates": 100000 }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EgSettings {
    public static final String RESOURCE = "eg-settings.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Prefix of generated CLIF variable names: x1, x2, ... */
    private String variablePrefix = "x";

    /** Upper bound on the translator's naming fixpoint passes. */
    private int maxCanonicalRounds = 8;

    /** Upper bound on candidate combinations tried per de-iteration check. */
    private int maxDeiterationCandidates = 100_000;

    /**
     * Settings from {@value #RESOURCE} on the classpath, or built-in defaults
     * when the resource is absent.
     */
    public static EgSettings defaults() {
        try (InputStream in = EgSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath, using built-in defaults", RESOURCE);
                return new EgSettings();
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static EgSettings load(InputStream in) throws IOException {
        return MAPPER.readValue(in, EgSettings.class).validate();
    }

    public static EgSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, EgSettings.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Checks field ranges.
     *
     * @return this instance.
     * @throws IllegalArgumentException on an unusable value.
     */
    public EgSettings validate() {
        if (variablePrefix == null || variablePrefix.isBlank())
            throw new IllegalArgumentException("variablePrefix must not be blank");
        for (char c : variablePrefix.toCharArray())
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';')
                throw new IllegalArgumentException("variablePrefix contains a CLIF delimiter: '" + variablePrefix + "'");
        if (maxCanonicalRounds < 1)
            throw new IllegalArgumentException("maxCanonicalRounds must be >= 1");
        if (maxDeiterationCandidates < 1)
            throw new IllegalArgumentException("maxDeiterationCandidates must be >= 1");
        return this;
    }
}
