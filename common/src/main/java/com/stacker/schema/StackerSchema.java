package com.stacker.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Index settings, analysers and field mapping shared by the property and prospect indexes.
 *
 * <p>The definition lives in the classpath resource {@value #DEFINITION_RESOURCE}. Its
 * {@code mappings.properties} key order is the canonical field order: the projector's SQL
 * produces columns in exactly this order and rows are zipped against {@link #fields()}.
 * Street synonyms and address stop words are inlined into the analysis settings from
 * {@value #SYNONYMS_RESOURCE} and {@value #STOP_WORDS_RESOURCE}, so nodes need no local files.</p>
 */
public final class StackerSchema {

    static final String DEFINITION_RESOURCE = "stacker/stacker-index.json";
    static final String SYNONYMS_RESOURCE = "stacker/analysis/street_synonyms.txt";
    static final String STOP_WORDS_RESOURCE = "stacker/analysis/stop_words.txt";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static volatile StackerSchema instance;

    private final Map<String, Object> definition;
    private final List<String> fields;
    private final Set<String> fieldSet;

    private StackerSchema(Map<String, Object> definition) {
        this.definition = definition;
        this.fields = Collections.unmodifiableList(new ArrayList<>(properties(definition).keySet()));
        this.fieldSet = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    /**
     * Canonical ordered field names of every Stacker document.
     */
    public static List<String> fields() {
        return get().fields;
    }

    public static boolean hasField(String field) {
        return get().fieldSet.contains(field);
    }

    /**
     * A fresh, mutable copy of the full index definition ({@code settings} + {@code mappings})
     * ready to be sent as a create-index body.
     */
    public static Map<String, Object> indexDefinition() {
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(get().definition),
                    new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy Stacker index definition", e);
        }
    }

    private static StackerSchema get() {
        StackerSchema schema = instance;
        if (schema == null) {
            synchronized (StackerSchema.class) {
                schema = instance;
                if (schema == null) {
                    schema = new StackerSchema(loadDefinition());
                    instance = schema;
                }
            }
        }
        return schema;
    }

    // ── Loading ──────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadDefinition() {
        try (InputStream is = resource(DEFINITION_RESOURCE)) {
            Map<String, Object> definition = MAPPER.readValue(is,
                    new TypeReference<LinkedHashMap<String, Object>>() { });

            Map<String, Object> analysis = (Map<String, Object>)
                    ((Map<String, Object>) definition.get("settings")).get("analysis");
            Map<String, Object> filters = (Map<String, Object>) analysis.get("filter");
            ((Map<String, Object>) filters.get("street_synonyms")).put("synonyms", readLines(SYNONYMS_RESOURCE));
            ((Map<String, Object>) filters.get("street_search_filter")).put("stopwords", readLines(STOP_WORDS_RESOURCE));
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load Stacker index definition", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> properties(Map<String, Object> definition) {
        Map<String, Object> mappings = (Map<String, Object>) definition.get("mappings");
        return (Map<String, Object>) mappings.get("properties");
    }

    /** Non-blank lines of a text resource, {@code #} comments skipped. */
    private static List<String> readLines(String name) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource(name), StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .collect(Collectors.toList());
        }
    }

    private static InputStream resource(String name) throws IOException {
        InputStream is = StackerSchema.class.getClassLoader().getResourceAsStream(name);
        if (is == null) {
            throw new IOException("Resource not found on classpath: " + name);
        }
        return is;
    }
}
