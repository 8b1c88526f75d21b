package org.catalogsearch.ingest.mapping.rules;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogsearch.ingest.mapping.ConfigurationException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * The rules for a run, keyed by label. Built once at startup and never modified.
 */
@Slf4j
public final class Ruleset {
    public static final String DEFAULT_RESOURCE = "config/marc_rules.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, Rule> rulesByLabel;

    private Ruleset(Map<String, Rule> rulesByLabel) {
        this.rulesByLabel = Collections.unmodifiableMap(rulesByLabel);
    }

    public static Ruleset of(List<Rule> rules) {
        var byLabel = new LinkedHashMap<String, Rule>();
        for (var rule : rules) {
            if (rule == null || rule.label() == null || rule.label().isBlank()) {
                throw new ConfigurationException("Every rule must have a label");
            }
            if (byLabel.putIfAbsent(rule.label(), rule) != null) {
                throw new ConfigurationException("Duplicate rule label '" + rule.label() + "'");
            }
        }
        return new Ruleset(byLabel);
    }

    public static Ruleset load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read ruleset " + path + ": " + e.getMessage(), e);
        }
    }

    public static Ruleset loadDefault() {
        var in = Ruleset.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new ConfigurationException("Bundled ruleset " + DEFAULT_RESOURCE + " is missing from the classpath");
        }
        try (in) {
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read ruleset " + DEFAULT_RESOURCE, e);
        }
    }

    public static Ruleset load(InputStream in, String description) {
        List<Rule> rules;
        try {
            rules = objectMapper.readValue(in, new TypeReference<List<Rule>>() {});
        } catch (IOException e) {
            throw new ConfigurationException("Invalid ruleset " + description + ": " + e.getMessage(), e);
        }
        if (rules == null || rules.isEmpty()) {
            throw new ConfigurationException("Ruleset " + description + " contains no rules");
        }
        var ruleset = of(rules);
        log.atDebug().setMessage("Loaded {} rules from {}").addArgument(rules::size).addArgument(description).log();
        return ruleset;
    }

    public Rule rule(String label) {
        var rule = rulesByLabel.get(label);
        if (rule == null) {
            throw new ConfigurationException("No rule defined for label '" + label + "'");
        }
        return rule;
    }

    public boolean hasRule(String label) {
        return rulesByLabel.containsKey(label);
    }

    /** Fails with every missing label listed, so a bad ruleset is fixed in one pass. */
    public void requireLabels(Collection<String> labels) {
        var missing = new ArrayList<String>();
        for (var label : labels) {
            if (!rulesByLabel.containsKey(label)) {
                missing.add(label);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Ruleset is missing rules for labels " + missing);
        }
    }

    public Collection<Rule> rules() {
        return rulesByLabel.values();
    }

    public int size() {
        return rulesByLabel.size();
    }
}
