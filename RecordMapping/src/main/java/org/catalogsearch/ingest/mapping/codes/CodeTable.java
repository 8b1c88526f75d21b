package org.catalogsearch.ingest.mapping.codes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.catalogsearch.ingest.mapping.ConfigurationException;

import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Code to display-name table read from a code list document where each entry is an element
 * named after the code type holding {@code name} and {@code code} children, e.g.
 * {@code <language><name>English</name><code>eng</code></language>}.
 */
@Slf4j
public final class CodeTable {
    public static final String LANGUAGE = "language";
    public static final String COUNTRY = "country";
    public static final String DEFAULT_LANGUAGES_RESOURCE = "config/languages.xml";
    public static final String DEFAULT_COUNTRIES_RESOURCE = "config/countries.xml";

    private static final XmlMapper xmlMapper = new XmlMapper();

    @Getter
    private final String codeType;
    private final Map<String, String> namesByCode;

    private CodeTable(String codeType, Map<String, String> namesByCode) {
        this.codeType = codeType;
        this.namesByCode = Collections.unmodifiableMap(namesByCode);
    }

    public static CodeTable of(String codeType, Map<String, String> namesByCode) {
        return new CodeTable(codeType, new HashMap<>(namesByCode));
    }

    public static CodeTable load(String codeType, Path path) {
        try (var in = Files.newInputStream(path)) {
            return load(codeType, in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + codeType + " codes from " + path + ": " + e.getMessage(), e);
        }
    }

    public static CodeTable loadResource(String codeType, String resource) {
        var in = CodeTable.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Code list " + resource + " is missing from the classpath");
        }
        try (in) {
            return load(codeType, in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + codeType + " codes from " + resource, e);
        }
    }

    public static CodeTable load(String codeType, InputStream in, String description) {
        var namesByCode = new HashMap<String, String>();
        try (var parser = xmlMapper.getFactory().createParser(in)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token != JsonToken.FIELD_NAME || !codeType.equals(parser.currentName())) {
                    continue;
                }
                var valueToken = parser.nextToken();
                if (valueToken == JsonToken.START_OBJECT) {
                    addEntry(namesByCode, xmlMapper.readTree(parser));
                } else if (valueToken == JsonToken.START_ARRAY) {
                    for (JsonNode entry : (JsonNode) xmlMapper.readTree(parser)) {
                        addEntry(namesByCode, entry);
                    }
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Invalid " + codeType + " code list " + description + ": " + e.getMessage(), e);
        }
        if (namesByCode.isEmpty()) {
            throw new ConfigurationException("No " + codeType + " entries found in " + description);
        }
        log.atDebug().setMessage("Loaded {} {} codes from {}")
            .addArgument(namesByCode::size)
            .addArgument(codeType)
            .addArgument(description)
            .log();
        return new CodeTable(codeType, namesByCode);
    }

    private static void addEntry(Map<String, String> namesByCode, JsonNode entry) {
        var code = textOf(entry.get("code"));
        var name = textOf(entry.get("name"));
        if (code.isEmpty() || name.isEmpty()) {
            return;
        }
        namesByCode.putIfAbsent(code, name);
    }

    // Elements carrying attributes arrive as objects with the text under the empty key
    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            return node.size() == 0 ? "" : textOf(node.get(0));
        }
        if (node.isObject()) {
            return node.path("").asText("").trim();
        }
        return node.asText("").trim();
    }

    public Optional<String> name(String code) {
        return Optional.ofNullable(namesByCode.get(code));
    }

    public int size() {
        return namesByCode.size();
    }
}
