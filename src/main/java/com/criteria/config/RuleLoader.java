package com.criteria.config;

import com.criteria.core.LeafCriteria;
import com.criteria.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Loads rule documents from YAML or JSON files.
 * Supports classpath: prefix for classpath resources; {@code .json} files are read as JSON,
 * everything else as YAML.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final RuleParser ruleParser;
    private final ObjectMapper objectMapper;

    public RuleLoader() {
        this(new RuleParser());
    }

    public RuleLoader(RuleParser ruleParser) {
        this.ruleParser = ruleParser;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load a rule document from a path.
     *
     * @param path File path, or classpath resource with the classpath: prefix
     * @return Parsed leaf criteria
     */
    public LeafCriteria load(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Rule path cannot be blank");
        }
        log.info("Loading rules from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            Object document = isJson(path) ? readJson(inputStream, path) : readYaml(inputStream, path);
            LeafCriteria criteria = parseDocument(document, path);
            log.info("Loaded {} filter(s) and {} order(s) from: {}",
                    criteria.filters().size(), criteria.orders().size(), path);
            return criteria;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rules from: " + path, e);
        }
    }

    /**
     * Parse an inline JSON rule document.
     */
    public LeafCriteria parseJson(String json) {
        try {
            Object document = objectMapper.readValue(json, Object.class);
            return parseDocument(document, "inline JSON");
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON rule document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse an inline YAML rule document.
     */
    public LeafCriteria parseYaml(String yamlText) {
        Object document;
        try {
            document = newYaml().load(yamlText);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML rule document: " + e.getMessage(), e);
        }
        return parseDocument(document, "inline YAML");
    }

    private LeafCriteria parseDocument(Object document, String source) {
        if (document == null) {
            throw new ConfigurationException("Rule document is empty: " + source);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Rule document must be a mapping: " + source);
        }
        return ruleParser.parse(map);
    }

    private Object readJson(InputStream inputStream, String path) throws IOException {
        try {
            return objectMapper.readValue(inputStream, Object.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON rule document " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private Object readYaml(InputStream inputStream, String path) {
        try {
            return newYaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML rule document " + path + ": " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml() {
        return new Yaml(new RuleYamlConstructor());
    }

    private static boolean isJson(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }
}
