package com.sysmuse.leadership.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the hierarchy catalogue JSON into a {@link HierarchyConfig}.
 * All validation happens here so a bad catalogue fails before any roster row is read.
 */
public class HierarchyConfigLoader {

    public static final String DEFAULT_RESOURCE = "leadership/hierarchy-v1.json";

    private static volatile HierarchyConfig defaultConfig;

    private final ObjectMapper mapper;

    public HierarchyConfigLoader() {
        this(new ObjectMapper());
    }

    public HierarchyConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Process-wide catalogue from the classpath, loaded on first use.
     */
    public static HierarchyConfig getDefault() throws HierarchyConfigException {
        HierarchyConfig config = defaultConfig;
        if (config == null) {
            synchronized (HierarchyConfigLoader.class) {
                config = defaultConfig;
                if (config == null) {
                    config = new HierarchyConfigLoader().loadFromClasspath(DEFAULT_RESOURCE);
                    defaultConfig = config;
                }
            }
        }
        return config;
    }

    public HierarchyConfig load(Path path) throws HierarchyConfigException {
        if (!Files.isRegularFile(path)) {
            throw new HierarchyConfigException("Hierarchy config file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (HierarchyConfigException e) {
            throw e;
        } catch (IOException e) {
            throw new HierarchyConfigException("Failed to read hierarchy config " + path + ": " + e.getMessage(), e);
        }
    }

    public HierarchyConfig loadFromClasspath(String resource) throws HierarchyConfigException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = HierarchyConfigLoader.class.getClassLoader();
        }
        InputStream in = loader.getResourceAsStream(resource);
        if (in == null) {
            throw new HierarchyConfigException("Hierarchy config resource not found: " + resource);
        }
        try (InputStream stream = in) {
            return load(stream, "classpath:" + resource);
        } catch (HierarchyConfigException e) {
            throw e;
        } catch (IOException e) {
            throw new HierarchyConfigException("Failed to read hierarchy config " + resource + ": " + e.getMessage(), e);
        }
    }

    public HierarchyConfig load(InputStream in, String source) throws HierarchyConfigException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new HierarchyConfigException("Malformed hierarchy config " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new HierarchyConfigException("Failed to read hierarchy config " + source + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new HierarchyConfigException("Hierarchy config " + source + " is not a JSON object");
        }
        return parse(root, source);
    }

    HierarchyConfig parse(JsonNode root, String source) throws HierarchyConfigException {
        JsonNode sectionsNode = root.get("sections");
        if (sectionsNode == null || !sectionsNode.isObject()) {
            throw new HierarchyConfigException("Hierarchy config " + source + " has no 'sections' object");
        }

        String version = root.path("version").asText("1.0");

        Map<String, SectionConfig> sections = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = sectionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            sections.put(entry.getKey(), parseSection(entry.getKey(), entry.getValue()));
        }

        List<String> sports = new ArrayList<>();
        JsonNode sportsNode = root.get("sports");
        if (sportsNode != null && !sportsNode.isNull()) {
            if (!sportsNode.isArray()) {
                throw new HierarchyConfigException("Hierarchy config " + source + " 'sports' must be a list");
            }
            for (JsonNode sportNode : sportsNode) {
                String sport = sportNode.asText().trim();
                SectionConfig section = sections.get(sport);
                if (section == null || section.isList()) {
                    throw new HierarchyConfigException("Sport '" + sport + "' in " + source
                            + " has no leadership section");
                }
                sports.add(sport);
            }
        }

        LoggingUtil.debug("Loaded hierarchy config " + source + " version " + version
                + " with " + sections.size() + " sections");
        return new HierarchyConfig(version, sections, sports);
    }

    private SectionConfig parseSection(String key, JsonNode node) throws HierarchyConfigException {
        if (!node.isObject()) {
            throw new HierarchyConfigException("Section '" + key + "' must be an object");
        }
        String name = requireText(node, "name", "section '" + key + "'");

        JsonNode headersNode = node.get("csv_section_headers");
        if (headersNode == null || !headersNode.isArray() || headersNode.size() == 0) {
            throw new HierarchyConfigException("Section '" + key + "' needs a non-empty 'csv_section_headers' list");
        }
        List<String> headers = new ArrayList<>();
        for (JsonNode header : headersNode) {
            headers.add(header.asText().trim().toLowerCase(Locale.ROOT));
        }

        if (node.path("is_list").asBoolean(false)) {
            return new ListSectionConfig(key, name, headers);
        }

        JsonNode positionsNode = node.get("positions");
        List<PositionConfig> positions = new ArrayList<>();
        Set<String> roleKeys = new HashSet<>();
        if (positionsNode != null) {
            if (!positionsNode.isArray()) {
                throw new HierarchyConfigException("Section '" + key + "' 'positions' must be a list");
            }
            int index = 0;
            for (JsonNode positionNode : positionsNode) {
                PositionConfig position = parsePosition(key, positionNode, index++);
                if (!roleKeys.add(position.getRoleKey())) {
                    throw new HierarchyConfigException("Duplicate role key '" + position.getRoleKey()
                            + "' in section '" + key + "'");
                }
                positions.add(position);
            }
        }
        for (String roleKey : roleKeys) {
            for (String other : roleKeys) {
                if (other.startsWith(roleKey + ".")) {
                    throw new HierarchyConfigException("Role key '" + roleKey + "' in section '" + key
                            + "' is also a level of '" + other + "'");
                }
            }
        }
        return new TreeSectionConfig(key, name, headers, positions);
    }

    private PositionConfig parsePosition(String sectionKey, JsonNode node, int index)
            throws HierarchyConfigException {
        String where = "position #" + index + " of section '" + sectionKey + "'";
        if (!node.isObject()) {
            throw new HierarchyConfigException(where + " must be an object");
        }
        String roleKey = requireText(node, "role_key", where);
        String title = requireText(node, "title", where);

        JsonNode patternsNode = node.get("match_patterns");
        if (patternsNode == null || !patternsNode.isObject()) {
            throw new HierarchyConfigException(where + " needs a 'match_patterns' object");
        }
        MatchPattern pattern = parsePattern(patternsNode, where);

        boolean required = node.path("required").asBoolean(false);
        int priority = node.path("priority").asInt(0);

        try {
            return new PositionConfig(roleKey, title, pattern, required, priority, index);
        } catch (IllegalArgumentException e) {
            throw new HierarchyConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private MatchPattern parsePattern(JsonNode node, String where) throws HierarchyConfigException {
        String exact = null;
        JsonNode exactNode = node.get("exact");
        if (exactNode != null && !exactNode.isNull()) {
            exact = exactNode.asText().trim();
        }

        List<List<String>> alternatives = new ArrayList<>();
        JsonNode keywordsNode = node.get("keywords");
        if (keywordsNode != null && !keywordsNode.isNull()) {
            if (!keywordsNode.isArray()) {
                throw new HierarchyConfigException(where + " 'keywords' must be a list of term lists");
            }
            for (JsonNode groupNode : keywordsNode) {
                if (!groupNode.isArray() || groupNode.size() == 0) {
                    throw new HierarchyConfigException(where + " has an empty keyword list");
                }
                List<String> terms = new ArrayList<>();
                for (JsonNode term : groupNode) {
                    String value = term.asText().trim().toLowerCase(Locale.ROOT);
                    if (value.isEmpty()) {
                        throw new HierarchyConfigException(where + " has a blank keyword");
                    }
                    terms.add(value);
                }
                alternatives.add(terms);
            }
        }

        if ((exact == null || exact.isEmpty()) && alternatives.isEmpty()) {
            throw new HierarchyConfigException(where + " has neither an exact value nor keywords");
        }
        return new MatchPattern(exact, alternatives);
    }

    private static String requireText(JsonNode node, String field, String where) throws HierarchyConfigException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().trim().isEmpty()) {
            throw new HierarchyConfigException(where + " is missing '" + field + "'");
        }
        return value.asText().trim();
    }
}
