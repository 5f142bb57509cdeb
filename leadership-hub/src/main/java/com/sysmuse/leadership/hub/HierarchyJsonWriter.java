package com.sysmuse.leadership.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmuse.leadership.model.CompletenessReport;
import com.sysmuse.leadership.model.HierarchySummary;
import com.sysmuse.leadership.model.LeadershipHierarchy;
import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the serialised hierarchy as pretty-printed JSON.
 */
public class HierarchyJsonWriter {

    private final ObjectMapper mapper;

    public HierarchyJsonWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(LeadershipHierarchy hierarchy) throws JsonProcessingException {
        return mapper.writeValueAsString(hierarchy.toMap());
    }

    /**
     * Run report: the hierarchy summary and its completeness analysis.
     */
    public String reportJson(HierarchySummary summary, CompletenessReport completeness) throws JsonProcessingException {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("summary", summary);
        report.put("completeness", completeness);
        return mapper.writeValueAsString(report);
    }

    public void write(LeadershipHierarchy hierarchy, Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(outputFile.toFile(), hierarchy.toMap());
        LoggingUtil.info("Wrote leadership hierarchy to " + outputFile);
    }
}
