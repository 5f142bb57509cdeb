package com.sysmuse.leadership.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Offline directory read from a JSON object of {@code "email": "account id"} pairs.
 * Emails are compared case-insensitively.
 */
public class JsonAccountDirectory implements AccountDirectory {

    private final Map<String, String> idsByEmail;

    public JsonAccountDirectory(Map<String, String> idsByEmail) {
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : idsByEmail.entrySet()) {
            normalized.put(key(entry.getKey()), entry.getValue());
        }
        this.idsByEmail = Collections.unmodifiableMap(normalized);
    }

    public static JsonAccountDirectory load(Path file) throws IOException {
        JsonNode root = new ObjectMapper().readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Account directory " + file + " must be a JSON object");
        }
        Map<String, String> ids = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual() && !field.getValue().asText().isEmpty()) {
                ids.put(field.getKey(), field.getValue().asText());
            }
        }
        LoggingUtil.info("Loaded " + ids.size() + " accounts from " + file);
        return new JsonAccountDirectory(ids);
    }

    @Override
    public Optional<String> lookupByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsByEmail.get(key(email)));
    }

    public int size() {
        return idsByEmail.size();
    }

    private static String key(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
