package com.phillippitts.agenthandoff.service.synthesis;

import com.phillippitts.agenthandoff.domain.FunctionSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the category table from its JSON document.
 *
 * <p>Expected shape:
 * <pre>{@code
 * {
 *   "functions": { "take_order": { "description": "...", "parameters": ["items", ...] }, ... },
 *   "categories": [ { "name": "pizza", "keywords": [...], "voice": "echo", "tone": "...",
 *                     "functions": [...], "responses": [...] }, ... ],
 *   "default": { "name": "general", ... }
 * }
 * }</pre>
 *
 * <p>A broken catalog is a deployment error: every problem fails
 * fast with an {@link IllegalStateException} naming the offending entry.
 */
public final class CategoryTableLoader {

    private static final Logger LOG = LogManager.getLogger(CategoryTableLoader.class);

    private CategoryTableLoader() {}

    /**
     * Loads and validates the table from a Spring resource.
     *
     * @throws IllegalStateException if the resource is missing, unreadable or invalid
     */
    public static CategoryTable load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException("Category table not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            CategoryTable table = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            LOG.info("Loaded category table from {} ({} categories + fallback '{}')",
                    resource.getDescription(), table.rules().size(), table.fallback().name());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read category table: " + resource.getDescription(), e);
        }
    }

    /**
     * Parses and validates a JSON document.
     *
     * @throws IllegalStateException if the document is malformed or references unknown functions
     */
    public static CategoryTable parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalStateException("Category table is empty");
        }
        try {
            JSONObject root = new JSONObject(json);
            FunctionCatalog catalog = parseCatalog(root.getJSONObject("functions"));

            JSONArray categories = root.getJSONArray("categories");
            List<CategoryTemplate> rules = new ArrayList<>(categories.length());
            for (int i = 0; i < categories.length(); i++) {
                rules.add(parseCategory(categories.getJSONObject(i)));
            }
            CategoryTemplate fallback = parseCategory(root.getJSONObject("default"));
            return new CategoryTable(rules, fallback, catalog);
        } catch (JSONException | IllegalArgumentException | NullPointerException e) {
            throw new IllegalStateException("Invalid category table: " + e.getMessage(), e);
        }
    }

    private static FunctionCatalog parseCatalog(JSONObject functions) {
        Map<String, FunctionSpec> specs = new LinkedHashMap<>();
        for (String name : functions.keySet()) {
            JSONObject fn = functions.getJSONObject(name);
            specs.put(name, new FunctionSpec(name, fn.getString("description"),
                    strings(fn.optJSONArray("parameters"))));
        }
        return new FunctionCatalog(specs);
    }

    private static CategoryTemplate parseCategory(JSONObject obj) {
        return new CategoryTemplate(
                obj.getString("name"),
                strings(obj.optJSONArray("keywords")),
                obj.getString("voice"),
                obj.getString("tone"),
                strings(obj.optJSONArray("functions")),
                strings(obj.optJSONArray("responses")));
    }

    private static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            out.add(array.getString(i));
        }
        return out;
    }
}
