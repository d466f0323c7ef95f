package com.phillippitts.agenthandoff.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable specification of a synthesized task persona.
 *
 * <p>A re-synthesis always produces a new instance; nothing here is ever mutated after
 * construction. {@code businessContext} keeps insertion order and silently drops null values.
 *
 * @param agentType        display name, e.g. "Tony's Pizza Pizza Assistant"
 * @param instructions     full persona prompt
 * @param voice            voice identifier from the resolved category
 * @param functions        advertised functions
 * @param sampleResponses  rendered sample utterances
 * @param businessContext  derived display fields (business_type, business_name, tone, functions)
 */
public record AgentSpec(
        String agentType,
        String instructions,
        String voice,
        List<FunctionSpec> functions,
        List<String> sampleResponses,
        Map<String, String> businessContext
) {

    public static final String BUSINESS_TYPE = "business_type";
    public static final String BUSINESS_NAME = "business_name";
    public static final String TONE = "tone";
    public static final String FUNCTIONS = "functions";

    public AgentSpec {
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(instructions, "instructions must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
        functions = functions == null ? List.of() : List.copyOf(functions);
        sampleResponses = sampleResponses == null ? List.of() : List.copyOf(sampleResponses);
        Map<String, String> ctx = new LinkedHashMap<>();
        if (businessContext != null) {
            businessContext.forEach((k, v) -> {
                if (k != null && v != null) {
                    ctx.put(k, v);
                }
            });
        }
        businessContext = Collections.unmodifiableMap(ctx);
    }

    /**
     * Returns a business-context value or the given fallback when absent or blank.
     */
    public String contextValue(String key, String fallback) {
        String v = businessContext.get(key);
        return v == null || v.isBlank() ? fallback : v;
    }
}
