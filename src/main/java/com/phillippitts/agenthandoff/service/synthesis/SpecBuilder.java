package com.phillippitts.agenthandoff.service.synthesis;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.FunctionSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;
import com.phillippitts.agenthandoff.exception.SynthesisException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic {@link SpecSynthesizer} backed by the {@link CategoryTable}.
 *
 * <p>The business type selects a category; the category supplies voice, default tone, default
 * functions and sample responses. User-supplied tone, functions, audience, special requirements
 * and contact details are appended to the category's instruction skeleton as separate sections
 * and never rewrite it.
 *
 * <p>Pure: no I/O, no shared mutable state. The same snapshot always yields an equal spec.
 */
public final class SpecBuilder implements SpecSynthesizer {

    static final String FALLBACK_BUSINESS_NAME = "our business";
    static final String FALLBACK_AGENT_NAME = "Custom";

    private final CategoryTable table;

    public SpecBuilder(CategoryTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public AgentSpec synthesize(RequirementsSnapshot snapshot) {
        if (snapshot == null) {
            throw SynthesisException.failed("No requirements to synthesize from");
        }
        CategoryTemplate category = table.resolve(snapshot.businessType());
        List<FunctionSpec> functions = table.functionsOf(category);
        String businessName = hasText(snapshot.businessName()) ? snapshot.businessName().trim() : null;
        String displayName = businessName != null ? businessName : FALLBACK_BUSINESS_NAME;

        String agentType = (businessName != null ? businessName : FALLBACK_AGENT_NAME)
                + " " + category.title() + " Assistant";

        Map<String, String> context = new LinkedHashMap<>();
        context.put(AgentSpec.BUSINESS_TYPE, category.name());
        context.put(AgentSpec.BUSINESS_NAME, businessName);
        context.put(AgentSpec.TONE, hasText(snapshot.tone()) ? snapshot.tone().trim() : category.tone());
        context.put(AgentSpec.FUNCTIONS, snapshot.mainFunctions().isEmpty()
                ? null : String.join(", ", snapshot.mainFunctions()));

        return new AgentSpec(
                agentType,
                instructions(snapshot, category, functions, displayName),
                category.voice(),
                functions,
                sampleResponses(category, displayName),
                context);
    }

    private static String instructions(RequirementsSnapshot snapshot, CategoryTemplate category,
                                       List<FunctionSpec> functions, String displayName) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a ").append(category.tone()).append(" AI assistant for ").append(displayName);
        if (hasText(snapshot.businessType())) {
            sb.append(", a ").append(snapshot.businessType().trim());
        }
        sb.append(".\n");
        sb.append("You answer calls on behalf of ").append(displayName)
                .append(" and help callers get what they need quickly.\n\n");

        sb.append("Key functions you can help with:\n");
        for (FunctionSpec fn : functions) {
            sb.append("- ").append(fn.description()).append(" (").append(fn.name()).append(")\n");
        }

        sb.append("\nGuidelines:\n");
        sb.append("- Keep answers short and conversational; you are speaking, not writing.\n");
        sb.append("- Confirm important details such as dates, times, names and phone numbers.\n");
        sb.append("- If you cannot help with something, offer to take a message.\n");

        appendSection(sb, "Preferred tone", hasText(snapshot.tone()) ? List.of(snapshot.tone().trim()) : List.of());
        appendSection(sb, "Additional functions requested by the owner", snapshot.mainFunctions());
        appendSection(sb, "Target audience",
                hasText(snapshot.targetAudience()) ? List.of(snapshot.targetAudience().trim()) : List.of());
        appendSection(sb, "Special requirements", snapshot.specialRequirements());

        List<String> contacts = new ArrayList<>();
        snapshot.contactInfo().forEach((kind, value) -> contacts.add(kind + ": " + value));
        appendSection(sb, "Contact information", contacts);
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(":\n");
        for (String line : lines) {
            sb.append("- ").append(line).append('\n');
        }
    }

    private static List<String> sampleResponses(CategoryTemplate category, String displayName) {
        List<String> rendered = new ArrayList<>(category.responseTemplates().size());
        for (String template : category.responseTemplates()) {
            rendered.add(template.replace(CategoryTemplate.BUSINESS_NAME_PLACEHOLDER, displayName));
        }
        return rendered;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
