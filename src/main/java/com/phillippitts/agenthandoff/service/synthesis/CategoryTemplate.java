package com.phillippitts.agenthandoff.service.synthesis;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One row of the category table: the keywords that select it and the defaults it contributes
 * to a synthesized persona.
 *
 * @param name              category name, e.g. "pizza"
 * @param keywords          lowercase keywords matched as substrings of the business type
 * @param voice             default voice identifier
 * @param tone              default tone
 * @param functions         default function names, resolved against the {@link FunctionCatalog}
 * @param responseTemplates sample responses with a {@code {business_name}} placeholder
 */
public record CategoryTemplate(
        String name,
        List<String> keywords,
        String voice,
        String tone,
        List<String> functions,
        List<String> responseTemplates
) {

    public static final String BUSINESS_NAME_PLACEHOLDER = "{business_name}";

    public CategoryTemplate {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
        Objects.requireNonNull(tone, "tone must not be null");
        keywords = keywords == null
                ? List.of()
                : keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        functions = functions == null ? List.of() : List.copyOf(functions);
        responseTemplates = responseTemplates == null ? List.of() : List.copyOf(responseTemplates);
    }

    /**
     * Case-insensitive substring match of any keyword against the business type.
     */
    public boolean matches(String businessType) {
        if (businessType == null || businessType.isBlank()) {
            return false;
        }
        String lower = businessType.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Category name with a leading capital, as used in agent type names ("Pizza Assistant").
     */
    public String title() {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
