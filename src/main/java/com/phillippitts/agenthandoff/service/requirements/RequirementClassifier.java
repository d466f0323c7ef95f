package com.phillippitts.agenthandoff.service.requirements;

import com.phillippitts.agenthandoff.domain.RequirementsStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps free-form requirement keys, as produced by the gathering persona's tool calls, onto
 * {@link RequirementsStore} fields.
 *
 * <p>Classification is a data-driven ordered rule table: the key is normalized (lowercase,
 * spaces and hyphens to underscores) and the first rule with an alias contained in the key wins.
 * Keys matching no rule fall into {@link RequirementField#OTHER}. Contact keys are matched first
 * so that {@code contact_name} is a contact, not the business name; cuisine precedes type so
 * that {@code cuisine_type} still yields a restaurant.
 *
 * <p>Stateless and thread-safe.
 */
public final class RequirementClassifier {

    private static final Logger LOG = LogManager.getLogger(RequirementClassifier.class);

    private static final List<Rule> RULES = List.of(
            new Rule(RequirementField.CONTACT, List.of("contact")),
            new Rule(RequirementField.BUSINESS_NAME, List.of("business_name", "name")),
            new Rule(RequirementField.CUISINE, List.of("cuisine")),
            new Rule(RequirementField.BUSINESS_TYPE, List.of("business_type", "type", "industry")),
            new Rule(RequirementField.FUNCTIONS, List.of("function")),
            new Rule(RequirementField.TONE, List.of("tone", "personality")),
            new Rule(RequirementField.TARGET_AUDIENCE, List.of("audience", "target")),
            new Rule(RequirementField.OPERATING_HOURS, List.of("hours", "operating")),
            new Rule(RequirementField.SPECIAL_REQUIREMENT, List.of("special", "requirement"))
    );

    /**
     * Classifies a requirement key.
     *
     * @param key free-form key such as "business_name", "Cuisine" or "contact_phone"
     * @return the matching field, {@link RequirementField#OTHER} when nothing matches
     */
    public RequirementField classify(String key) {
        String normalized = normalize(key);
        for (Rule rule : RULES) {
            if (rule.matches(normalized)) {
                return rule.field();
            }
        }
        return RequirementField.OTHER;
    }

    /**
     * Classifies {@code key} and applies {@code value} to the store. Scalars are overwritten,
     * lists appended.
     *
     * <p>The caller must hold the owning orchestrator's lock.
     *
     * @return the field the value was recorded under
     */
    public RequirementField record(RequirementsStore store, String key, String value) {
        Objects.requireNonNull(store, "store must not be null");
        String v = value == null ? "" : value.trim();
        RequirementField field = classify(key);
        switch (field) {
            case BUSINESS_NAME -> store.setBusinessName(v);
            case BUSINESS_TYPE -> store.setBusinessType(v);
            case CUISINE -> store.setBusinessType(v + " Restaurant");
            case FUNCTIONS -> {
                for (String f : v.split(",")) {
                    if (!f.isBlank()) {
                        store.addFunction(f.trim());
                    }
                }
            }
            case TONE -> store.setTone(v);
            case TARGET_AUDIENCE -> store.setTargetAudience(v);
            case OPERATING_HOURS -> store.addSpecialRequirement("Operating hours: " + v);
            case CONTACT -> store.putContact(contactKind(normalize(key)), v);
            case SPECIAL_REQUIREMENT -> store.addSpecialRequirement(v);
            case OTHER -> store.addSpecialRequirement((key == null ? "detail" : key.trim()) + ": " + v);
        }
        LOG.debug("Recorded requirement key='{}' as {}", key, field);
        return field;
    }

    private static String contactKind(String normalizedKey) {
        String kind = normalizedKey.replace("contact", "");
        while (kind.startsWith("_")) {
            kind = kind.substring(1);
        }
        return kind.isEmpty() ? "general" : kind;
    }

    static String normalize(String key) {
        if (key == null) {
            return "";
        }
        return key.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    private record Rule(RequirementField field, List<String> aliases) {
        boolean matches(String normalizedKey) {
            for (String alias : aliases) {
                if (normalizedKey.contains(alias)) {
                    return true;
                }
            }
            return false;
        }
    }
}
