package com.phillippitts.agenthandoff.service.synthesis;

import com.phillippitts.agenthandoff.domain.FunctionSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered business-type classification rules plus the function catalog they reference.
 *
 * <p>Rules are evaluated in declaration order and the first match wins, so more specific
 * categories ("pizza") must precede broader ones ("restaurant"). A business type matching no
 * rule resolves to the fallback category.
 *
 * <p>Immutable and thread-safe once constructed; shared by all contexts.
 */
public final class CategoryTable {

    private final List<CategoryTemplate> rules;
    private final CategoryTemplate fallback;
    private final FunctionCatalog catalog;

    /**
     * @throws IllegalArgumentException if any category references a function missing from the catalog
     */
    public CategoryTable(List<CategoryTemplate> rules, CategoryTemplate fallback, FunctionCatalog catalog) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        List<CategoryTemplate> all = new ArrayList<>(this.rules);
        all.add(fallback);
        for (CategoryTemplate category : all) {
            for (String fn : category.functions()) {
                if (!catalog.contains(fn)) {
                    throw new IllegalArgumentException(
                            "Category '" + category.name() + "' references unknown function '" + fn + "'");
                }
            }
        }
    }

    /**
     * Resolves a business type to its category.
     *
     * @param businessType free-form business type, may be null
     * @return first matching category, or the fallback
     */
    public CategoryTemplate resolve(String businessType) {
        for (CategoryTemplate rule : rules) {
            if (rule.matches(businessType)) {
                return rule;
            }
        }
        return fallback;
    }

    /**
     * Function definitions for a category, in category order.
     */
    public List<FunctionSpec> functionsOf(CategoryTemplate category) {
        List<FunctionSpec> specs = new ArrayList<>(category.functions().size());
        for (String name : category.functions()) {
            catalog.find(name).ifPresent(specs::add);
        }
        return List.copyOf(specs);
    }

    public List<CategoryTemplate> rules() {
        return rules;
    }

    public CategoryTemplate fallback() {
        return fallback;
    }
}
