package com.phillippitts.agenthandoff.config;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import com.phillippitts.agenthandoff.service.requirements.RequirementClassifier;
import com.phillippitts.agenthandoff.service.synthesis.CategoryTable;
import com.phillippitts.agenthandoff.service.synthesis.CategoryTableLoader;
import com.phillippitts.agenthandoff.service.synthesis.SpecBuilder;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the category table and the default synthesizer.
 *
 * <p>The table location comes from {@code handoff.catalog-location}; an unreadable or invalid
 * table fails application start.
 */
@Configuration
public class SynthesisConfig {

    @Bean
    public CategoryTable categoryTable(HandoffProperties properties, ResourceLoader resourceLoader) {
        return CategoryTableLoader.load(resourceLoader.getResource(properties.getCatalogLocation()));
    }

    /**
     * Table-driven synthesizer. Replace by declaring another {@link SpecSynthesizer} bean.
     */
    @Bean
    @ConditionalOnMissingBean(SpecSynthesizer.class)
    public SpecSynthesizer specSynthesizer(CategoryTable categoryTable) {
        return new SpecBuilder(categoryTable);
    }

    @Bean
    public RequirementClassifier requirementClassifier() {
        return new RequirementClassifier();
    }
}
