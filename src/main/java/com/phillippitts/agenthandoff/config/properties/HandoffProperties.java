package com.phillippitts.agenthandoff.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the handoff protocol, synthesis ceiling and engagement loop.
 *
 * <p>Every value falls back to its production default when the property is absent, so a bare
 * {@code application.properties} yields the timings the live personas were tuned for.
 */
@Validated
@ConfigurationProperties(prefix = "handoff")
public class HandoffProperties {

    public static final Duration DEFAULT_SYNTHESIS_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_ENGAGEMENT_INTERVAL = Duration.ofSeconds(3);
    public static final int DEFAULT_MAX_FILLER_UTTERANCES = 2;
    public static final Duration DEFAULT_FAREWELL_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(3);
    public static final Duration DEFAULT_TEARDOWN_GRACE = Duration.ofSeconds(10);
    public static final String DEFAULT_CATALOG_LOCATION = "classpath:catalog/categories.json";

    @NotNull
    private final Duration synthesisTimeout;

    @NotNull
    private final Duration engagementInterval;

    @Min(0)
    private final int maxFillerUtterances;

    @NotNull
    private final Duration farewellDelay;

    @NotNull
    private final Duration settleDelay;

    @NotNull
    private final Duration teardownGrace;

    @NotBlank
    private final String catalogLocation;

    @Valid
    @NotNull
    private final Creator creator;

    @ConstructorBinding
    public HandoffProperties(Duration synthesisTimeout,
                             Duration engagementInterval,
                             Integer maxFillerUtterances,
                             Duration farewellDelay,
                             Duration settleDelay,
                             Duration teardownGrace,
                             String catalogLocation,
                             Creator creator) {
        this.synthesisTimeout = positiveOrDefault(synthesisTimeout, DEFAULT_SYNTHESIS_TIMEOUT);
        this.engagementInterval = positiveOrDefault(engagementInterval, DEFAULT_ENGAGEMENT_INTERVAL);
        this.maxFillerUtterances = maxFillerUtterances == null ? DEFAULT_MAX_FILLER_UTTERANCES : maxFillerUtterances;
        this.farewellDelay = nonNegativeOrDefault(farewellDelay, DEFAULT_FAREWELL_DELAY);
        this.settleDelay = nonNegativeOrDefault(settleDelay, DEFAULT_SETTLE_DELAY);
        this.teardownGrace = nonNegativeOrDefault(teardownGrace, DEFAULT_TEARDOWN_GRACE);
        this.catalogLocation = catalogLocation == null || catalogLocation.isBlank()
                ? DEFAULT_CATALOG_LOCATION : catalogLocation;
        this.creator = creator == null ? Creator.defaults() : creator;
    }

    /**
     * Production defaults, for tests and manual wiring.
     */
    public static HandoffProperties defaults() {
        return new HandoffProperties(null, null, null, null, null, null, null, null);
    }

    public Duration getSynthesisTimeout() {
        return synthesisTimeout;
    }

    public Duration getEngagementInterval() {
        return engagementInterval;
    }

    public int getMaxFillerUtterances() {
        return maxFillerUtterances;
    }

    public Duration getFarewellDelay() {
        return farewellDelay;
    }

    public Duration getSettleDelay() {
        return settleDelay;
    }

    public Duration getTeardownGrace() {
        return teardownGrace;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public Creator getCreator() {
        return creator;
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    private static Duration nonNegativeOrDefault(Duration value, Duration fallback) {
        return value == null || value.isNegative() ? fallback : value;
    }

    /**
     * The static requirements-gathering persona.
     *
     * @param name         persona name used in introductions
     * @param voice        voice identifier
     * @param instructions persona prompt
     */
    public record Creator(@NotBlank String name, @NotBlank String voice, @NotBlank String instructions) {

        public static final String DEFAULT_NAME = "Voxie";
        public static final String DEFAULT_VOICE = "marin";
        public static final String DEFAULT_INSTRUCTIONS = """
                You are Voxie, a friendly assistant that helps business owners design a custom voice agent.
                Gather the business name and business type first; they are required.
                Then ask about the main functions the agent should handle, the preferred tone and the target audience.
                Store every answer with store_user_requirement as soon as you hear it.
                Read back a summary and wait for an explicit yes before calling confirm_requirements and then finalize_requirements.
                While the agent is being created the requirements are locked: chat naturally and explain that changes
                can be made after the demo.
                When the demo agent is ready, offer to connect the user with start_demo.
                Speak warmly and concisely, and never mention other voice platforms by name.
                """;

        public Creator {
            name = name == null || name.isBlank() ? DEFAULT_NAME : name;
            voice = voice == null || voice.isBlank() ? DEFAULT_VOICE : voice;
            instructions = instructions == null || instructions.isBlank() ? DEFAULT_INSTRUCTIONS : instructions;
        }

        public static Creator defaults() {
            return new Creator(null, null, null);
        }
    }
}
