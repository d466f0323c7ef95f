package com.phillippitts.agenthandoff.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable point-in-time copy of a {@link RequirementsStore}.
 *
 * <p>Snapshots are what leave the owning orchestrator: they are handed to synthesis and to
 * persistence, so later mutations of the store never leak into an in-flight synthesis.
 */
public record RequirementsSnapshot(
        String businessName,
        String businessType,
        String targetAudience,
        List<String> mainFunctions,
        String tone,
        List<String> specialRequirements,
        Map<String, String> contactInfo
) {

    /** Minimum trimmed length of a required field. */
    public static final int MIN_REQUIRED_LENGTH = 2;

    /** Hesitations that must never be stored or accepted as a required value. */
    public static final Set<String> FILLER_VALUES = Set.of("um", "uh", "i don't know", "not sure");

    public RequirementsSnapshot {
        mainFunctions = mainFunctions == null ? List.of() : List.copyOf(mainFunctions);
        specialRequirements = specialRequirements == null ? List.of() : List.copyOf(specialRequirements);
        contactInfo = contactInfo == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contactInfo));
    }

    public static RequirementsSnapshot empty() {
        return new RequirementsSnapshot(null, null, null, List.of(), null, List.of(), Map.of());
    }

    /**
     * Required fields that are absent, shorter than {@link #MIN_REQUIRED_LENGTH} once trimmed,
     * or a filler word.
     *
     * @return human-readable names, empty when the snapshot can be confirmed
     */
    public List<String> missingRequired() {
        List<String> missing = new ArrayList<>(2);
        if (!isMeaningful(businessName)) {
            missing.add("business name");
        }
        if (!isMeaningful(businessType)) {
            missing.add("business type");
        }
        return missing;
    }

    /**
     * Optional fields worth asking for before confirmation.
     */
    public List<String> missingRecommended() {
        List<String> missing = new ArrayList<>(3);
        if (mainFunctions.isEmpty()) {
            missing.add("main functions");
        }
        if (tone == null || tone.isBlank()) {
            missing.add("preferred tone");
        }
        if (targetAudience == null || targetAudience.isBlank()) {
            missing.add("target audience");
        }
        return missing;
    }

    public boolean isValidForProcessing() {
        return missingRequired().isEmpty();
    }

    /**
     * Multi-line summary read back to the user before confirmation.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Business: ").append(businessName).append('\n');
        sb.append("Type: ").append(businessType).append('\n');
        if (!mainFunctions.isEmpty()) {
            sb.append("Functions: ").append(String.join(", ", mainFunctions)).append('\n');
        }
        if (tone != null) {
            sb.append("Tone: ").append(tone).append('\n');
        }
        if (targetAudience != null) {
            sb.append("Target Audience: ").append(targetAudience).append('\n');
        }
        if (!specialRequirements.isEmpty()) {
            sb.append("Special Requirements: ").append(String.join(", ", specialRequirements)).append('\n');
        }
        return sb.toString();
    }

    /**
     * True when the value is long enough and not a hesitation such as "um" or "not sure".
     */
    public static boolean isMeaningful(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return trimmed.length() >= MIN_REQUIRED_LENGTH
                && !FILLER_VALUES.contains(trimmed.toLowerCase(Locale.ROOT));
    }
}
