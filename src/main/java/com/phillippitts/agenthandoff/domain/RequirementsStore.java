package com.phillippitts.agenthandoff.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulation of user-supplied requirements for one conversation context.
 *
 * <p><b>Thread Safety:</b> not thread-safe on its own. Every instance is owned by exactly one
 * {@code HandoffOrchestrator}, which only touches it while holding its context lock.
 *
 * <p>Lists are append-only; scalar fields are overwritten by later values. The store is
 * snapshotted, never cleared, when requirements are finalized so a later re-synthesis can
 * build on the same history.
 */
public final class RequirementsStore {

    private String businessName;
    private String businessType;
    private String targetAudience;
    private final List<String> mainFunctions = new ArrayList<>();
    private String tone;
    private final List<String> specialRequirements = new ArrayList<>();
    private final Map<String, String> contactInfo = new LinkedHashMap<>();

    public void setBusinessName(String businessName) {
        this.businessName = businessName;
    }

    public void setBusinessType(String businessType) {
        this.businessType = businessType;
    }

    public void setTargetAudience(String targetAudience) {
        this.targetAudience = targetAudience;
    }

    public void setTone(String tone) {
        this.tone = tone;
    }

    public void addFunction(String function) {
        mainFunctions.add(function);
    }

    public void addSpecialRequirement(String requirement) {
        specialRequirements.add(requirement);
    }

    public void putContact(String kind, String value) {
        contactInfo.put(kind, value);
    }

    /**
     * Replaces the whole content with a previously saved snapshot.
     */
    public void restore(RequirementsSnapshot snapshot) {
        businessName = snapshot.businessName();
        businessType = snapshot.businessType();
        targetAudience = snapshot.targetAudience();
        tone = snapshot.tone();
        mainFunctions.clear();
        mainFunctions.addAll(snapshot.mainFunctions());
        specialRequirements.clear();
        specialRequirements.addAll(snapshot.specialRequirements());
        contactInfo.clear();
        contactInfo.putAll(snapshot.contactInfo());
    }

    public RequirementsSnapshot snapshot() {
        return new RequirementsSnapshot(businessName, businessType, targetAudience,
                mainFunctions, tone, specialRequirements, contactInfo);
    }
}
