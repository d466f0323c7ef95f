package com.phillippitts.agenthandoff.service.requirements;

/**
 * Bucket a spoken requirement key is classified into.
 */
public enum RequirementField {
    BUSINESS_NAME,
    BUSINESS_TYPE,
    /** A cuisine implies a restaurant business type. */
    CUISINE,
    FUNCTIONS,
    TONE,
    TARGET_AUDIENCE,
    OPERATING_HOURS,
    CONTACT,
    SPECIAL_REQUIREMENT,
    /** Unrecognized key; stored as a "key: value" special requirement. */
    OTHER
}
