package edu.uw.easyqg.annotation;

import com.google.common.collect.ImmutableMap;

/**
 * Named-entity classes. GPE covers geo-political entities: cities, countries and states.
 */
public enum EntityType {
    PERSON, GPE, LOC, ORG, DATE, OTHER, NONE;

    private static final ImmutableMap<String, EntityType> typesByLabel = ImmutableMap.<String, EntityType>builder()
            .put("PERSON", PERSON)
            .put("GPE", GPE)
            .put("CITY", GPE)
            .put("COUNTRY", GPE)
            .put("STATE_OR_PROVINCE", GPE)
            .put("LOC", LOC)
            .put("LOCATION", LOC)
            .put("ORG", ORG)
            .put("ORGANIZATION", ORG)
            .put("DATE", DATE)
            .build();

    public static EntityType fromLabel(String label) {
        if (label == null || label.isEmpty() || label.equals("O")) {
            return NONE;
        }
        return typesByLabel.getOrDefault(label.toUpperCase(), OTHER);
    }
}
