package com.tmdledit.models;

import java.util.List;
import java.util.Map;

/**
 * Relationships of a model with active/inactive counts and a count per cardinality.
 */
public class RelationshipListing {
    private int total;
    private int active;
    private int inactive;
    private Map<String, Integer> cardinalitySummary;
    private List<RelationshipSummary> relationships;

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getActive() {
        return active;
    }

    public void setActive(int active) {
        this.active = active;
    }

    public int getInactive() {
        return inactive;
    }

    public void setInactive(int inactive) {
        this.inactive = inactive;
    }

    public Map<String, Integer> getCardinalitySummary() {
        return cardinalitySummary;
    }

    public void setCardinalitySummary(Map<String, Integer> cardinalitySummary) {
        this.cardinalitySummary = cardinalitySummary;
    }

    public List<RelationshipSummary> getRelationships() {
        return relationships;
    }

    public void setRelationships(List<RelationshipSummary> relationships) {
        this.relationships = relationships;
    }
}
