package com.tmdledit.models;

public class RelationshipSummary {
    private String name;
    private String fromTable;
    private String fromColumn;
    private String toTable;
    private String toColumn;
    private String cardinality;
    private String crossFilteringBehavior;
    private boolean active;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFromTable() {
        return fromTable;
    }

    public void setFromTable(String fromTable) {
        this.fromTable = fromTable;
    }

    public String getFromColumn() {
        return fromColumn;
    }

    public void setFromColumn(String fromColumn) {
        this.fromColumn = fromColumn;
    }

    public String getToTable() {
        return toTable;
    }

    public void setToTable(String toTable) {
        this.toTable = toTable;
    }

    public String getToColumn() {
        return toColumn;
    }

    public void setToColumn(String toColumn) {
        this.toColumn = toColumn;
    }

    public String getCardinality() {
        return cardinality;
    }

    public void setCardinality(String cardinality) {
        this.cardinality = cardinality;
    }

    public String getCrossFilteringBehavior() {
        return crossFilteringBehavior;
    }

    public void setCrossFilteringBehavior(String crossFilteringBehavior) {
        this.crossFilteringBehavior = crossFilteringBehavior;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
