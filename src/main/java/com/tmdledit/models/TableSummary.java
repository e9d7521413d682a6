package com.tmdledit.models;

public class TableSummary {
    private String name;
    private String file;
    private int columnCount;
    private int measureCount;
    private int partitionCount;
    private int hierarchyCount;
    private boolean hidden;
    private boolean privateTable;
    private String lineageTag;
    private String description;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(int columnCount) {
        this.columnCount = columnCount;
    }

    public int getMeasureCount() {
        return measureCount;
    }

    public void setMeasureCount(int measureCount) {
        this.measureCount = measureCount;
    }

    public int getPartitionCount() {
        return partitionCount;
    }

    public void setPartitionCount(int partitionCount) {
        this.partitionCount = partitionCount;
    }

    public int getHierarchyCount() {
        return hierarchyCount;
    }

    public void setHierarchyCount(int hierarchyCount) {
        this.hierarchyCount = hierarchyCount;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public boolean isPrivate() {
        return privateTable;
    }

    public void setPrivate(boolean privateTable) {
        this.privateTable = privateTable;
    }

    public String getLineageTag() {
        return lineageTag;
    }

    public void setLineageTag(String lineageTag) {
        this.lineageTag = lineageTag;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
