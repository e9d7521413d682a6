package com.tmdledit.models;

public class ColumnSummary {
    private String tableName;
    private String name;
    private String dataType;
    private String summarizeBy;
    private String formatString;
    private String sourceColumn;
    private boolean hidden;
    private boolean calculated;
    private String expression;
    private String lineageTag;
    private String description;

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDataType() {
        return dataType;
    }

    public void setDataType(String dataType) {
        this.dataType = dataType;
    }

    public String getSummarizeBy() {
        return summarizeBy;
    }

    public void setSummarizeBy(String summarizeBy) {
        this.summarizeBy = summarizeBy;
    }

    public String getFormatString() {
        return formatString;
    }

    public void setFormatString(String formatString) {
        this.formatString = formatString;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public void setSourceColumn(String sourceColumn) {
        this.sourceColumn = sourceColumn;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public boolean isCalculated() {
        return calculated;
    }

    public void setCalculated(boolean calculated) {
        this.calculated = calculated;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
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
