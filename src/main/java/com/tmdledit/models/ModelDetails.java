package com.tmdledit.models;

import java.util.List;
import java.util.Map;

/**
 * Whole-model overview: the {@code model} declaration, totals across all tables, the
 * relationship listing and the per-table, per-column and per-measure summaries.
 */
public class ModelDetails {
    private String modelName;
    private String culture;
    private TableTotals tableTotals;
    private ColumnTotals columnTotals;
    private MeasureTotals measureTotals;
    private RelationshipListing relationships;
    private List<TableSummary> tables;
    private List<ColumnSummary> columns;
    private List<MeasureSummary> measures;

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getCulture() {
        return culture;
    }

    public void setCulture(String culture) {
        this.culture = culture;
    }

    public TableTotals getTableTotals() {
        return tableTotals;
    }

    public void setTableTotals(TableTotals tableTotals) {
        this.tableTotals = tableTotals;
    }

    public ColumnTotals getColumnTotals() {
        return columnTotals;
    }

    public void setColumnTotals(ColumnTotals columnTotals) {
        this.columnTotals = columnTotals;
    }

    public MeasureTotals getMeasureTotals() {
        return measureTotals;
    }

    public void setMeasureTotals(MeasureTotals measureTotals) {
        this.measureTotals = measureTotals;
    }

    public RelationshipListing getRelationships() {
        return relationships;
    }

    public void setRelationships(RelationshipListing relationships) {
        this.relationships = relationships;
    }

    public List<TableSummary> getTables() {
        return tables;
    }

    public void setTables(List<TableSummary> tables) {
        this.tables = tables;
    }

    public List<ColumnSummary> getColumns() {
        return columns;
    }

    public void setColumns(List<ColumnSummary> columns) {
        this.columns = columns;
    }

    public List<MeasureSummary> getMeasures() {
        return measures;
    }

    public void setMeasures(List<MeasureSummary> measures) {
        this.measures = measures;
    }

    public static class TableTotals {
        private int total;
        private int hidden;
        private int privateCount;

        public int getTotal() {
            return total;
        }

        public void setTotal(int total) {
            this.total = total;
        }

        public int getHidden() {
            return hidden;
        }

        public void setHidden(int hidden) {
            this.hidden = hidden;
        }

        public int getPrivate() {
            return privateCount;
        }

        public void setPrivate(int privateCount) {
            this.privateCount = privateCount;
        }
    }

    public static class ColumnTotals {
        private int total;
        private int calculated;
        private int regular;
        private int hidden;
        private Map<String, Integer> byDataType;

        public int getTotal() {
            return total;
        }

        public void setTotal(int total) {
            this.total = total;
        }

        public int getCalculated() {
            return calculated;
        }

        public void setCalculated(int calculated) {
            this.calculated = calculated;
        }

        public int getRegular() {
            return regular;
        }

        public void setRegular(int regular) {
            this.regular = regular;
        }

        public int getHidden() {
            return hidden;
        }

        public void setHidden(int hidden) {
            this.hidden = hidden;
        }

        /** Column count per TMDL data type; columns without one count as {@code unknown}. */
        public Map<String, Integer> getByDataType() {
            return byDataType;
        }

        public void setByDataType(Map<String, Integer> byDataType) {
            this.byDataType = byDataType;
        }
    }

    public static class MeasureTotals {
        private int total;
        private int hidden;
        private int withFormatString;

        public int getTotal() {
            return total;
        }

        public void setTotal(int total) {
            this.total = total;
        }

        public int getHidden() {
            return hidden;
        }

        public void setHidden(int hidden) {
            this.hidden = hidden;
        }

        public int getWithFormatString() {
            return withFormatString;
        }

        public void setWithFormatString(int withFormatString) {
            this.withFormatString = withFormatString;
        }
    }
}
