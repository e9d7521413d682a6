package com.tmdledit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdledit.errors.DuplicateNameException;
import com.tmdledit.errors.EntityNotFoundException;
import com.tmdledit.models.ColumnSummary;
import com.tmdledit.models.EditResult;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntityPath;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.MeasureSummary;
import com.tmdledit.models.ModelDetails;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.RelationshipListing;
import com.tmdledit.models.TableSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelOperationsTest {

    @TempDir
    Path tempDir;

    private final TmdlEditor editor = new TmdlEditor();
    private SemanticModelWorkspace workspace;
    private ModelOperations operations;

    @BeforeEach
    void setUp() throws Exception {
        workspace = SemanticModelWorkspace.open(Fixtures.writeProject(tempDir), editor);
        operations = new ModelOperations(workspace, editor, new ObjectMapper(), false);
    }

    @Test
    void listsTablesWithCounts() throws Exception {
        List<TableSummary> tables = operations.listTables();

        assertEquals(4, tables.size());
        TableSummary date = tables.get(0);
        assertEquals("Date", date.getName());
        assertEquals("definition/tables/Date.tmdl", date.getFile());
        assertEquals(5, date.getColumnCount());
        assertEquals(1, date.getHierarchyCount());
        assertEquals(1, date.getPartitionCount());

        TableSummary fact = tables.get(1);
        assertEquals("Order lines, one row per product sold", fact.getDescription());
        assertEquals(0, fact.getMeasureCount());
        assertEquals(3, tables.get(2).getMeasureCount());
    }

    @Test
    void listsMeasuresAcrossModelOrForOneTable() throws Exception {
        List<MeasureSummary> all = operations.listMeasures(null);
        assertEquals(3, all.size());
        assertEquals("Sales", all.get(0).getTableName());
        assertEquals("Sum of the sales amount", all.get(0).getDescription());

        assertTrue(operations.listMeasures("Fact").isEmpty());
        assertThrows(EntityNotFoundException.class, () -> operations.listMeasures("Nope"));
    }

    @Test
    void listsColumns() throws Exception {
        List<ColumnSummary> columns = operations.listColumns("Fact");

        assertEquals(5, columns.size());
        ColumnSummary margin = columns.get(4);
        assertEquals("Margin", margin.getName());
        assertTrue(margin.isCalculated());
        assertEquals("double", margin.getDataType());
        assertEquals("sum", margin.getSummarizeBy());
        assertTrue(columns.get(2).isHidden());
        assertEquals("Order Date", columns.get(3).getSourceColumn());
    }

    @Test
    void summarizesRelationships() throws Exception {
        RelationshipListing listing = operations.listRelationships();

        assertEquals(3, listing.getTotal());
        assertEquals(2, listing.getActive());
        assertEquals(1, listing.getInactive());
        assertEquals(Integer.valueOf(2), listing.getCardinalitySummary().get("many-to-one"));
        assertEquals(Integer.valueOf(1), listing.getCardinalitySummary().get("one-to-many"));
        assertEquals("Order Date", listing.getRelationships().get(0).getFromColumn());
        assertEquals("bothDirections", listing.getRelationships().get(1).getCrossFilteringBehavior());
    }

    @Test
    void showsEntityTree() throws Exception {
        ObjectNode hierarchy = operations.show(EntityPath.parse("Date/hierarchy:'Date Hierarchy'"));

        assertEquals("hierarchy", hierarchy.get("kind").asText());
        assertEquals("Date Hierarchy", hierarchy.get("name").asText());
        assertEquals(4, hierarchy.get("children").size());
        assertEquals("Year", hierarchy.get("children").get(0).get("properties").get("column").asText());

        ObjectNode quantity = operations.show(EntityPath.parse("Fact/column:Quantity"));
        assertTrue(quantity.get("properties").get("isHidden").asBoolean());
    }

    @Test
    void addWritesTableFile() throws Exception {
        EditResult result = operations.add(EntityPath.table("Fact"),
            EntitySpec.measure("Total Revenue", "SUM(Fact[Revenue])"));

        assertEquals("added", result.getAction());
        assertEquals("Fact/measure:'Total Revenue'", result.getPath());
        assertEquals("definition/tables/Fact.tmdl", result.getFile());
        assertEquals(List.of("name", "expression"), result.getUpdatedFields());
        assertNotNull(result.getLineageTag());
        assertTrue(result.isWritten());
        assertTrue(Files.readString(workspace.getTablesDir().resolve("Fact.tmdl"))
            .contains("\tmeasure 'Total Revenue' = SUM(Fact[Revenue])\n"));
    }

    @Test
    void measureNamesAreUniqueAcrossTables() throws Exception {
        assertThrows(DuplicateNameException.class,
            () -> operations.add(EntityPath.table("Fact"), EntitySpec.measure("Total Sales", "1")));
        assertThrows(DuplicateNameException.class,
            () -> operations.update(EntityPath.parse("Sales/measure:'Big Orders'"),
                new PropertyChanges().name("total sales")));
        assertEquals(Fixtures.read("Fact.tmdl"), Files.readString(workspace.getTablesDir().resolve("Fact.tmdl")));
    }

    @Test
    void renameToSameNameWithOtherCaseIsAllowed() throws Exception {
        EditResult result = operations.update(EntityPath.parse("Sales/measure:'Big Orders'"),
            new PropertyChanges().name("Big orders"));
        assertTrue(result.isWritten());
        assertEquals(1, operations.listMeasures("Sales").stream()
            .filter(m -> "Big orders".equals(m.getName())).count());
    }

    @Test
    void dryRunReportsDiffWithoutWriting() throws Exception {
        ModelOperations dryRun = new ModelOperations(workspace, editor, new ObjectMapper(), true);
        EditResult result = dryRun.update(EntityPath.parse("Fact/column:Revenue"),
            new PropertyChanges().formatString("#,0"));

        assertTrue(result.isDryRun());
        assertFalse(result.isWritten());
        assertTrue(result.getDiff().contains("+\t\tformatString: #,0"));
        assertEquals(Fixtures.read("Fact.tmdl"), Files.readString(workspace.getTablesDir().resolve("Fact.tmdl")));
    }

    @Test
    void deleteRoutesRelationshipsToTheirFile() throws Exception {
        EditResult result = operations.delete(EntityPath.parse("relationship:6c8a1b2e-0000-4000-8000-000000000003"));

        assertEquals("definition/relationships.tmdl", result.getFile());
        assertEquals(2, operations.listRelationships().getTotal());
    }

    @Test
    void deleteNestedEntity() throws Exception {
        operations.delete(EntityPath.parse("Date/hierarchy:'Date Hierarchy'/level:Month"));

        ObjectNode hierarchy = operations.show(EntityPath.table("Date").child(EntityKind.HIERARCHY, "Date Hierarchy"));
        assertEquals(3, hierarchy.get("children").size());
    }

    @Test
    void unknownTableIsReported() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
            () -> operations.delete(EntityPath.parse("Nope/measure:X")));
        assertEquals("No table 'Nope' in the model", e.getMessage());
    }

    @Test
    void modelDetailsSummarizesTheWholeModel() throws Exception {
        ModelDetails details = operations.modelDetails();

        assertEquals("Model", details.getModelName());
        assertEquals("en-US", details.getCulture());
        assertEquals(4, details.getTableTotals().getTotal());
        assertEquals(0, details.getTableTotals().getHidden());

        ModelDetails.ColumnTotals columns = details.getColumnTotals();
        assertEquals(13, columns.getTotal());
        assertEquals(5, columns.getCalculated());
        assertEquals(8, columns.getRegular());
        assertEquals(3, columns.getHidden());
        assertEquals(Integer.valueOf(5), columns.getByDataType().get("int64"));
        assertEquals(Integer.valueOf(2), columns.getByDataType().get("dateTime"));
        assertEquals(Integer.valueOf(3), columns.getByDataType().get("string"));

        assertEquals(3, details.getMeasureTotals().getTotal());
        assertEquals(2, details.getMeasureTotals().getWithFormatString());
        assertEquals(3, details.getRelationships().getTotal());
        assertEquals(2, details.getRelationships().getActive());
        assertEquals(4, details.getTables().size());
        assertEquals(13, details.getColumns().size());
        assertEquals("Sales", details.getMeasures().get(0).getTableName());
    }

    @Test
    void modelDetailsReadsQuotedNameCultureAndPrivateTables() throws Exception {
        Files.writeString(workspace.getModelFile(), "model 'Sales Model'\n\tculture: nb-NO\n\tsourceQueryCulture: en-US\n\n"
            + "ref table Fact\n");
        Files.writeString(workspace.getTablesDir().resolve("Helper.tmdl"), "table Helper\n\tisHidden\n\tisPrivate\n");

        ModelDetails details = operations.modelDetails();

        assertEquals("Sales Model", details.getModelName());
        assertEquals("nb-NO", details.getCulture());
        assertEquals(5, details.getTableTotals().getTotal());
        assertEquals(1, details.getTableTotals().getHidden());
        assertEquals(1, details.getTableTotals().getPrivate());
        assertEquals("Fact", details.getTables().get(0).getName());
        TableSummary helper = details.getTables().stream()
            .filter(t -> "Helper".equals(t.getName()))
            .findFirst()
            .orElseThrow();
        assertTrue(helper.isPrivate());
        assertTrue(helper.isHidden());
    }

    @Test
    void modelDetailsWithoutModelFileFallsBackToDefaults() throws Exception {
        Files.delete(workspace.getModelFile());

        ModelDetails details = operations.modelDetails();

        assertNull(details.getModelName());
        assertEquals("en-US", details.getCulture());
        assertEquals(4, details.getTableTotals().getTotal());
    }
}
