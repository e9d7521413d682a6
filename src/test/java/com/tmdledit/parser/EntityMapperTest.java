package com.tmdledit.parser;

import com.tmdledit.Fixtures;
import com.tmdledit.errors.UnknownEntityKeywordException;
import com.tmdledit.models.Cardinality;
import com.tmdledit.models.CrossFilteringBehavior;
import com.tmdledit.models.DataType;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.OpaqueBlock;
import com.tmdledit.models.PartitionMode;
import com.tmdledit.models.SummarizeBy;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;
import com.tmdledit.models.Trivia;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityMapperTest {

    private final TmdlParser parser = new TmdlParser();

    @Test
    void mapsTableWithColumnsAndPartition() throws Exception {
        TmdlDocument document = parser.parse(Fixtures.read("Fact.tmdl"));
        TmdlEntity fact = document.getTable("Fact");

        assertNotNull(fact);
        assertEquals("Order lines, one row per product sold", fact.getDescription());
        assertEquals("3f2e7c1a-1d4b-4e8a-9b61-0c5d2a7e9f10", fact.getLineageTag());

        List<TmdlEntity> columns = fact.getChildren(EntityKind.COLUMN);
        assertEquals(5, columns.size());
        assertEquals("Order Date", columns.get(3).getName());
        assertEquals("'Order Date'", columns.get(3).getRawName());

        TmdlEntity quantity = fact.findChild(EntityKind.COLUMN, "Quantity");
        assertTrue(quantity.isHidden());
        assertEquals(DataType.INT64, quantity.getDataType());
        assertEquals(SummarizeBy.SUM, quantity.getSummarizeBy());
        assertEquals(TmdlProperty.Style.EQUALS, quantity.findProperty("changedProperty").getStyle());

        TmdlEntity margin = fact.findChild(EntityKind.COLUMN, "Margin");
        assertTrue(margin.isCalculated());
        assertEquals("[Revenue] * 0.3", margin.getExpression());
        assertFalse(fact.findChild(EntityKind.COLUMN, "Revenue").isCalculated());

        TmdlEntity partition = fact.findChild(EntityKind.PARTITION, "Fact");
        assertEquals(PartitionMode.IMPORT, partition.getMode());
        assertEquals("m", partition.getExpression());
        assertEquals("let\n"
            + "    Source = Sql.Database(\"sql.contoso.local\", \"Sales\"),\n"
            + "    Fact = Source{[Schema=\"dbo\",Item=\"Fact\"]}[Data]\n"
            + "in\n"
            + "    Fact", partition.getSourceExpression());
    }

    @Test
    void keepsCommentsAsTriviaMembers() throws Exception {
        TmdlEntity fact = parser.parse(Fixtures.read("Fact.tmdl")).getTable("Fact");

        boolean found = false;
        for (TmdlElement member : fact.getMembers()) {
            if (member instanceof Trivia && ((Trivia) member).getType() == Trivia.Type.COMMENT) {
                assertEquals("// margin uses a flat rate until the cost table lands", ((Trivia) member).getText());
                found = true;
            }
        }
        assertTrue(found);
    }

    @Test
    void nestedEntitiesBelowColumns() throws Exception {
        TmdlEntity orderDate = parser.parse(Fixtures.read("Fact.tmdl")).getTable("Fact")
            .findChild(EntityKind.COLUMN, "Order Date");

        TmdlEntity variation = orderDate.findChild(EntityKind.VARIATION, "Variation");
        assertNotNull(variation);
        assertTrue(variation.findProperty("isDefault").isTrue());
        assertEquals("LocalDateTable_1.'Date Hierarchy'", variation.getPropertyValue("defaultHierarchy"));
        assertEquals("Date", orderDate.findChild(EntityKind.ANNOTATION, "UnderlyingDateTimeDataType").getExpression());
    }

    @Test
    void mapsHierarchyLevels() throws Exception {
        TmdlEntity date = parser.parse(Fixtures.read("Date.tmdl")).getTable("Date");

        TmdlEntity hierarchy = date.findChild(EntityKind.HIERARCHY, "Date Hierarchy");
        List<TmdlEntity> levels = hierarchy.getChildren(EntityKind.LEVEL);
        assertEquals(4, levels.size());
        assertEquals("Month", levels.get(2).getName());
        assertEquals("Month", levels.get(2).getPropertyValue("column"));
        assertEquals("Time", date.getDataCategory());
    }

    @Test
    void extractsMultiLineAndFencedExpressions() throws Exception {
        TmdlEntity sales = parser.parse(Fixtures.read("Sales.tmdl")).getTable("Sales");

        TmdlEntity total = sales.findChild(EntityKind.MEASURE, "Total Sales");
        assertEquals("SUM(Sales[Amount])", total.getExpression());
        assertEquals("Sum of the sales amount", total.getDescription());
        assertEquals("$#,0.00;($#,0.00);$#,0.00", total.getFormatString());

        TmdlEntity yoy = sales.findChild(EntityKind.MEASURE, "Sales YoY %");
        assertEquals("VAR current = [Total Sales]\n"
            + "VAR previous =\n"
            + "    CALCULATE([Total Sales], SAMEPERIODLASTYEAR('Date'[Date]))\n"
            + "\n"
            + "RETURN\n"
            + "    DIVIDE(current - previous, previous)", yoy.getExpression());
        assertEquals("Growth", yoy.getDisplayFolder());

        TmdlEntity big = sales.findChild(EntityKind.MEASURE, "Big Orders");
        assertEquals("CALCULATE(\n    COUNTROWS(Sales),\n    Sales[Amount] > 1000\n)", big.getExpression());
        assertEquals("5e000000-0003-4000-8000-000000000003", big.getLineageTag());
    }

    @Test
    void mapsCalculationGroup() throws Exception {
        TmdlEntity table = parser.parse(Fixtures.read("TimeIntelligence.tmdl")).getTable("Time Intelligence");

        List<TmdlEntity> groups = table.getChildren(EntityKind.CALCULATION_GROUP);
        assertEquals(1, groups.size());
        assertNull(groups.get(0).getName());

        TmdlEntity ytd = groups.get(0).findChild(EntityKind.CALCULATION_ITEM, "YTD");
        assertEquals("CALCULATE(\n\tSELECTEDMEASURE(),\n\tDATESYTD('Date'[Date])\n)", ytd.getExpression());
        assertEquals("SELECTEDMEASURE()",
            groups.get(0).findChild(EntityKind.CALCULATION_ITEM, "Current").getExpression());
    }

    @Test
    void mapsRelationships() throws Exception {
        List<TmdlEntity> relationships = parser.parse(Fixtures.read("relationships.tmdl")).getRelationships();

        assertEquals(3, relationships.size());
        TmdlEntity first = relationships.get(0);
        assertEquals("6c8a1b2e-0000-4000-8000-000000000001", first.getName());
        assertEquals("Fact", first.getFromColumn().getTable());
        assertEquals("Order Date", first.getFromColumn().getColumn());
        assertEquals(Cardinality.MANY_TO_ONE, first.getCardinality());
        assertTrue(first.isActive());
        assertEquals(CrossFilteringBehavior.ONE_DIRECTION, first.getCrossFilteringBehavior());

        TmdlEntity second = relationships.get(1);
        assertFalse(second.isActive());
        assertEquals(CrossFilteringBehavior.BOTH_DIRECTIONS, second.getCrossFilteringBehavior());

        assertEquals(Cardinality.ONE_TO_MANY, relationships.get(2).getCardinality());
        assertEquals("Time Intelligence", relationships.get(2).getFromColumn().getTable());
    }

    @Test
    void modelFileKeepsUnmodelledBlocksOpaque() throws Exception {
        TmdlDocument document = parser.parse(Fixtures.read("model.tmdl"));

        OpaqueBlock model = (OpaqueBlock) document.getElements().get(0);
        assertEquals("model", model.getKeyword());
        assertTrue(model.getRawText().contains("\t\treturnErrorValuesAsNull\n"));
        assertNotNull(document.findTopLevel(EntityKind.ANNOTATION, "PBI_QueryOrder"));

        long refs = document.getElements().stream()
            .filter(e -> e instanceof OpaqueBlock && "ref".equals(((OpaqueBlock) e).getKeyword()))
            .count();
        assertEquals(5, refs);
    }

    @Test
    void nestedPropertyBlockBecomesOpaque() throws Exception {
        TmdlEntity column = parser.parse("table T\n\tcolumn C\n\t\tdataType: string\n\t\textendedProperty X =\n"
            + "\t\t\t\t{ \"a\": 1 }\n\t\tcustomBlock\n\t\t\tinner: 1\n").getTable("T").findChild(EntityKind.COLUMN, "C");

        TmdlElement last = column.getMembers().get(column.getMembers().size() - 1);
        assertTrue(last instanceof OpaqueBlock);
        assertEquals("customBlock", ((OpaqueBlock) last).getKeyword());
        assertEquals("{ \"a\": 1 }", column.findProperty("extendedProperty X").getValue());
    }

    @Test
    void unknownTopLevelKeywordIsRejected() {
        UnknownEntityKeywordException e = assertThrows(UnknownEntityKeywordException.class,
            () -> parser.parse("table T\n\tcolumn C\nbanana B\n"));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void quotedNamesWithEscapedQuotes() throws Exception {
        TmdlEntity table = parser.parse("table 'Customer''s Orders'\n\tmeasure 'a = b' = 1\n")
            .getTable("Customer's Orders");

        assertNotNull(table);
        TmdlEntity measure = table.getChildren(EntityKind.MEASURE).get(0);
        assertEquals("a = b", measure.getName());
        assertEquals("1", measure.getExpression());
    }

    @Test
    void preservesCrLfAndSpaceIndent() throws Exception {
        TmdlDocument crlf = parser.parse("table T\r\n\tcolumn C\r\n");
        assertEquals("\r\n", crlf.getNewline());

        TmdlDocument spaces = parser.parse("table T\n  column C\n    dataType: int64\n");
        assertEquals(IndentUnit.spaces(2), spaces.getIndentUnit());
        assertEquals(DataType.INT64, spaces.getTable("T").findChild(EntityKind.COLUMN, "C").getDataType());
    }
}
