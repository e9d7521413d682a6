package com.tmdledit.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdledit.errors.UnsupportedPropertyException;
import com.tmdledit.models.DataType;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.PropertyKey;
import com.tmdledit.models.SummarizeBy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PayloadParserTest {

    private final PayloadParser parser = new PayloadParser(new ObjectMapper());

    @Test
    void parseValidMeasureSpec() throws Exception {
        String json = "{\"name\":\"Total Revenue\",\"expression\":\"SUM(Fact[Revenue])\",\"format_string\":\"#,0\",\"is_hidden\":false}";
        EntitySpec spec = parser.parseEntitySpec(EntityKind.MEASURE, json);
        assertEquals(EntityKind.MEASURE, spec.getKind());
        assertEquals("Total Revenue", spec.getName());
        assertEquals("SUM(Fact[Revenue])", spec.getProperties().getString(PropertyKey.EXPRESSION));
        assertEquals("#,0", spec.getProperties().get(PropertyKey.FORMAT_STRING));
        assertEquals(Boolean.FALSE, spec.getProperties().get(PropertyKey.IS_HIDDEN));
    }

    @Test
    void acceptsAliasesAndCamelCase() throws Exception {
        String json = "{\"column_name\":\"Region\",\"dataType\":\"String\",\"summarizeBy\":\"none\",\"hidden\":true}";
        EntitySpec spec = parser.parseEntitySpec(EntityKind.COLUMN, json);
        assertEquals("Region", spec.getName());
        assertEquals(DataType.STRING, spec.getProperties().get(PropertyKey.DATA_TYPE));
        assertEquals(SummarizeBy.NONE, spec.getProperties().get(PropertyKey.SUMMARIZE_BY));
        assertEquals(Boolean.TRUE, spec.getProperties().get(PropertyKey.IS_HIDDEN));
    }

    @Test
    void acceptsMixedCaseEnumValues() throws Exception {
        EntitySpec spec = parser.parseEntitySpec(EntityKind.COLUMN, "{\"name\":\"When\",\"data_type\":\"dateTime\"}");
        assertEquals(DataType.DATE_TIME, spec.getProperties().get(PropertyKey.DATA_TYPE));
    }

    @Test
    void rejectsUnknownProperty() {
        String json = "{\"name\":\"X\",\"expression\":\"1\",\"color\":\"red\"}";
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.MEASURE, json));
        assertEquals("unknown-arg:color", e.getDetail());
    }

    @Test
    void rejectsMissingRequired() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.MEASURE, "{\"name\":\"X\"}"));
        assertEquals("missing-required:expression", e.getDetail());
    }

    @Test
    void rejectsWrongTypes() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.MEASURE, "{\"name\":\"X\",\"expression\":\"1\",\"is_hidden\":\"yes\"}"));
        assertEquals("invalid-type:is_hidden", e.getDetail());
    }

    @Test
    void rejectsValuesOutsideEnumeration() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("{\"summarize_by\":\"median\"}"));
        assertEquals("invalid-enum:summarize_by", e.getDetail());
    }

    @Test
    void rejectsInvalidJson() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("{\"name\":"));
        assertEquals(PayloadParser.ERR_INVALID_FORMAT, e.getDetail());
    }

    @Test
    void rejectsNonObjectPayload() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("[1, 2]"));
        assertEquals(PayloadParser.ERR_INVALID_FORMAT, e.getDetail());
    }

    @Test
    void rejectsKindsWithoutPayloadShape() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.HIERARCHY, "{\"name\":\"H\"}"));
        assertEquals("not-applicable:kind", e.getDetail());
    }

    @Test
    void nullClearsAndNewNameRenames() throws Exception {
        PropertyChanges changes = parser.parsePropertyChanges("{\"new_name\":\"Gross\",\"format_string\":null}");
        assertEquals("Gross", changes.get(PropertyKey.NAME));
        assertTrue(changes.contains(PropertyKey.FORMAT_STRING));
        assertNull(changes.get(PropertyKey.FORMAT_STRING));
    }

    @Test
    void rejectsEmptyChanges() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("{}"));
        assertEquals("missing-required:changes", e.getDetail());
    }

    @Test
    void stripsInvisibleEdgeCharacters() throws Exception {
        PropertyChanges changes = parser.parsePropertyChanges("\uFEFF{\"description\":\"Net of returns\"}\u200B");
        assertEquals("Net of returns", changes.get(PropertyKey.DESCRIPTION));
    }

    @Test
    void dashedAndSpacedKeysNormalize() throws Exception {
        PropertyChanges changes = parser.parsePropertyChanges("{\"Format-String\":\"0.0\",\" is hidden \":true}");
        assertEquals("0.0", changes.get(PropertyKey.FORMAT_STRING));
        assertEquals(Boolean.TRUE, changes.get(PropertyKey.IS_HIDDEN));
    }

    @Test
    void rejectsLineBreaksInSingleLineValues() {
        UnsupportedPropertyException format = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("{\"format_string\":\"0\\nmeasure X = 2\"}"));
        assertEquals("invalid-value:format_string", format.getDetail());

        UnsupportedPropertyException name = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.MEASURE, "{\"name\":\"A\\r\\nB\",\"expression\":\"1\"}"));
        assertEquals("invalid-value:name", name.getDetail());
    }

    @Test
    void multiLineExpressionAndDescriptionAreAccepted() throws Exception {
        PropertyChanges changes = parser.parsePropertyChanges(
            "{\"expression\":\"VAR x = 1\\nRETURN x\",\"description\":\"one\\ntwo\"}");
        assertEquals("VAR x = 1\nRETURN x", changes.get(PropertyKey.EXPRESSION));
        assertEquals("one\ntwo", changes.get(PropertyKey.DESCRIPTION));
    }

    @Test
    void enumValuesAreCheckedAgainstTheModelTypes() {
        UnsupportedPropertyException e = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parseEntitySpec(EntityKind.COLUMN, "{\"name\":\"C\",\"data_type\":\"varchar\"}"));
        assertEquals("invalid-enum:data_type", e.getDetail());

        UnsupportedPropertyException wrongType = assertThrows(UnsupportedPropertyException.class,
            () -> parser.parsePropertyChanges("{\"data_type\":3}"));
        assertEquals("invalid-type:data_type", wrongType.getDetail());
    }
}
