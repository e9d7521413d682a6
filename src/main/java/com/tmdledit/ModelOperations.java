package com.tmdledit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdledit.errors.DuplicateNameException;
import com.tmdledit.errors.EntityNotFoundException;
import com.tmdledit.errors.TmdlException;
import com.tmdledit.models.ColumnReference;
import com.tmdledit.models.ColumnSummary;
import com.tmdledit.models.EditResult;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntityPath;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.MeasureSummary;
import com.tmdledit.models.ModelDetails;
import com.tmdledit.models.OpaqueBlock;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.PropertyKey;
import com.tmdledit.models.RelationshipListing;
import com.tmdledit.models.RelationshipSummary;
import com.tmdledit.models.TableSummary;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;
import com.tmdledit.writer.IdentifierQuoting;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Model-level reads and edits on top of {@link SemanticModelWorkspace}: listings across all
 * table files, and add/update/delete routed to the file that owns the addressed entity.
 */
public class ModelOperations {

    private static final String DEFAULT_CULTURE = "en-US";

    private final SemanticModelWorkspace workspace;
    private final TmdlEditor editor;
    private final ObjectMapper objectMapper;
    private final boolean dryRun;

    public ModelOperations(SemanticModelWorkspace workspace, TmdlEditor editor, ObjectMapper objectMapper,
                           boolean dryRun) {
        this.workspace = workspace;
        this.editor = editor;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.dryRun = dryRun;
    }

    // -------------------------------------------------------------------------
    // Listings
    // -------------------------------------------------------------------------

    public List<TableSummary> listTables() throws IOException, TmdlException {
        List<TableSummary> result = new ArrayList<>();
        for (LoadedTable loaded : loadTables()) {
            result.add(summarize(loaded));
        }
        return result;
    }

    /**
     * @param tableName a table to restrict to, or null for every table
     */
    public List<MeasureSummary> listMeasures(String tableName) throws IOException, TmdlException {
        List<MeasureSummary> result = new ArrayList<>();
        for (LoadedTable loaded : loadTables(tableName)) {
            for (TmdlEntity measure : loaded.table.getChildren(EntityKind.MEASURE)) {
                result.add(summarizeMeasure(loaded.table, measure));
            }
        }
        return result;
    }

    public List<ColumnSummary> listColumns(String tableName) throws IOException, TmdlException {
        List<ColumnSummary> result = new ArrayList<>();
        for (LoadedTable loaded : loadTables(tableName)) {
            for (TmdlEntity column : loaded.table.getChildren(EntityKind.COLUMN)) {
                result.add(summarizeColumn(loaded.table, column));
            }
        }
        return result;
    }

    private TableSummary summarize(LoadedTable loaded) {
        TmdlEntity table = loaded.table;
        TableSummary summary = new TableSummary();
        summary.setName(table.getName());
        summary.setFile(workspace.toRelativePath(loaded.file));
        summary.setColumnCount(table.getChildren(EntityKind.COLUMN).size());
        summary.setMeasureCount(table.getChildren(EntityKind.MEASURE).size());
        summary.setPartitionCount(table.getChildren(EntityKind.PARTITION).size());
        summary.setHierarchyCount(table.getChildren(EntityKind.HIERARCHY).size());
        summary.setHidden(table.isHidden());
        summary.setPrivate(table.isPrivate());
        summary.setLineageTag(table.getLineageTag());
        summary.setDescription(table.getDescription());
        return summary;
    }

    private MeasureSummary summarizeMeasure(TmdlEntity table, TmdlEntity measure) {
        MeasureSummary summary = new MeasureSummary();
        summary.setTableName(table.getName());
        summary.setName(measure.getName());
        summary.setExpression(measure.getExpression());
        summary.setFormatString(measure.getFormatString());
        summary.setDisplayFolder(measure.getDisplayFolder());
        summary.setHidden(measure.isHidden());
        summary.setLineageTag(measure.getLineageTag());
        summary.setDescription(measure.getDescription());
        return summary;
    }

    private ColumnSummary summarizeColumn(TmdlEntity table, TmdlEntity column) {
        ColumnSummary summary = new ColumnSummary();
        summary.setTableName(table.getName());
        summary.setName(column.getName());
        summary.setDataType(column.getDataType() == null ? null : column.getDataType().toTmdl());
        summary.setSummarizeBy(column.getSummarizeBy() == null ? null : column.getSummarizeBy().toTmdl());
        summary.setFormatString(column.getFormatString());
        summary.setSourceColumn(column.getSourceColumn());
        summary.setHidden(column.isHidden());
        summary.setCalculated(column.isCalculated());
        summary.setExpression(column.getExpression());
        summary.setLineageTag(column.getLineageTag());
        summary.setDescription(column.getDescription());
        return summary;
    }

    public RelationshipListing listRelationships() throws IOException, TmdlException {
        List<RelationshipSummary> relationships = new ArrayList<>();
        Path file = workspace.getRelationshipsFile();
        if (Files.isRegularFile(file)) {
            for (TmdlEntity relationship : workspace.readDocument(file).getRelationships()) {
                relationships.add(summarize(relationship));
            }
        }
        int active = 0;
        Map<String, Integer> byCardinality = new LinkedHashMap<>();
        for (RelationshipSummary summary : relationships) {
            if (summary.isActive()) {
                active++;
            }
            byCardinality.merge(summary.getCardinality(), 1, Integer::sum);
        }
        RelationshipListing listing = new RelationshipListing();
        listing.setTotal(relationships.size());
        listing.setActive(active);
        listing.setInactive(relationships.size() - active);
        listing.setCardinalitySummary(byCardinality);
        listing.setRelationships(relationships);
        return listing;
    }

    private RelationshipSummary summarize(TmdlEntity relationship) {
        RelationshipSummary summary = new RelationshipSummary();
        summary.setName(relationship.getName());
        ColumnReference from = relationship.getFromColumn();
        ColumnReference to = relationship.getToColumn();
        if (from != null) {
            summary.setFromTable(from.getTable());
            summary.setFromColumn(from.getColumn());
        }
        if (to != null) {
            summary.setToTable(to.getTable());
            summary.setToColumn(to.getColumn());
        }
        summary.setCardinality(relationship.getCardinality().getLabel());
        summary.setCrossFilteringBehavior(relationship.getCrossFilteringBehavior().toTmdl());
        summary.setActive(relationship.isActive());
        return summary;
    }

    // -------------------------------------------------------------------------
    // Model Overview
    // -------------------------------------------------------------------------

    /**
     * Overview of the whole model: name and culture from {@code model.tmdl}, totals across all
     * tables, the relationship listing and every table, column and measure summary.
     */
    public ModelDetails modelDetails() throws IOException, TmdlException {
        ModelDetails details = new ModelDetails();
        readModelDeclaration(details);

        List<TableSummary> tables = new ArrayList<>();
        List<ColumnSummary> columns = new ArrayList<>();
        List<MeasureSummary> measures = new ArrayList<>();
        ModelDetails.TableTotals tableTotals = new ModelDetails.TableTotals();
        ModelDetails.ColumnTotals columnTotals = new ModelDetails.ColumnTotals();
        ModelDetails.MeasureTotals measureTotals = new ModelDetails.MeasureTotals();
        Map<String, Integer> byDataType = new TreeMap<>();

        for (LoadedTable loaded : loadTables()) {
            TableSummary table = summarize(loaded);
            tables.add(table);
            if (table.isHidden()) {
                tableTotals.setHidden(tableTotals.getHidden() + 1);
            }
            if (table.isPrivate()) {
                tableTotals.setPrivate(tableTotals.getPrivate() + 1);
            }
            for (TmdlEntity column : loaded.table.getChildren(EntityKind.COLUMN)) {
                ColumnSummary summary = summarizeColumn(loaded.table, column);
                columns.add(summary);
                if (summary.isCalculated()) {
                    columnTotals.setCalculated(columnTotals.getCalculated() + 1);
                }
                if (summary.isHidden()) {
                    columnTotals.setHidden(columnTotals.getHidden() + 1);
                }
                String dataType = summary.getDataType() == null ? "unknown" : summary.getDataType();
                byDataType.merge(dataType, 1, Integer::sum);
            }
            for (TmdlEntity measure : loaded.table.getChildren(EntityKind.MEASURE)) {
                MeasureSummary summary = summarizeMeasure(loaded.table, measure);
                measures.add(summary);
                if (summary.isHidden()) {
                    measureTotals.setHidden(measureTotals.getHidden() + 1);
                }
                if (summary.getFormatString() != null) {
                    measureTotals.setWithFormatString(measureTotals.getWithFormatString() + 1);
                }
            }
        }

        tableTotals.setTotal(tables.size());
        columnTotals.setTotal(columns.size());
        columnTotals.setRegular(columns.size() - columnTotals.getCalculated());
        columnTotals.setByDataType(byDataType);
        measureTotals.setTotal(measures.size());

        details.setTableTotals(tableTotals);
        details.setColumnTotals(columnTotals);
        details.setMeasureTotals(measureTotals);
        details.setRelationships(listRelationships());
        details.setTables(tables);
        details.setColumns(columns);
        details.setMeasures(measures);
        return details;
    }

    /**
     * Takes the model name and {@code culture} from the {@code model} block, which the parser
     * keeps verbatim. The culture defaults to en-US when the model does not declare one.
     */
    private void readModelDeclaration(ModelDetails details) throws IOException, TmdlException {
        details.setCulture(DEFAULT_CULTURE);
        Path file = workspace.getModelFile();
        if (!Files.isRegularFile(file)) {
            return;
        }
        for (TmdlElement element : workspace.readDocument(file).getElements()) {
            if (!(element instanceof OpaqueBlock) || !"model".equals(((OpaqueBlock) element).getKeyword())) {
                continue;
            }
            List<String> lines = ((OpaqueBlock) element).getRawLines();
            String header = lines.get(0).strip();
            details.setModelName(IdentifierQuoting.unquote(header.substring("model".length()).strip()));
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i).strip();
                if (line.startsWith("culture:")) {
                    details.setCulture(IdentifierQuoting.unquoteValue(line.substring("culture:".length())));
                }
            }
            return;
        }
    }

    /**
     * JSON view of one entity with its properties and nested members.
     */
    public ObjectNode show(EntityPath path) throws IOException, TmdlException {
        TmdlDocument document = workspace.readDocument(fileFor(path));
        return view(editor.resolve(document, path));
    }

    private ObjectNode view(TmdlEntity entity) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", entity.getKind().getKeyword());
        if (entity.getName() != null) {
            node.put("name", entity.getName());
        }
        if (entity.hasExpression()) {
            node.put("expression", entity.getExpression());
        }
        if (entity.getDescription() != null) {
            node.put("description", entity.getDescription());
        }
        ObjectNode properties = node.putObject("properties");
        ArrayNode children = objectMapper.createArrayNode();
        for (TmdlElement member : entity.getMembers()) {
            if (member instanceof TmdlProperty) {
                TmdlProperty property = (TmdlProperty) member;
                if (property.getStyle() == TmdlProperty.Style.FLAG && property.getValue() == null) {
                    properties.put(property.getKey(), true);
                } else {
                    properties.put(property.getKey(), property.getValue());
                }
            } else if (member instanceof TmdlEntity) {
                children.add(view((TmdlEntity) member));
            } else if (member instanceof OpaqueBlock) {
                ObjectNode opaque = objectMapper.createObjectNode();
                opaque.put("kind", "opaque");
                opaque.put("keyword", ((OpaqueBlock) member).getKeyword());
                opaque.put("text", ((OpaqueBlock) member).getRawText());
                children.add(opaque);
            }
        }
        if (!children.isEmpty()) {
            node.set("children", children);
        }
        return node;
    }

    // -------------------------------------------------------------------------
    // Edits
    // -------------------------------------------------------------------------

    public EditResult add(EntityPath parentPath, EntitySpec spec) throws IOException, TmdlException {
        Path file = fileFor(parentPath);
        String name = spec.getName() == null ? null : spec.getName().strip();
        if (spec.getKind() == EntityKind.MEASURE && name != null) {
            checkMeasureNameFree(name, null);
        }
        SemanticModelWorkspace.FileEdit edit = workspace.edit(file, doc -> editor.add(doc, parentPath, spec), dryRun);
        EntityPath childPath = parentPath.child(spec.getKind(), name);
        EditResult result = result("added", childPath, edit);
        result.setUpdatedFields(payloadKeys(spec.getProperties()));
        result.setLineageTag(editor.resolve(edit.document(), childPath).getLineageTag());
        return result;
    }

    public EditResult update(EntityPath path, PropertyChanges changes) throws IOException, TmdlException {
        Path file = fileFor(path);
        if (path.getLast().kind() == EntityKind.MEASURE && changes.contains(PropertyKey.NAME)
                && changes.get(PropertyKey.NAME) != null) {
            checkMeasureNameFree(changes.getString(PropertyKey.NAME).strip(), path);
        }
        SemanticModelWorkspace.FileEdit edit = workspace.edit(file, doc -> editor.update(doc, path, changes), dryRun);
        EditResult result = result("updated", path, edit);
        result.setUpdatedFields(payloadKeys(changes));
        return result;
    }

    public EditResult delete(EntityPath path) throws IOException, TmdlException {
        Path file = fileFor(path);
        SemanticModelWorkspace.FileEdit edit = workspace.edit(file, doc -> editor.delete(doc, path), dryRun);
        EditResult result = result("deleted", path, edit);
        result.setUpdatedFields(new ArrayList<>());
        return result;
    }

    private EditResult result(String action, EntityPath path, SemanticModelWorkspace.FileEdit edit) {
        EditResult result = new EditResult();
        result.setAction(action);
        result.setPath(path.toString());
        result.setFile(workspace.toRelativePath(edit.file()));
        result.setDryRun(dryRun);
        result.setWritten(edit.written());
        result.setDiff(edit.diff());
        return result;
    }

    private List<String> payloadKeys(PropertyChanges changes) {
        List<String> keys = new ArrayList<>();
        for (PropertyKey key : changes.keys()) {
            keys.add(key.getPayloadKey());
        }
        return keys;
    }

    /**
     * Measure names are unique across the whole model, not just within a table.
     */
    private void checkMeasureNameFree(String name, EntityPath renamed) throws IOException, TmdlException {
        for (LoadedTable loaded : loadTables()) {
            for (TmdlEntity measure : loaded.table.getChildren(EntityKind.MEASURE)) {
                boolean self = renamed != null
                    && loaded.table.getName().equalsIgnoreCase(renamed.getTableName())
                    && measure.getName().equalsIgnoreCase(renamed.getLast().name());
                if (!self && measure.getName().equalsIgnoreCase(name)) {
                    throw new DuplicateNameException("Measure '" + measure.getName()
                        + "' already exists in table '" + loaded.table.getName() + "'",
                        EntityPath.table(loaded.table.getName()).child(EntityKind.MEASURE, name).toString());
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // File Routing
    // -------------------------------------------------------------------------

    private Path fileFor(EntityPath path) throws IOException, EntityNotFoundException {
        EntityPath.Segment first = path.getSegments().get(0);
        if (first.kind() == EntityKind.TABLE) {
            Path file = workspace.findTableFile(first.name());
            if (file == null) {
                throw new EntityNotFoundException("No table '" + first.name() + "' in the model", path.toString());
            }
            return file;
        }
        if (first.kind() == EntityKind.RELATIONSHIP && Files.isRegularFile(workspace.getRelationshipsFile())) {
            return workspace.getRelationshipsFile();
        }
        throw new EntityNotFoundException("No file holds top-level " + first.kind().getKeyword() + " entities",
            path.toString());
    }

    private List<LoadedTable> loadTables() throws IOException, TmdlException {
        List<LoadedTable> tables = new ArrayList<>();
        for (Path file : workspace.listTableFiles()) {
            for (TmdlEntity table : workspace.readDocument(file).getTables()) {
                tables.add(new LoadedTable(file, table));
            }
        }
        return tables;
    }

    private List<LoadedTable> loadTables(String tableName) throws IOException, TmdlException {
        if (tableName == null || tableName.isBlank()) {
            return loadTables();
        }
        Path file = workspace.findTableFile(tableName);
        TmdlEntity table = file == null ? null : workspace.readDocument(file).getTable(tableName);
        if (table == null) {
            throw new EntityNotFoundException("No table '" + tableName + "' in the model",
                EntityPath.table(tableName).toString());
        }
        List<LoadedTable> tables = new ArrayList<>();
        tables.add(new LoadedTable(file, table));
        return tables;
    }

    private static final class LoadedTable {
        private final Path file;
        private final TmdlEntity table;

        LoadedTable(Path file, TmdlEntity table) {
            this.file = file;
            this.table = table;
        }
    }
}
