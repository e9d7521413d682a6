package com.tmdledit.models;

import com.tmdledit.writer.IdentifierQuoting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named structural node (table, column, measure, ...) with its description, its optional
 * declaration expression and its ordered members.
 *
 * <p>Parsed entities keep the raw lines of their declaration. Those lines are re-emitted as long
 * as neither the name nor the expression has been changed; members and description are tracked
 * separately so a property edit leaves the declaration untouched.
 */
public class TmdlEntity extends TmdlElement {

    private final EntityKind kind;
    private String name;
    private String rawName;
    private String expression;
    private final String inlineExpression;
    private final int depth;
    private final int lineNumber;
    private final List<String> declarationRaw;
    private final List<Trivia> description = new ArrayList<>();
    private final List<TmdlElement> members = new ArrayList<>();
    private boolean declarationModified;
    private boolean expressionModified;
    private boolean descriptionModified;

    public TmdlEntity(EntityKind kind, String name, String rawName, String expression, String inlineExpression,
                      int depth, int lineNumber, List<String> declarationRaw) {
        this.kind = kind;
        this.name = name;
        this.rawName = rawName;
        this.expression = expression;
        this.inlineExpression = inlineExpression;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.declarationRaw = declarationRaw == null ? null : List.copyOf(declarationRaw);
    }

    /**
     * A new entity with no source text; everything about it is rendered canonically.
     */
    public static TmdlEntity create(EntityKind kind, String name, int depth) {
        String raw = kind.isNamed() ? IdentifierQuoting.quote(name) : null;
        TmdlEntity entity = new TmdlEntity(kind, kind.isNamed() ? name : null, raw, null, null, depth, 0, null);
        entity.declarationModified = true;
        entity.descriptionModified = true;
        return entity;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /** Name token as written in the declaration, quotes included. */
    public String getRawName() {
        return rawName;
    }

    public void setName(String name) {
        this.name = name;
        this.rawName = IdentifierQuoting.quote(name);
        this.declarationModified = true;
    }

    /** Declaration expression with continuation indentation removed, or null. */
    public String getExpression() {
        return expression;
    }

    public boolean hasExpression() {
        return expression != null;
    }

    public void setExpression(String expression) {
        this.expression = expression;
        this.expressionModified = true;
        this.declarationModified = true;
    }

    /** Text after {@code =} on the declaration line as authored. */
    public String getInlineExpression() {
        return inlineExpression;
    }

    public List<String> getDeclarationRaw() {
        return declarationRaw;
    }

    public List<String> getDeclarationContinuation() {
        if (declarationRaw == null || declarationRaw.size() <= 1) {
            return Collections.emptyList();
        }
        return declarationRaw.subList(1, declarationRaw.size());
    }

    public boolean isNew() {
        return declarationRaw == null;
    }

    public boolean isDeclarationModified() {
        return declarationModified;
    }

    public boolean isExpressionModified() {
        return expressionModified;
    }

    public boolean isDescriptionModified() {
        return descriptionModified;
    }

    public List<Trivia> getDescriptionLines() {
        return description;
    }

    public void addDescriptionLine(Trivia line) {
        description.add(line);
    }

    /**
     * Description text with lines joined by {@code \n}, or null when there is none.
     */
    public String getDescription() {
        if (description.isEmpty()) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        for (Trivia line : description) {
            lines.add(line.getDescriptionText());
        }
        return String.join("\n", lines);
    }

    public void setDescription(String text) {
        description.clear();
        if (text != null && !text.isEmpty()) {
            for (String line : text.split("\r\n|\r|\n", -1)) {
                description.add(Trivia.description(line.stripTrailing(), depth));
            }
        }
        descriptionModified = true;
    }

    public List<TmdlElement> getMembers() {
        return members;
    }

    public List<TmdlEntity> getChildren(EntityKind childKind) {
        return Elements.entities(members, childKind);
    }

    public TmdlEntity findChild(EntityKind childKind, String childName) {
        return Elements.findEntity(members, childKind, childName);
    }

    public TmdlProperty findProperty(String key) {
        return Elements.findProperty(members, key);
    }

    public String getPropertyValue(String key) {
        TmdlProperty property = findProperty(key);
        return property == null ? null : property.getValue();
    }

    // -------------------------------------------------------------------------
    // Typed accessors
    // -------------------------------------------------------------------------

    public String getLineageTag() {
        return getPropertyValue("lineageTag");
    }

    public DataType getDataType() {
        return DataType.fromTmdl(getPropertyValue("dataType"));
    }

    public SummarizeBy getSummarizeBy() {
        return SummarizeBy.fromTmdl(getPropertyValue("summarizeBy"));
    }

    public String getFormatString() {
        return getPropertyValue("formatString");
    }

    public String getSourceColumn() {
        return getPropertyValue("sourceColumn");
    }

    public String getDisplayFolder() {
        return getPropertyValue("displayFolder");
    }

    public String getDataCategory() {
        return getPropertyValue("dataCategory");
    }

    public boolean isHidden() {
        TmdlProperty property = findProperty("isHidden");
        return property != null && property.isTrue();
    }

    public boolean isPrivate() {
        TmdlProperty property = findProperty("isPrivate");
        return property != null && property.isTrue();
    }

    /**
     * A column declared with {@code =} is calculated; a data column maps a source column instead.
     */
    public boolean isCalculated() {
        return kind == EntityKind.COLUMN && expression != null;
    }

    public PartitionMode getMode() {
        return PartitionMode.fromTmdl(getPropertyValue("mode"));
    }

    /** Query text of a partition's {@code source =} block. */
    public String getSourceExpression() {
        TmdlProperty property = findProperty("source");
        return property == null ? null : property.getValue();
    }

    public ColumnReference getFromColumn() {
        return ColumnReference.parse(getPropertyValue("fromColumn"));
    }

    public ColumnReference getToColumn() {
        return ColumnReference.parse(getPropertyValue("toColumn"));
    }

    public Cardinality getCardinality() {
        Cardinality explicit = Cardinality.fromTmdl(getPropertyValue("cardinality"));
        if (explicit != null) {
            return explicit;
        }
        return Cardinality.fromEnds(getPropertyValue("fromCardinality"), getPropertyValue("toCardinality"));
    }

    public CrossFilteringBehavior getCrossFilteringBehavior() {
        CrossFilteringBehavior behavior = CrossFilteringBehavior.fromTmdl(getPropertyValue("crossFilteringBehavior"));
        return behavior == null ? CrossFilteringBehavior.ONE_DIRECTION : behavior;
    }

    /** Relationships are active unless marked {@code isActive: false}. */
    public boolean isActive() {
        TmdlProperty property = findProperty("isActive");
        return property == null || property.isTrue();
    }

    @Override
    public int getDepth() {
        return depth;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * True when the declaration or description must be rendered. Member edits are
     * tracked by the members themselves.
     */
    @Override
    public boolean isModified() {
        return declarationModified || descriptionModified;
    }

    @Override
    public TmdlEntity copy() {
        TmdlEntity copy = new TmdlEntity(kind, name, rawName, expression, inlineExpression, depth, lineNumber,
            declarationRaw);
        copy.declarationModified = declarationModified;
        copy.expressionModified = expressionModified;
        copy.descriptionModified = descriptionModified;
        for (Trivia line : description) {
            copy.description.add(line.copy());
        }
        copy.members.addAll(Elements.copyAll(members));
        return copy;
    }

    @Override
    public String toString() {
        return kind.getKeyword() + (rawName == null ? "" : " " + rawName);
    }
}
