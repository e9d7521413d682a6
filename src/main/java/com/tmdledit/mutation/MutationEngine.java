package com.tmdledit.mutation;

import com.tmdledit.AppLogger;
import com.tmdledit.errors.DuplicateNameException;
import com.tmdledit.errors.EntityNotFoundException;
import com.tmdledit.errors.TmdlMutationException;
import com.tmdledit.models.EntityPath;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.Elements;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.Trivia;

import java.util.List;

/**
 * Add, update, delete and resolve entities by path.
 *
 * <p>Every operation works on a deep copy of the input document and returns the copy, so a
 * failed call never leaves a partially edited document behind.
 */
public class MutationEngine {

    private final LineageTagGenerator tagGenerator;
    private final InsertionPolicy insertionPolicy;
    private final PropertyEditor editor = new PropertyEditor();
    private final EntityFactory factory = new EntityFactory(editor);

    public MutationEngine() {
        this(new RandomLineageTagGenerator(), new AuthoredConventionPolicy());
    }

    public MutationEngine(LineageTagGenerator tagGenerator, InsertionPolicy insertionPolicy) {
        this.tagGenerator = tagGenerator;
        this.insertionPolicy = insertionPolicy;
    }

    // -------------------------------------------------------------------------
    // Operations
    // -------------------------------------------------------------------------

    public TmdlDocument add(TmdlDocument document, EntityPath parentPath, EntitySpec spec)
            throws TmdlMutationException {
        TmdlDocument copy = document.copy();
        Location parentLocation = locate(copy, parentPath);
        TmdlEntity parent = parentLocation.entity;
        String childPath = parentPath.child(spec.getKind(), spec.getName()).toString();

        if (spec.getName() != null) {
            TmdlEntity existing = Elements.findEntity(parent.getMembers(), spec.getKind(), spec.getName().strip());
            if (existing != null) {
                throw new DuplicateNameException("A " + spec.getKind().getKeyword() + " named '"
                    + existing.getName() + "' already exists in " + parentPath, childPath);
            }
        }

        String tag = tagGenerator.next(copy.collectLineageTags());
        TmdlEntity entity = factory.create(spec, parent.getDepth() + 1, tag, childPath);
        int index = insertionPolicy.insertionIndex(parent, spec.getKind());
        insert(parent, index, entity);
        log("Added " + entity + " to " + parentPath + " at member " + index);
        return copy;
    }

    public TmdlDocument update(TmdlDocument document, EntityPath path, PropertyChanges changes)
            throws TmdlMutationException {
        TmdlDocument copy = document.copy();
        Location location = locate(copy, path);
        List<String> applied = editor.apply(location.entity, changes, location.container, path.toString());
        log("Updated " + path + ": " + applied);
        return copy;
    }

    public TmdlDocument delete(TmdlDocument document, EntityPath path) throws TmdlMutationException {
        TmdlDocument copy = document.copy();
        Location location = locate(copy, path);
        List<TmdlElement> members = location.container;
        int index = members.indexOf(location.entity);
        members.remove(index);
        if (index > 0 && isBlank(members.get(index - 1))) {
            members.remove(index - 1);
        } else if (index < members.size() && isBlank(members.get(index))) {
            members.remove(index);
        }
        log("Deleted " + path);
        return copy;
    }

    /**
     * Returns a copy of the addressed entity.
     */
    public TmdlEntity resolve(TmdlDocument document, EntityPath path) throws EntityNotFoundException {
        return locate(document, path).entity.copy();
    }

    // -------------------------------------------------------------------------
    // Path Resolution
    // -------------------------------------------------------------------------

    private Location locate(TmdlDocument document, EntityPath path) throws EntityNotFoundException {
        List<TmdlElement> container = document.getElements();
        TmdlEntity entity = null;
        for (EntityPath.Segment segment : path.getSegments()) {
            if (entity != null) {
                container = entity.getMembers();
            }
            TmdlEntity next = Elements.findEntity(container, segment.kind(), segment.name());
            if (next == null) {
                String where = entity == null ? "the document" : entity.toString();
                String name = segment.name() == null ? "" : " '" + segment.name() + "'";
                throw new EntityNotFoundException(
                    "No " + segment.kind().getKeyword() + name + " in " + where, path.toString());
            }
            entity = next;
        }
        return new Location(container, entity);
    }

    // -------------------------------------------------------------------------
    // Separators
    // -------------------------------------------------------------------------

    /**
     * Inserts the entity and, when the parent separates its children with blank lines, one
     * blank line so the parent keeps that layout. Between two siblings with no blank line
     * between them, the entity goes in without one.
     */
    private void insert(TmdlEntity parent, int index, TmdlEntity entity) {
        List<TmdlElement> members = parent.getMembers();
        if (!usesBlankSeparators(parent)) {
            members.add(index, entity);
            return;
        }
        int before = index;
        while (before > 0 && isBlank(members.get(before - 1))) {
            before--;
        }
        if (before == index && index > 0 && index < members.size()
                && members.get(index - 1) instanceof TmdlEntity && !isBlank(members.get(index))) {
            // The preceding sibling has no gap after it; the new one keeps that gap closed.
            members.add(index, entity);
            return;
        }
        if (before > 0) {
            members.add(before, Trivia.blank());
            members.add(before + 1, entity);
            return;
        }
        members.add(index, entity);
        if (index + 1 < members.size() && !isBlank(members.get(index + 1))) {
            members.add(index + 1, Trivia.blank());
        }
    }

    private boolean usesBlankSeparators(TmdlEntity parent) {
        List<TmdlElement> members = parent.getMembers();
        boolean hasEntities = false;
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) instanceof TmdlEntity) {
                hasEntities = true;
                if (i > 0 && isBlank(members.get(i - 1))) {
                    return true;
                }
            }
        }
        return !hasEntities;
    }

    private static boolean isBlank(TmdlElement element) {
        return element instanceof Trivia && ((Trivia) element).isBlank();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[MutationEngine] " + message);
        }
    }

    private static final class Location {
        private final List<TmdlElement> container;
        private final TmdlEntity entity;

        Location(List<TmdlElement> container, TmdlEntity entity) {
            this.container = container;
            this.entity = entity;
        }
    }
}
