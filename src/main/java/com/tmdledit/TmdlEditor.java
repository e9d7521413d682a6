package com.tmdledit;

import com.tmdledit.errors.EntityNotFoundException;
import com.tmdledit.errors.SerializationInvariantException;
import com.tmdledit.errors.TmdlMutationException;
import com.tmdledit.errors.TmdlParseException;
import com.tmdledit.models.EntityPath;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.mutation.MutationEngine;
import com.tmdledit.parser.TmdlParser;
import com.tmdledit.writer.StructureSignature;
import com.tmdledit.writer.TmdlSerializer;

/**
 * Entry point to the parse, mutate and serialize pipeline for a single TMDL file.
 *
 * <p>With verification on, every serialized text is parsed again and compared structurally with
 * the document it came from; a mismatch raises {@link SerializationInvariantException}.
 */
public class TmdlEditor {

    private final TmdlParser parser = new TmdlParser();
    private final TmdlSerializer serializer = new TmdlSerializer();
    private final MutationEngine engine;
    private final boolean verify;

    public TmdlEditor() {
        this(new MutationEngine(), true);
    }

    public TmdlEditor(MutationEngine engine, boolean verify) {
        this.engine = engine;
        this.verify = verify;
    }

    public TmdlDocument parse(String text) throws TmdlParseException {
        return parser.parse(text);
    }

    public TmdlDocument add(TmdlDocument document, EntityPath parentPath, EntitySpec spec)
            throws TmdlMutationException {
        return engine.add(document, parentPath, spec);
    }

    public TmdlDocument update(TmdlDocument document, EntityPath path, PropertyChanges changes)
            throws TmdlMutationException {
        return engine.update(document, path, changes);
    }

    public TmdlDocument delete(TmdlDocument document, EntityPath path) throws TmdlMutationException {
        return engine.delete(document, path);
    }

    public TmdlEntity resolve(TmdlDocument document, EntityPath path) throws EntityNotFoundException {
        return engine.resolve(document, path);
    }

    public String serialize(TmdlDocument document) {
        String text = serializer.serialize(document);
        if (verify) {
            verify(document, text);
        }
        return text;
    }

    private void verify(TmdlDocument document, String text) {
        TmdlDocument reparsed;
        try {
            reparsed = parser.parse(text);
        } catch (TmdlParseException e) {
            throw new SerializationInvariantException("Serialized text does not parse: " + e.getMessage(), e);
        }
        if (!StructureSignature.of(document).equals(StructureSignature.of(reparsed))) {
            log("Structure changed between serialize and re-parse");
            throw new SerializationInvariantException("Serialized text does not re-parse to the same structure");
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[TmdlEditor] " + message);
        }
    }
}
