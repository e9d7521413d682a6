package com.tmdledit.models;

import java.util.List;

/**
 * Outcome of one add, update or delete, as reported to the caller.
 */
public class EditResult {
    private String action;
    private String path;
    private String file;
    private List<String> updatedFields;
    private String lineageTag;
    private boolean dryRun;
    private boolean written;
    private String diff;

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public List<String> getUpdatedFields() {
        return updatedFields;
    }

    public void setUpdatedFields(List<String> updatedFields) {
        this.updatedFields = updatedFields;
    }

    public String getLineageTag() {
        return lineageTag;
    }

    public void setLineageTag(String lineageTag) {
        this.lineageTag = lineageTag;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isWritten() {
        return written;
    }

    public void setWritten(boolean written) {
        this.written = written;
    }

    public String getDiff() {
        return diff;
    }

    public void setDiff(String diff) {
        this.diff = diff;
    }
}
