package com.tmdledit;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unified diff between the text of a file before and after an edit.
 */
public class ChangePreview {

    private static final int CONTEXT_LINES = 3;

    /**
     * @return the diff, or an empty string when the texts are line-for-line equal
     */
    public String unifiedDiff(String fileName, String before, String after) {
        List<String> original = lines(before);
        List<String> revised = lines(after);
        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
            "a/" + fileName,
            "b/" + fileName,
            original,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unified);
    }

    static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
