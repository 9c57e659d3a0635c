package com.percussion.scoredb.ingest;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits "Percussion Scholastic A – Block 2" into ("Percussion Scholastic A", 2).
 * Text that does not look like a percussion classification maps to the placeholder label.
 */
public final class ClassificationBlockSplitter {

    public static final String UNKNOWN = "Unknown";

    private static final Pattern CLASS_BLOCK = Pattern.compile(
            "^(Percussion\\s+(?:Scholastic|Independent)\\s+.*?)(?:\\s*[–—-]\\s*Block\\s*(\\d+))?$",
            Pattern.CASE_INSENSITIVE);

    private ClassificationBlockSplitter() {}

    public static ClassificationBlock split(String text) {
        return split(text, UNKNOWN);
    }

    public static ClassificationBlock split(String text, String unknownLabel) {
        if (text == null || text.isBlank()) return new ClassificationBlock(unknownLabel, null);
        Matcher m = CLASS_BLOCK.matcher(text.trim());
        if (!m.matches()) return new ClassificationBlock(unknownLabel, null);
        String label = m.group(1).trim().replaceAll("\\s+", " ");
        Integer block = m.group(2) != null ? Integer.valueOf(m.group(2)) : null;
        return new ClassificationBlock(label, block);
    }
}
