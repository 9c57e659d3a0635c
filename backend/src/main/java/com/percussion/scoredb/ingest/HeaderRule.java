package com.percussion.scoredb.ingest;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable rule table for the score sheet header: one pattern per header field.
 * Each rule captures its value in group 1.
 */
public enum HeaderRule {

    SHOW_NAME(Pattern.compile("([A-Za-z ]+ HS(?: Saturday| Sunday| Finals| Prelims))")),

    LOCATION(Pattern.compile("[–—-][ \\t]*([A-Za-z ]+,[ \\t]*[A-Z]{2})\\b")),

    DATE(Pattern.compile("([A-Za-z]+ \\d{1,2},\\s*\\d{4})")),

    CLASSIFICATION(Pattern.compile(
            "(Percussion (?:Scholastic|Independent) [A-Za-z ]+(?:[–—-][ \\t]*Block[ \\t]*\\d+)?)",
            Pattern.CASE_INSENSITIVE));

    private final Pattern pattern;

    HeaderRule(Pattern pattern) {
        this.pattern = pattern;
    }

    public Pattern pattern() {
        return pattern;
    }

    public Matcher matcher(CharSequence text) {
        return pattern.matcher(text);
    }
}
