package com.percussion.scoredb.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Best-effort extraction of show name, date, location and classification from a page's text.
 * Missing fields are left empty; the caller combines the result with the file name fallback.
 */
public final class HeaderScanner {

    private static final Logger log = LoggerFactory.getLogger(HeaderScanner.class);

    private static final DateTimeFormatter HEADER_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMMM d, uuuu")
            .toFormatter(Locale.ENGLISH);

    private HeaderScanner() {}

    public static SheetHeader scan(String pageText) {
        if (pageText == null || pageText.isBlank()) return SheetHeader.EMPTY;

        Map<HeaderRule, String> found = new EnumMap<>(HeaderRule.class);
        for (HeaderRule rule : HeaderRule.values()) {
            if (rule == HeaderRule.DATE) continue;
            Matcher m = rule.matcher(pageText);
            if (m.find()) {
                String value = m.group(1).trim();
                if (!value.isEmpty()) found.put(rule, value);
            }
        }

        return new SheetHeader(
                found.get(HeaderRule.SHOW_NAME),
                findDate(pageText),
                found.get(HeaderRule.LOCATION),
                found.get(HeaderRule.CLASSIFICATION));
    }

    // First "Month D, YYYY" run that is a real calendar date; "Block 2, 2024" style noise is skipped
    private static LocalDate findDate(String pageText) {
        Matcher m = HeaderRule.DATE.matcher(pageText);
        while (m.find()) {
            String candidate = m.group(1).replaceAll(",\\s*", ", ");
            try {
                return LocalDate.parse(candidate, HEADER_DATE);
            } catch (DateTimeParseException e) {
                log.debug("[HEADER] Ignoring non-date match '{}'", candidate);
            }
        }
        return null;
    }
}
