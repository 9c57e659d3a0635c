package com.percussion.scoredb.ingest;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses file names of the form {@code YYYY_MM_DD_<host>[_hs]_<weekday>_<city>_<STATE>.pdf}.
 * Used as the deterministic fallback when the sheet header cannot be read.
 */
public final class FilenameIdentityParser {

    public static final Set<String> WEEKDAYS = Set.of("saturday", "sunday", "prelims", "semifinals", "finals");

    private static final int MIN_TOKENS = 6;
    private static final int FIRST_HOST_TOKEN = 3;

    private FilenameIdentityParser() {}

    public static FilenameIdentity parse(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new SheetFormatException("File name is empty");
        }
        String base = stripExtension(fileName.trim());
        String[] parts = base.split("_");
        if (parts.length < MIN_TOKENS) {
            throw new SheetFormatException("File name too short: '" + fileName + "'");
        }

        LocalDate showDate;
        try {
            showDate = LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException | DateTimeException e) {
            throw new SheetFormatException("No valid date prefix in file name: '" + fileName + "'", e);
        }

        int weekdayIdx = -1;
        for (int i = FIRST_HOST_TOKEN; i < parts.length; i++) {
            if (WEEKDAYS.contains(parts[i].toLowerCase(Locale.ROOT))) {
                weekdayIdx = i;
                break;
            }
        }
        if (weekdayIdx < 0) {
            throw new SheetFormatException("No weekday in file name: '" + fileName + "'");
        }
        if (weekdayIdx == parts.length - 1) {
            throw new SheetFormatException("No state after weekday in file name: '" + fileName + "'");
        }

        List<String> hostParts = new ArrayList<>(Arrays.asList(parts).subList(FIRST_HOST_TOKEN, weekdayIdx));
        if (hostParts.isEmpty() || !"hs".equalsIgnoreCase(hostParts.get(hostParts.size() - 1))) {
            hostParts.add("hs");
        }
        String hostId = String.join("_", hostParts);

        String weekday = titleCase(parts[weekdayIdx]);

        // city tokens sit between the weekday and the trailing state token
        List<String> cityParts = weekdayIdx + 1 < parts.length - 1
                ? Arrays.asList(parts).subList(weekdayIdx + 1, parts.length - 1)
                : List.of();
        String city = cityParts.isEmpty() ? null
                : cityParts.stream().map(FilenameIdentityParser::titleCase).collect(Collectors.joining(" "));

        String state = parts[parts.length - 1].toUpperCase(Locale.ROOT);

        String hostWords = Arrays.stream(hostId.split("_"))
                .map(FilenameIdentityParser::titleCase)
                .collect(Collectors.joining(" "));
        String showName = hostWords + " " + weekday;

        return new FilenameIdentity(showDate, hostId, weekday, city, state, showName);
    }

    static String titleCase(String token) {
        if (token == null || token.isEmpty()) return "";
        String lower = token.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
