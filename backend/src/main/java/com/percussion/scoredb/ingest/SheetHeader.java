package com.percussion.scoredb.ingest;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Partial header of one score sheet page. Every field is optional.
 */
public final class SheetHeader {

    public static final SheetHeader EMPTY = new SheetHeader(null, null, null, null);

    private final String showName;
    private final LocalDate showDate;
    private final String location;
    private final String classificationText;

    public SheetHeader(String showName, LocalDate showDate, String location, String classificationText) {
        this.showName = showName;
        this.showDate = showDate;
        this.location = location;
        this.classificationText = classificationText;
    }

    public Optional<String> getShowName() { return Optional.ofNullable(showName); }

    public Optional<LocalDate> getShowDate() { return Optional.ofNullable(showDate); }

    /** Raw "City, ST" text. */
    public Optional<String> getLocation() { return Optional.ofNullable(location); }

    public Optional<String> getClassificationText() { return Optional.ofNullable(classificationText); }

    public Optional<String> getLocationCity() {
        return locationPart(0);
    }

    public Optional<String> getLocationState() {
        return locationPart(1);
    }

    private Optional<String> locationPart(int idx) {
        if (location == null) return Optional.empty();
        int comma = location.indexOf(',');
        if (comma < 0) return Optional.empty();
        String part = idx == 0 ? location.substring(0, comma) : location.substring(comma + 1);
        part = part.trim();
        return part.isEmpty() ? Optional.empty() : Optional.of(part);
    }

    @Override
    public String toString() {
        return "SheetHeader{showName='" + showName + "', showDate=" + showDate
                + ", location='" + location + "', classificationText='" + classificationText + "'}";
    }
}
