package com.percussion.scoredb.ingest;

import java.time.LocalDate;

/**
 * Show identity recovered from a structured score sheet file name.
 *
 * @param showDate date encoded in the leading YYYY_MM_DD tokens
 * @param hostId   underscore-joined host tokens, always ending in "hs" (e.g. "arcadia_hs")
 * @param weekday  title-cased weekday token (e.g. "Saturday", "Finals")
 * @param city     title-cased city words (e.g. "Lake Elsinore"), or null when the name has none
 * @param state    upper-cased state code (e.g. "CA")
 * @param showName display name synthesized from host id and weekday
 */
public record FilenameIdentity(LocalDate showDate,
                               String hostId,
                               String weekday,
                               String city,
                               String state,
                               String showName) {
}
