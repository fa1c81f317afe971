package com.enterprise.clickhouse.runner;

import java.util.Set;

/**
 * Output formats that can be consumed row by row.
 */
public final class StreamFormats {

    public static final String DEFAULT = "JSONEachRow";

    public static final Set<String> ALL = Set.of(
            "JSONEachRow",
            "JSONStringsEachRow",
            "JSONCompactEachRow",
            "JSONCompactStringsEachRow",
            "JSONCompactEachRowWithNames",
            "JSONCompactEachRowWithNamesAndTypes",
            "JSONCompactStringsEachRowWithNames",
            "JSONCompactStringsEachRowWithNamesAndTypes",
            "CSV",
            "CSVWithNames",
            "CSVWithNamesAndTypes",
            "TabSeparated",
            "TabSeparatedRaw",
            "TabSeparatedWithNames",
            "TabSeparatedWithNamesAndTypes",
            "TabSeparatedRawWithNames",
            "TabSeparatedRawWithNamesAndTypes");

    private StreamFormats() {}

    public static boolean isStreamable(String format) {
        return format != null && ALL.contains(format);
    }
}
