package com.enterprise.clickhouse.runner;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Native insert bypassing SQL text. Exactly one of {@code rows} and
 * {@code stream} is set; an empty {@code columns} list means "take the
 * columns from the data".
 */
public record InsertRequest(String table, List<Map<String, Object>> rows, InputStream stream,
                            String format, List<String> columns) {

    public InsertRequest {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(format, "format");
        if ((rows == null) == (stream == null)) {
            throw new IllegalArgumentException("exactly one of rows or stream must be given");
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static InsertRequest ofRows(String table, List<Map<String, Object>> rows,
                                       String format, List<String> columns) {
        return new InsertRequest(table, rows, null, format, columns);
    }

    public static InsertRequest ofStream(String table, InputStream stream,
                                         String format, List<String> columns) {
        return new InsertRequest(table, null, stream, format, columns);
    }

    public boolean isStream() {
        return stream != null;
    }
}
