package com.jreinhal.compass.autonomous.groundtruth;

import java.util.List;
import java.util.Map;

/**
 * A parsed spreadsheet: the sheet name plus one header-keyed map per data row. Row 0 is the
 * first row below the header.
 */
public record SourceSheet(String name, List<Map<String, Object>> rows) {

    public SourceSheet {
        name = name == null || name.isBlank() ? "Sheet1" : name;
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
