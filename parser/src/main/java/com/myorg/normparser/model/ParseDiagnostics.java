package com.myorg.normparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one workbook conversion. Unclassified rows are the ones the
 * classification rules drop without a node.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseDiagnostics {

    @JsonProperty("rows_scanned")
    private Integer rowsScanned;

    @JsonProperty("rows_by_kind")
    private Map<RowKind, Integer> rowsByKind;

    @JsonProperty("unclassified_rows")
    private List<Integer> unclassifiedRows;

    @JsonProperty("note_count")
    private Integer noteCount;

    // 1-based; null when the sheet has no footnote section
    @JsonProperty("note_marker_row")
    private Integer noteMarkerRow;

    public Map<RowKind, Integer> getRowsByKind() {
        return rowsByKind == null ? Map.of() : Map.copyOf(rowsByKind);
    }

    public List<Integer> getUnclassifiedRows() {
        return unclassifiedRows == null ? List.of() : List.copyOf(unclassifiedRows);
    }

    public int count(RowKind kind) {
        return rowsByKind == null ? 0 : rowsByKind.getOrDefault(kind, 0);
    }

    public static Map<RowKind, Integer> emptyCounts() {
        Map<RowKind, Integer> counts = new EnumMap<>(RowKind.class);
        for (RowKind kind : RowKind.values()) {
            counts.put(kind, 0);
        }
        return counts;
    }
}
