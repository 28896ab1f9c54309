package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.blocks.TableBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects pipe-table rows until the table is drained into a {@link TableBlock}.
 *
 * <p>The first non-delimiter row becomes the header and every later one a data row.
 * A table that never received a data row is discarded on drain.</p>
 */
final class TableAccumulator {

    private static final char CELL_SEPARATOR = '|';

    private List<String> header = List.of();
    private final List<List<String>> rows = new ArrayList<>();
    private boolean headerCaptured;

    /**
     * Adds one table line. Delimiter rows such as {@code |---|:---:|} are ignored.
     *
     * @param line raw table line
     */
    void acceptRow(String line) {
        List<String> cells = parseCells(line);
        if (isDelimiterRow(cells)) {
            return;
        }
        if (!headerCaptured) {
            header = cells;
            headerCaptured = true;
        } else {
            rows.add(cells);
        }
    }

    boolean hasDataRows() {
        return !rows.isEmpty();
    }

    /**
     * Empties the accumulator.
     *
     * @return the table when at least one data row was collected, empty otherwise
     */
    Optional<TableBlock> drain() {
        Optional<TableBlock> table = hasDataRows()
            ? Optional.of(new TableBlock(header, rows))
            : Optional.empty();
        header = List.of();
        rows.clear();
        headerCaptured = false;
        return table;
    }

    /**
     * Splits a row on pipes, strips every cell and drops empty cells.
     *
     * @param line raw table line
     * @return non-empty trimmed cells in column order
     */
    static List<String> parseCells(String line) {
        List<String> cells = new ArrayList<>();
        int cellStart = 0;
        for (int cursor = 0; cursor <= line.length(); cursor++) {
            if (cursor == line.length() || line.charAt(cursor) == CELL_SEPARATOR) {
                String cell = line.substring(cellStart, cursor).strip();
                if (!cell.isEmpty()) {
                    cells.add(cell);
                }
                cellStart = cursor + 1;
            }
        }
        return cells;
    }

    /**
     * A delimiter row consists only of cells made of dashes and colons.
     * A row without any cells also counts, so it never becomes a header.
     */
    static boolean isDelimiterRow(List<String> cells) {
        return cells.stream().allMatch(cell -> cell.chars().allMatch(c -> c == '-' || c == ':'));
    }
}
