package com.williamcallahan.chatblocks.domain.blocks;

import java.util.List;
import java.util.Objects;

/**
 * A pipe table with trimmed, non-empty cells. Rows are not padded to the header width.
 *
 * @param header cells of the first non-delimiter row
 * @param rows cells of every following non-delimiter row
 */
public record TableBlock(List<String> header, List<List<String>> rows) implements ContentBlock {

    public TableBlock {
        Objects.requireNonNull(header, "Table header cannot be null");
        Objects.requireNonNull(rows, "Table rows cannot be null");
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }
}
