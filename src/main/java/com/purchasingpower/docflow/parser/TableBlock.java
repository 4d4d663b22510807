package com.purchasingpower.docflow.parser;

/**
 * Contiguous run of pipe-prefixed lines bound to a {@code table:} marker.
 *
 * @param markerLine line of the table marker
 * @param start      first pipe line (the header row)
 * @param end        exclusive end of the pipe run
 */
public record TableBlock(String tableId, int markerLine, int start, int end) {

    public int rowCount() {
        return end - start;
    }
}
