package com.myorg.normparser.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One decoded content row of the sheet, as consumed by the hierarchy builder.
 */
@Getter
@Builder
@ToString
public class SheetRow {

    /** 1-based row number in the sheet, for diagnostics. */
    private final int rowNumber;

    @Builder.Default
    private final DecodedCell caption = DecodedCell.empty();

    /** Raw code cell value; null when the cell is empty. */
    private final CodeValue code;

    @Builder.Default
    private final DecodedCell term = DecodedCell.empty();

    /** Whether the raw term cell holds a non-empty value, before decoding. */
    private final boolean rawTermPresent;

    /** Alignment indent of the caption cell. */
    private final int indent;

    public boolean hasCaption() {
        return caption.hasText();
    }

    public boolean hasCode() {
        return code != null && !code.isAbsent();
    }

    public boolean hasTermText() {
        return term.hasText();
    }
}
