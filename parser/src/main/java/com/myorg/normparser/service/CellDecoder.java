package com.myorg.normparser.service;

import com.myorg.normparser.model.DecodedCell;
import org.apache.poi.ss.usermodel.Cell;

public interface CellDecoder {

    /**
     * Splits a cell into its display text and the footnote keys written as superscript.
     * Never fails; a null or blank cell decodes to {@link DecodedCell#empty()}.
     */
    DecodedCell decode(Cell cell);
}
