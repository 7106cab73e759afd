package com.myorg.normparser.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized document of one workbook, plus what the conversion saw on the way.
 */
@Getter
@ToString
@AllArgsConstructor
public class ExtractionResult {

    private final NormativeDocument document;

    private final ParseDiagnostics diagnostics;
}
