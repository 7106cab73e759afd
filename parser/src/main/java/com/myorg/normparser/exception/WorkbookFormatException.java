package com.myorg.normparser.exception;

/**
 * The workbook cannot be read as a normative-terms sheet, e.g. it is not OOXML
 * or the expected sheet is missing.
 */
public class WorkbookFormatException extends RuntimeException {

    public WorkbookFormatException(String message) {
        super(message);
    }

    public WorkbookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
