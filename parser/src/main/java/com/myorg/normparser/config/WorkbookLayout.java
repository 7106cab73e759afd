package com.myorg.normparser.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where things are in the normative-terms sheet. Columns and rows are 1-based, as in Excel.
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "parser.layout")
public class WorkbookLayout {

    private String sheetName = "Нормативные сроки";

    /** Rows above the content, column titles included. */
    private int headerRows = 8;

    /** Column-1 text that starts the footnote section. */
    private String noteMarker = "Примечание";

    private int descriptionColumn = 1;

    private int codeColumn = 2;

    private int termColumn = 3;
}
