package com.myorg.normparser.service.implementation;

import com.myorg.normparser.model.CodeValue;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw cell access shared by the decoder and the extractor. Formula cells are read through
 * their cached result; nothing is evaluated.
 */
final class PoiCells {

    private static final DataFormatter FORMATTER = new DataFormatter();
    private static final Pattern XML_ESCAPE = Pattern.compile("_x([0-9A-Fa-f]{4})_");

    private PoiCells() {}

    static CellType resolvedType(Cell cell) {
        if (cell == null) return CellType.BLANK;
        CellType type = cell.getCellType();
        return type == CellType.FORMULA ? cell.getCachedFormulaResultType() : type;
    }

    /**
     * Text as the sheet shows it, or null for blank and error cells.
     */
    static String displayText(Cell cell) {
        switch (resolvedType(cell)) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                CellStyle style = cell.getCellStyle();
                return FORMATTER.formatRawCellContents(cell.getNumericCellValue(),
                        style.getDataFormat(), style.getDataFormatString());
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            default:
                return null;
        }
    }

    /**
     * Whether the cell holds something other than nothing, an empty string, zero or FALSE.
     */
    static boolean hasValue(Cell cell) {
        switch (resolvedType(cell)) {
            case STRING:
                return !cell.getStringCellValue().isEmpty();
            case NUMERIC:
                return cell.getNumericCellValue() != 0.0;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return true;
            default:
                return false;
        }
    }

    /**
     * Code column value with its spreadsheet type kept. Null for blank or empty cells.
     */
    static CodeValue codeValue(Cell cell) {
        switch (resolvedType(cell)) {
            case STRING:
                String s = cell.getStringCellValue();
                return s.isEmpty() ? null : CodeValue.ofText(s);
            case NUMERIC:
                return CodeValue.ofNumber(cell.getNumericCellValue());
            case BOOLEAN:
                return CodeValue.ofText(String.valueOf(cell.getBooleanCellValue()));
            default:
                return null;
        }
    }

    static int indent(Cell cell) {
        if (cell == null || cell.getCellStyle() == null) return 0;
        return cell.getCellStyle().getIndention();
    }

    /**
     * Decodes the {@code _xHHHH_} escapes of raw OOXML run text, e.g. {@code _x000D_} for a carriage
     * return, the same way the cell's string value is decoded.
     */
    static String unescapeXml(String raw) {
        if (raw == null || !raw.contains("_x")) {
            return raw == null ? "" : raw;
        }
        Matcher m = XML_ESCAPE.matcher(raw);
        StringBuilder out = new StringBuilder(raw.length());
        while (m.find()) {
            char decoded = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(decoded)));
        }
        m.appendTail(out);
        return out.toString();
    }
}
