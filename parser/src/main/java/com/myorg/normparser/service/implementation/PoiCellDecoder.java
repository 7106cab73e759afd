package com.myorg.normparser.service.implementation;

import com.myorg.normparser.model.DecodedCell;
import com.myorg.normparser.service.CellDecoder;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.RichTextString;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFRichTextString;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTRst;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes XLSX cells whose text mixes regular runs with superscript footnote keys,
 * e.g. "срок" followed by a superscript "2, 5".
 */
public class PoiCellDecoder implements CellDecoder {

    @Override
    public DecodedCell decode(Cell cell) {
        if (!PoiCells.hasValue(cell)) {
            return DecodedCell.empty();
        }
        if (PoiCells.resolvedType(cell) != CellType.STRING) {
            return DecodedCell.plain(PoiCells.displayText(cell));
        }

        RichTextString rich = cell.getRichStringCellValue();
        String full = rich.getString();
        if (rich.numFormattingRuns() < 2 || !(rich instanceof XSSFRichTextString)) {
            return DecodedCell.plain(full);
        }
        return decodeRuns((XSSFRichTextString) rich);
    }

    /**
     * Walks the runs of the shared string. Each run's text is taken from the run itself, since
     * run offsets count the raw {@code _xHHHH_} escapes and the decoded string does not.
     */
    private static DecodedCell decodeRuns(XSSFRichTextString rich) {
        StringBuilder text = new StringBuilder();
        StringBuilder refs = new StringBuilder();

        CTRst st = rich.getCTRst();
        for (int i = 0; i < st.sizeOfRArray(); i++) {
            String part = PoiCells.unescapeXml(st.getRArray(i).getT());
            if (isSuperscript(rich.getFontOfFormattingRun(i))) {
                refs.append(part);
            } else {
                text.append(part);
            }
        }

        String value = text.toString().trim().isEmpty() ? null : text.toString();
        return DecodedCell.of(value, splitRefs(refs.toString()));
    }

    private static boolean isSuperscript(XSSFFont font) {
        return font != null && font.getTypeOffset() == Font.SS_SUPER;
    }

    private static List<String> splitRefs(String raw) {
        List<String> refs = new ArrayList<>();
        for (String piece : raw.split(",")) {
            String key = piece.trim();
            if (!key.isEmpty()) {
                refs.add(key);
            }
        }
        return refs;
    }
}
