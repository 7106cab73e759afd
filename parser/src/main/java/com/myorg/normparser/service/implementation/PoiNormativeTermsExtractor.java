package com.myorg.normparser.service.implementation;

import com.myorg.normparser.config.WorkbookLayout;
import com.myorg.normparser.exception.WorkbookFormatException;
import com.myorg.normparser.metrics.PerfProbe;
import com.myorg.normparser.model.ExtractionResult;
import com.myorg.normparser.model.HierarchyResult;
import com.myorg.normparser.model.NormativeDocument;
import com.myorg.normparser.model.NoteEntry;
import com.myorg.normparser.model.ParseDiagnostics;
import com.myorg.normparser.model.SheetRow;
import com.myorg.normparser.service.CellDecoder;
import com.myorg.normparser.service.NormativeTermsExtractor;
import com.myorg.normparser.service.processing.FootnoteSectionParser;
import com.myorg.normparser.service.processing.HierarchyBuilder;
import com.myorg.normparser.service.processing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the normative-terms sheet of an XLSX workbook and converts it into a {@link NormativeDocument}.
 *
 * <p>The sheet is scanned once for the footnote marker. Rows between the header and the marker are
 * content rows and go to the {@link HierarchyBuilder}; rows after the marker go to the
 * {@link FootnoteSectionParser}. Without a marker every row after the header is content and there
 * are no notes.
 */
@Slf4j
public class PoiNormativeTermsExtractor implements NormativeTermsExtractor {

    private final WorkbookLayout layout;
    private final CellDecoder decoder;
    private final HierarchyBuilder hierarchyBuilder;
    private final FootnoteSectionParser footnoteParser;

    public PoiNormativeTermsExtractor(WorkbookLayout layout) {
        this(layout, new PoiCellDecoder(), new HierarchyBuilder(), new FootnoteSectionParser());
    }

    public PoiNormativeTermsExtractor(WorkbookLayout layout, CellDecoder decoder,
                                      HierarchyBuilder hierarchyBuilder, FootnoteSectionParser footnoteParser) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.decoder = decoder;
        this.hierarchyBuilder = hierarchyBuilder;
        this.footnoteParser = footnoteParser;
    }

    @Override
    public ExtractionResult extract(File workbookFile) throws IOException {
        Objects.requireNonNull(workbookFile, "workbookFile must not be null");
        if (!workbookFile.exists()) {
            throw new FileNotFoundException("Workbook does not exist: " + workbookFile.getAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(workbookFile.toPath())) {
            return extract(in, workbookFile.getName());
        }
    }

    @Override
    public ExtractionResult extract(InputStream workbook, String sourceName) throws IOException {
        Objects.requireNonNull(workbook, "workbook must not be null");
        PerfProbe probe = new PerfProbe(sourceName);

        try (XSSFWorkbook wb = open(workbook, sourceName)) {
            probe.mark("Workbook loaded", 0);

            Sheet sheet = wb.getSheet(layout.getSheetName());
            if (sheet == null) {
                throw new WorkbookFormatException(
                        "Sheet '" + layout.getSheetName() + "' not found in " + sourceName);
            }
            int lastRow = sheet.getLastRowNum() + 1;
            Integer markerRow = findNoteMarker(sheet, lastRow);

            int firstContentRow = layout.getHeaderRows() + 1;
            int lastContentRow = markerRow != null ? markerRow - 1 : lastRow;
            List<SheetRow> rows = readContentRows(sheet, firstContentRow, lastContentRow);
            probe.mark("Rows decoded", rows.size());

            HierarchyResult hierarchy = hierarchyBuilder.build(rows);
            probe.mark("Hierarchy built", rows.size());

            List<NoteEntry> notes = List.of();
            if (markerRow != null) {
                List<String> lines = readNoteLines(sheet, markerRow + 1, lastRow);
                notes = footnoteParser.parse(lines);
                probe.mark("Notes parsed", lines.size());
            } else {
                log.info("No '{}' section in {}, notes left empty", layout.getNoteMarker(), sourceName);
            }

            NormativeDocument document = TextNormalizer.normalize(NormativeDocument.builder()
                    .normativeTerms(hierarchy.getRoots())
                    .notes(notes)
                    .build());

            ParseDiagnostics diagnostics = ParseDiagnostics.builder()
                    .rowsScanned(hierarchy.getRowsScanned())
                    .rowsByKind(hierarchy.getRowsByKind())
                    .unclassifiedRows(hierarchy.getUnclassifiedRows())
                    .noteCount(document.getNotes().size())
                    .noteMarkerRow(markerRow)
                    .build();

            log.info("Extracted {} top-level nodes and {} notes from {} ({} rows, {} unclassified)",
                    document.getNormativeTerms().size(), diagnostics.getNoteCount(), sourceName,
                    diagnostics.getRowsScanned(), diagnostics.getUnclassifiedRows().size());
            probe.done("Extraction");
            return new ExtractionResult(document, diagnostics);
        }
    }

    private static XSSFWorkbook open(InputStream in, String sourceName) throws IOException {
        InputStream checked = FileMagic.prepareToCheckMagic(in);
        FileMagic magic = FileMagic.valueOf(checked);
        if (magic != FileMagic.OOXML) {
            throw new WorkbookFormatException("Not an XLSX workbook (" + magic + "): " + sourceName);
        }
        try {
            return new XSSFWorkbook(checked);
        } catch (IllegalArgumentException | POIXMLException e) {
            // NotOfficeXmlFileException and friends
            throw new WorkbookFormatException("Not a readable XLSX workbook: " + sourceName, e);
        }
    }

    /**
     * 1-based number of the first row whose first cell contains the marker, or null.
     */
    private Integer findNoteMarker(Sheet sheet, int lastRow) {
        for (int rowNumber = 1; rowNumber <= lastRow; rowNumber++) {
            String text = PoiCells.displayText(cell(sheet, rowNumber, 1));
            if (text != null && text.contains(layout.getNoteMarker())) {
                log.debug("Footnote marker found at row {}", rowNumber);
                return rowNumber;
            }
        }
        return null;
    }

    private List<SheetRow> readContentRows(Sheet sheet, int firstRow, int lastRow) {
        List<SheetRow> rows = new ArrayList<>();
        for (int rowNumber = firstRow; rowNumber <= lastRow; rowNumber++) {
            Cell description = cell(sheet, rowNumber, layout.getDescriptionColumn());
            Cell code = cell(sheet, rowNumber, layout.getCodeColumn());
            Cell term = cell(sheet, rowNumber, layout.getTermColumn());

            rows.add(SheetRow.builder()
                    .rowNumber(rowNumber)
                    .caption(decoder.decode(description))
                    .code(PoiCells.codeValue(code))
                    .term(decoder.decode(term))
                    .rawTermPresent(PoiCells.hasValue(term))
                    .indent(PoiCells.indent(description))
                    .build());
        }
        return rows;
    }

    private List<String> readNoteLines(Sheet sheet, int firstRow, int lastRow) {
        List<String> lines = new ArrayList<>();
        for (int rowNumber = firstRow; rowNumber <= lastRow; rowNumber++) {
            Cell cell = cell(sheet, rowNumber, 1);
            String text = PoiCells.displayText(cell);
            if (PoiCells.hasValue(cell) && text != null) {
                lines.add(text);
            }
        }
        return lines;
    }

    private static Cell cell(Sheet sheet, int rowNumber, int column) {
        Row row = sheet.getRow(rowNumber - 1);
        return row == null ? null : row.getCell(column - 1);
    }
}
