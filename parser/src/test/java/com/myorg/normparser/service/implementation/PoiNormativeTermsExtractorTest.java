package com.myorg.normparser.service.implementation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normparser.config.WorkbookLayout;
import com.myorg.normparser.exception.WorkbookFormatException;
import com.myorg.normparser.model.ExtractionResult;
import com.myorg.normparser.model.NormativeDocument;
import com.myorg.normparser.model.NormativeTermNode;
import com.myorg.normparser.model.NoteEntry;
import com.myorg.normparser.model.RowKind;
import com.myorg.normparser.support.NormativeSheetBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("PoiNormativeTermsExtractor")
class PoiNormativeTermsExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final PoiNormativeTermsExtractor extractor = new PoiNormativeTermsExtractor(new WorkbookLayout());

    @Test
    @DisplayName("three coded rows without footnotes give a nested tree and no notes")
    void minimalSheet() throws Exception {
        Path file = NormativeSheetBuilder.standard()
                .row("Division", "1", null)
                .row("Sub", "101", null)
                .row("Item", "10101", "25 years", 0)
                .writeTo(tempDir.resolve("os.xlsx"));

        ExtractionResult result = extractor.extract(file.toFile());

        JsonNode expected = MAPPER.readTree("{\"normativeTerms\":[{"
                + "\"description\":{\"value\":\"Division\"},\"code\":\"1\",\"children\":[{"
                + "\"description\":{\"value\":\"Sub\"},\"code\":\"101\",\"children\":[{"
                + "\"description\":{\"value\":\"Item\"},\"code\":\"10101\",\"term\":{\"value\":\"25 years\"}"
                + "}]}]}],\"notes\":[]}");
        JsonNode actual = MAPPER.valueToTree(result.getDocument());
        assertThat(actual).isEqualTo(expected);
        assertThat(result.getDiagnostics().getNoteMarkerRow()).isNull();
        assertThat(result.getDiagnostics().getRowsScanned()).isEqualTo(3);
    }

    @Test
    @DisplayName("full sheet: indents, rich text refs, numeric codes and footnote section")
    void fullSheet() throws Exception {
        Path file = NormativeSheetBuilder.standard()
                .row("Здания", 1, null)
                .row("Здания производственные", 101, null)
                .blankRow()
                .row("Котлы", null, null)
                .annotatedRow("Котлы паровые", "1", null, "20", "2, 3", 2)
                .row("Котлы  водогрейные", null, "15", 2)
                .row("Смещено на один", null, "7", 1)
                .row("Сооружения", 10101, "50", 0)
                .row("Ограждения", null, "10", 2)
                .blankRow()
                .text("Примечание:")
                .text("1 Для зданий")
                .text("из кирпича.")
                .blankRow()
                .text("2  Срок  в годах")
                .text("3 Включая ремонт")
                .writeTo(tempDir.resolve("os.xlsx"));

        ExtractionResult result = extractor.extract(file.toFile());
        NormativeDocument document = result.getDocument();

        assertThat(document.getNormativeTerms()).hasSize(1);
        NormativeTermNode division = document.getNormativeTerms().get(0);
        assertThat(division.getCode().getNumber()).isEqualTo(1L);

        List<NormativeTermNode> underSub = division.getChildren().get(0).getChildren();
        assertThat(underSub).extracting(n -> n.getDescription().getValue())
                .containsExactly("Котлы", "Сооружения");

        NormativeTermNode group = underSub.get(0);
        assertThat(group.getChildren()).extracting(n -> n.getDescription().getValue())
                .containsExactly("Котлы паровые", "Котлы водогрейные");
        NormativeTermNode annotated = group.getChildren().get(0);
        assertThat(annotated.getDescription().getNotes()).containsExactly("1");
        assertThat(annotated.getTerm().getValue()).isEqualTo("20");
        assertThat(annotated.getTerm().getNotes()).containsExactly("2", "3");

        NormativeTermNode item = underSub.get(1);
        assertThat(item.getCode().getNumber()).isEqualTo(10101L);
        assertThat(item.getChildren()).extracting(n -> n.getDescription().getValue())
                .containsExactly("Ограждения");

        assertThat(document.getNotes())
                .extracting(NoteEntry::getKey, NoteEntry::getNote)
                .containsExactly(
                        tuple("1", "Для зданий из кирпича."),
                        tuple("2", "Срок в годах"),
                        tuple("3", "Включая ремонт"));

        assertThat(result.getDiagnostics().getNoteMarkerRow()).isEqualTo(19);
        assertThat(result.getDiagnostics().getUnclassifiedRows()).containsExactly(15);
        assertThat(result.getDiagnostics().count(RowKind.SKIP)).isEqualTo(2);
        assertThat(result.getDiagnostics().count(RowKind.LEAF_ITEM)).isEqualTo(3);
        assertThat(result.getDiagnostics().getNoteCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("rows inside the header are never parsed as content")
    void headerRowsAreIgnored() throws Exception {
        NormativeSheetBuilder builder = NormativeSheetBuilder.standard();
        builder.sheet().getRow(0).createCell(1).setCellValue("1");
        Path file = builder.row("Division", "2", null).writeTo(tempDir.resolve("os.xlsx"));

        NormativeDocument document = extractor.parse(file.toFile());

        assertThat(document.getNormativeTerms()).extracting(n -> n.getCode().getText()).containsExactly("2");
    }

    @Test
    @DisplayName("marker text anywhere in column 1 starts the footnote section")
    void markerIsMatchedBySubstring() throws Exception {
        byte[] bytes = NormativeSheetBuilder.standard()
                .row("Division", "1", null)
                .text("  Примечание к таблице:")
                .text("Вводный текст")
                .text("1 Первое")
                .toBytes();

        ExtractionResult result = extractor.extract(new ByteArrayInputStream(bytes), "upload.xlsx");

        assertThat(result.getDiagnostics().getNoteMarkerRow()).isEqualTo(10);
        assertThat(result.getDocument().getNotes())
                .extracting(NoteEntry::getKey, NoteEntry::getNote)
                .containsExactly(tuple("1", "Первое"));
    }

    @Test
    @DisplayName("layout settings pick the sheet, header size and marker")
    void customLayout() throws Exception {
        WorkbookLayout layout = new WorkbookLayout();
        layout.setSheetName("Terms");
        layout.setHeaderRows(0);
        layout.setNoteMarker("Notes");
        byte[] bytes = NormativeSheetBuilder.onSheet("Terms")
                .row("Division", "1", null)
                .text("Notes")
                .text("1 Only note")
                .toBytes();

        ExtractionResult result = new PoiNormativeTermsExtractor(layout)
                .extract(new ByteArrayInputStream(bytes), "custom.xlsx");

        assertThat(result.getDocument().getNormativeTerms()).hasSize(1);
        assertThat(result.getDocument().getNotes()).hasSize(1);
    }

    @Test
    @DisplayName("missing sheet fails fast")
    void missingSheet() {
        byte[] bytes = NormativeSheetBuilder.onSheet("Лист1").row("Division", "1", null).toBytes();

        assertThatThrownBy(() -> extractor.extract(new ByteArrayInputStream(bytes), "wrong.xlsx"))
                .isInstanceOf(WorkbookFormatException.class)
                .hasMessageContaining("Нормативные сроки");
    }

    @Test
    @DisplayName("missing file is reported as FileNotFoundException")
    void missingFile() {
        assertThatThrownBy(() -> extractor.extract(tempDir.resolve("absent.xlsx").toFile()))
                .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    @DisplayName("bytes that are not a zip are rejected as a workbook format problem")
    void notAWorkbook() {
        byte[] bytes = "not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(new ByteArrayInputStream(bytes), "fake.xlsx"))
                .isInstanceOf(WorkbookFormatException.class);
    }

    @Test
    @DisplayName("numeric zero in a term or note cell counts as empty")
    void zeroCellsAreEmpty() throws Exception {
        Path file = NormativeSheetBuilder.standard()
                .row("Division", "1", null)
                .row("Item", "10101", 0, 0)
                .text("Примечание:")
                .number(0)
                .text("1 Для зданий")
                .writeTo(tempDir.resolve("zero.xlsx"));

        NormativeDocument document = extractor.extract(file.toFile()).getDocument();

        NormativeTermNode item = document.getNormativeTerms().get(0).getChildren().get(0);
        assertThat(item.getTerm()).isNull();
        assertThat(document.getNotes()).containsExactly(new NoteEntry("1", "Для зданий"));
    }
}
