package com.myorg.normparser.service.implementation;

import com.myorg.normparser.config.WorkbookLayout;
import com.myorg.normparser.model.ExtractionResult;
import com.myorg.normparser.service.JsonDocumentWriter;
import com.myorg.normparser.service.NormativeTermsExtractor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Standalone runner: converts a workbook into result JSON without starting the web application.
 *
 * Usage: run main with args: [input-xlsx] [output-json], defaulting to os.xlsx and result.json.
 */
@Slf4j
public class NormativeTermsRunner {

    static final String DEFAULT_INPUT = "os.xlsx";
    static final String DEFAULT_OUTPUT = "result.json";

    private final NormativeTermsExtractor extractor;
    private final JsonDocumentWriter writer;

    public NormativeTermsRunner(WorkbookLayout layout) {
        this(new PoiNormativeTermsExtractor(layout), new JacksonJsonDocumentWriter());
    }

    public NormativeTermsRunner(NormativeTermsExtractor extractor, JsonDocumentWriter writer) {
        this.extractor = extractor;
        this.writer = writer;
    }

    /**
     * Parse the workbook and write the JSON document.
     *
     * @param workbookPath input XLSX path
     * @param outputPath   output JSON path
     * @throws IOException on IO errors
     */
    public ExtractionResult run(Path workbookPath, Path outputPath) throws IOException {
        File workbookFile = workbookPath.toFile();
        if (!workbookFile.exists()) {
            throw new FileNotFoundException("Workbook not found: " + workbookFile.getAbsolutePath());
        }
        log.info("Parsing workbook: {}", workbookFile.getAbsolutePath());
        ExtractionResult result = extractor.extract(workbookFile);

        writer.write(outputPath.toFile(), result.getDocument());
        if (!result.getDiagnostics().getUnclassifiedRows().isEmpty()) {
            log.warn("Rows dropped as unclassified: {}", result.getDiagnostics().getUnclassifiedRows());
        }
        log.info("Completed: {} -> {}", workbookPath, outputPath);
        return result;
    }

    /* ----------------- main ----------------- */
    public static void main(String[] args) throws IOException {
        if (args.length > 2) {
            log.error("Usage: NormativeTermsRunner [input-xlsx] [output-json]");
            System.exit(2);
        }
        Path input = Path.of(args.length >= 1 ? args[0] : DEFAULT_INPUT);
        Path output = Path.of(args.length >= 2 ? args[1] : DEFAULT_OUTPUT);
        new NormativeTermsRunner(new WorkbookLayout()).run(input, output);
        System.out.println("Данные успешно преобразованы в JSON и сохранены в файл " + output);
    }
}
