package com.myorg.normparser.service.implementation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.myorg.normparser.model.NormativeDocument;
import com.myorg.normparser.service.JsonDocumentWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes the document as indented UTF-8 JSON. Cyrillic and other non-ASCII text is written as is.
 */
@Slf4j
public class JacksonJsonDocumentWriter implements JsonDocumentWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectWriter OBJECT_WRITER = MAPPER.writer(new DefaultPrettyPrinter()
            .withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE));

    @Override
    public void write(File outputFile, NormativeDocument document) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }

        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories: {}", parent.getAbsolutePath());
        }

        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
            OBJECT_WRITER.writeValue(writer, document);
        }
        log.info("JSON written: {} top-level nodes, {} notes -> {}",
                document.getNormativeTerms().size(), document.getNotes().size(), outputFile.getAbsolutePath());
    }

    @Override
    public String writeAsString(NormativeDocument document) throws IOException {
        return OBJECT_WRITER.writeValueAsString(document);
    }
}
