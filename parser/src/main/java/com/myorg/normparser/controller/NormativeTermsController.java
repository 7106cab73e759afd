package com.myorg.normparser.controller;

import com.myorg.normparser.config.StorageProperties;
import com.myorg.normparser.exception.ValidationException;
import com.myorg.normparser.model.ExtractionResult;
import com.myorg.normparser.model.NormativeDocument;
import com.myorg.normparser.service.JsonDocumentWriter;
import com.myorg.normparser.service.NormativeTermsExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/normative-terms")
public class NormativeTermsController {

    private static final Logger PerfLogger = LoggerFactory.getLogger("performance");

    private final StorageProperties storageProperties;
    private final NormativeTermsExtractor extractor;
    private final JsonDocumentWriter writer;

    @PostMapping(value = "/parse", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<NormativeDocument> parseWorkbook(@RequestParam("file") MultipartFile file) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty XLSX workbook.");
        }

        final String originalName = file.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("Uploaded file has no filename.");
        }
        if (!originalName.toLowerCase().endsWith(".xlsx")) {
            throw new ValidationException("Only .xlsx workbooks are accepted.");
        }

        long jobStart = System.nanoTime();

        Path outDir = outputDirectory();
        ExtractionResult result;
        try {
            Files.createDirectories(outDir);

            // Save upload
            Path workbookPath = outDir.resolve(Path.of(originalName).getFileName().toString());
            Files.copy(file.getInputStream(), workbookPath, StandardCopyOption.REPLACE_EXISTING);

            result = extractor.extract(workbookPath.toFile());
            writer.write(outDir.resolve(storageProperties.getResultFileName()).toFile(), result.getDocument());
        } catch (IOException ex) {
            log.error("Conversion failed for {}: {}", originalName, ex.getMessage(), ex);
            throw ex;
        }

        PerfLogger.info("Upload {} converted in {} ms, unclassified rows: {}",
                originalName, msSince(jobStart), result.getDiagnostics().getUnclassifiedRows());

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(result.getDocument());
    }

    @GetMapping("/results")
    public ResponseEntity<FileSystemResource> getResultJson() {
        String name = storageProperties.getResultFileName();
        File f = outputDirectory().resolve(name).toFile();

        if (!f.exists()) return ResponseEntity.notFound().build();

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + name + "\"")
                .body(new FileSystemResource(f));
    }

    // ===== Helpers =====

    private Path outputDirectory() {
        return Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
    }

    private static long msSince(long nano) {
        return Duration.ofNanos(System.nanoTime() - nano).toMillis();
    }
}
