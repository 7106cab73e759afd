package com.myorg.normparser.service;

import com.myorg.normparser.model.ExtractionResult;
import com.myorg.normparser.model.NormativeDocument;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public interface NormativeTermsExtractor {

    ExtractionResult extract(InputStream workbook, String sourceName) throws IOException;

    ExtractionResult extract(File workbookFile) throws IOException;

    default NormativeDocument parse(File workbookFile) throws IOException {
        return extract(workbookFile).getDocument();
    }
}
