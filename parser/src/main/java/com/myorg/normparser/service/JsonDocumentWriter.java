package com.myorg.normparser.service;

import com.myorg.normparser.model.NormativeDocument;

import java.io.File;
import java.io.IOException;

public interface JsonDocumentWriter {

    void write(File outputFile, NormativeDocument document) throws IOException;

    String writeAsString(NormativeDocument document) throws IOException;
}
