package com.myorg.normparser.service.processing;

import com.myorg.normparser.model.AnnotatedText;
import com.myorg.normparser.model.CodeValue;
import com.myorg.normparser.model.NormativeDocument;
import com.myorg.normparser.model.NormativeTermNode;
import com.myorg.normparser.model.NoteEntry;
import com.myorg.normparser.util.TextCleaner;

import java.util.ArrayList;
import java.util.List;

/**
 * Final cleanup pass over an assembled document.
 *
 * <p>Returns a new document where every string has its whitespace collapsed and trimmed,
 * and every empty list is replaced by null so it is left out of the JSON. The top-level
 * {@code normativeTerms} and {@code notes} lists are always kept. Applying it twice gives
 * the same result as applying it once.
 */
public final class TextNormalizer {

    private TextNormalizer() {}

    public static NormativeDocument normalize(NormativeDocument document) {
        List<NormativeTermNode> terms = new ArrayList<>();
        for (NormativeTermNode node : document.getNormativeTerms()) {
            terms.add(normalize(node));
        }
        List<NoteEntry> notes = new ArrayList<>();
        for (NoteEntry note : document.getNotes()) {
            notes.add(new NoteEntry(TextCleaner.clean(note.getKey()), TextCleaner.clean(note.getNote())));
        }
        return NormativeDocument.builder()
                .normativeTerms(List.copyOf(terms))
                .notes(List.copyOf(notes))
                .build();
    }

    static NormativeTermNode normalize(NormativeTermNode node) {
        List<NormativeTermNode> children = null;
        if (node.getChildren() != null && !node.getChildren().isEmpty()) {
            List<NormativeTermNode> cleaned = new ArrayList<>(node.getChildren().size());
            for (NormativeTermNode child : node.getChildren()) {
                cleaned.add(normalize(child));
            }
            children = List.copyOf(cleaned);
        }
        AnnotatedText description = normalize(node.getDescription());
        return node.toBuilder()
                .description(description == null ? new AnnotatedText() : description)
                .code(normalize(node.getCode()))
                .term(normalize(node.getTerm()))
                .children(children)
                .build();
    }

    static AnnotatedText normalize(AnnotatedText text) {
        if (text == null) return null;
        return AnnotatedText.builder()
                .value(TextCleaner.clean(text.getValue()))
                .notes(normalize(text.getNotes()))
                .build();
    }

    private static CodeValue normalize(CodeValue code) {
        if (code == null || !code.isText()) return code;
        return CodeValue.ofText(TextCleaner.clean(code.getText()));
    }

    private static List<String> normalize(List<String> values) {
        if (values == null || values.isEmpty()) return null;
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) {
            out.add(TextCleaner.clean(v));
        }
        return List.copyOf(out);
    }
}
