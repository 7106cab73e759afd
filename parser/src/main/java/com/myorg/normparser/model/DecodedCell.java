package com.myorg.normparser.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Display text of one spreadsheet cell plus the footnote keys marked as superscript inside it.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DecodedCell {

    private static final DecodedCell EMPTY = new DecodedCell(null, List.of());

    private final String text;
    private final List<String> footnoteRefs;

    private DecodedCell(String text, List<String> footnoteRefs) {
        this.text = text;
        this.footnoteRefs = footnoteRefs == null ? List.of() : List.copyOf(footnoteRefs);
    }

    public static DecodedCell empty() {
        return EMPTY;
    }

    public static DecodedCell of(String text, List<String> footnoteRefs) {
        return new DecodedCell(text, footnoteRefs);
    }

    public static DecodedCell plain(String text) {
        return new DecodedCell(text == null || text.isEmpty() ? null : text, List.of());
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Converts the decoded cell into the JSON {@code {value, notes}} object, or null when
     * there is neither text nor a footnote reference.
     */
    public AnnotatedText toAnnotatedTextOrNull() {
        if (text == null && footnoteRefs.isEmpty()) {
            return null;
        }
        return toAnnotatedText();
    }

    public AnnotatedText toAnnotatedText() {
        return AnnotatedText.builder()
                .value(text)
                .notes(footnoteRefs.isEmpty() ? null : footnoteRefs)
                .build();
    }
}
