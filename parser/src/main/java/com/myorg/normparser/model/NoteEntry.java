package com.myorg.normparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Footnote from the trailing "Примечание" section.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"key", "note"})
public class NoteEntry {

    // leading digit run of the defining line, kept as written
    @JsonProperty("key")
    private String key;

    @JsonProperty("note")
    private String note;

    /**
     * Appends a continuation line, separated by one space.
     */
    public void append(String continuation) {
        note = note + " " + continuation;
    }
}
