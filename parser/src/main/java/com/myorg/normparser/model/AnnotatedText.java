package com.myorg.normparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Text value with the keys of the footnotes it references.
 * Used for both the {@code description} and the {@code term} of a node.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "notes"})
public class AnnotatedText {

    @JsonProperty("value")
    private String value;

    // footnote keys, absent when the cell carries no superscript references
    @JsonProperty("notes")
    private List<String> notes;

    public static AnnotatedText ofValue(String value) {
        return AnnotatedText.builder().value(value).build();
    }
}
