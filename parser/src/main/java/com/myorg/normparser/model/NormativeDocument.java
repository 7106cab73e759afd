package com.myorg.normparser.model;

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
 * Root of the produced JSON. Both lists are always written, even when empty.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"normativeTerms", "notes"})
public class NormativeDocument {

    @Builder.Default
    @JsonProperty("normativeTerms")
    private List<NormativeTermNode> normativeTerms = List.of();

    @Builder.Default
    @JsonProperty("notes")
    private List<NoteEntry> notes = List.of();
}
