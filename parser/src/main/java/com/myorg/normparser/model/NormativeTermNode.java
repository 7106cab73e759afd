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

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the regulation hierarchy: division, subdivision, group, or item.
 *
 * <p>{@code children} is null for nodes that do not admit children. During the row pass it is
 * an open mutable list; the post-pass transforms replace it with an unmodifiable copy or
 * drop it when empty.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"description", "code", "term", "children"})
public class NormativeTermNode {

    @Builder.Default
    @JsonProperty("description")
    private AnnotatedText description = new AnnotatedText();

    @JsonProperty("code")
    private CodeValue code;

    @JsonProperty("term")
    private AnnotatedText term;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("children")
    private List<NormativeTermNode> children;

    /**
     * Makes this node a parent. No-op when children are already open.
     */
    public NormativeTermNode openChildren() {
        if (children == null) {
            children = new ArrayList<>();
        }
        return this;
    }

    public void addChild(NormativeTermNode child) {
        openChildren();
        children.add(child);
    }
}
