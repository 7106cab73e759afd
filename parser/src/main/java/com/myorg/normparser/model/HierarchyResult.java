package com.myorg.normparser.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Forest produced from the content rows, with the classification counts behind it.
 */
@Getter
@Builder
@ToString
public class HierarchyResult {

    private final List<NormativeTermNode> roots;

    private final int rowsScanned;

    private final Map<RowKind, Integer> rowsByKind;

    private final List<Integer> unclassifiedRows;
}
