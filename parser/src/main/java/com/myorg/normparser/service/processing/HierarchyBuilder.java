package com.myorg.normparser.service.processing;

import com.myorg.normparser.model.HierarchyResult;
import com.myorg.normparser.model.NormativeTermNode;
import com.myorg.normparser.model.ParseDiagnostics;
import com.myorg.normparser.model.RowKind;
import com.myorg.normparser.model.SheetRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the regulation tree from flat content rows.
 *
 * <p>Rows carry no parent pointers. Each row is classified by {@link RowClassifier} and
 * attached under the last node seen at the matching rank:
 * <ul>
 *   <li>divisions go to the root and reset every lower rank;</li>
 *   <li>subdivisions go under the current division;</li>
 *   <li>group-code items and group headers go under the current subdivision, else division;</li>
 *   <li>leaf items go under the current group header, else group-code item, else upwards.</li>
 * </ul>
 * Empty child lists are removed once the pass is complete.
 */
@Slf4j
public class HierarchyBuilder {

    public HierarchyResult build(List<SheetRow> rows) {
        List<NormativeTermNode> roots = new ArrayList<>();
        BuilderState state = new BuilderState(roots);
        Map<RowKind, Integer> counts = ParseDiagnostics.emptyCounts();
        List<Integer> unclassified = new ArrayList<>();

        for (SheetRow row : rows) {
            RowKind kind = RowClassifier.classify(row);
            counts.merge(kind, 1, Integer::sum);

            switch (kind) {
                case SKIP:
                    log.debug("Row {} is empty, skipped", row.getRowNumber());
                    break;
                case DIVISION:
                    state.division(toNode(row));
                    break;
                case SUBDIVISION:
                    state.subdivision(toNode(row));
                    break;
                case GROUP_CODE_ITEM:
                    state.groupCodeItem(toNode(row));
                    break;
                case GROUP_HEADER:
                    state.groupHeader(toNode(row));
                    break;
                case LEAF_ITEM:
                    state.leafItem(toNode(row));
                    break;
                default:
                    unclassified.add(row.getRowNumber());
                    log.warn("Row {} matches no level (code={}, indent={}, caption='{}'), dropped",
                            row.getRowNumber(), row.getCode(), row.getIndent(), row.getCaption().getText());
            }
        }

        List<NormativeTermNode> pruned = pruneEmptyChildren(roots);
        log.debug("Built {} root nodes from {} rows, {} unclassified", pruned.size(), rows.size(), unclassified.size());

        return HierarchyResult.builder()
                .roots(pruned)
                .rowsScanned(rows.size())
                .rowsByKind(counts)
                .unclassifiedRows(unclassified)
                .build();
    }

    private static NormativeTermNode toNode(SheetRow row) {
        return NormativeTermNode.builder()
                .description(row.getCaption().toAnnotatedText())
                .code(row.getCode())
                .term(row.getTerm().toAnnotatedTextOrNull())
                .build();
    }

    /**
     * Copies the forest, children first, dropping every {@code children} list that ends up empty.
     */
    static List<NormativeTermNode> pruneEmptyChildren(List<NormativeTermNode> nodes) {
        List<NormativeTermNode> out = new ArrayList<>(nodes.size());
        for (NormativeTermNode node : nodes) {
            out.add(prune(node));
        }
        return List.copyOf(out);
    }

    private static NormativeTermNode prune(NormativeTermNode node) {
        if (node.getChildren() == null) {
            return node.toBuilder().build();
        }
        List<NormativeTermNode> children = pruneEmptyChildren(node.getChildren());
        return node.toBuilder()
                .children(children.isEmpty() ? null : children)
                .build();
    }
}
