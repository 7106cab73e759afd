package com.myorg.normparser.service.processing;

import com.myorg.normparser.model.NormativeTermNode;

import java.util.List;

/**
 * Most recently created node at each structural rank, local to one build.
 */
final class BuilderState {

    private final List<NormativeTermNode> roots;

    private NormativeTermNode level1;
    private NormativeTermNode level2;
    private NormativeTermNode level3;
    private NormativeTermNode group;

    BuilderState(List<NormativeTermNode> roots) {
        this.roots = roots;
    }

    void division(NormativeTermNode node) {
        level1 = node.openChildren();
        level2 = null;
        level3 = null;
        group = null;
        roots.add(node);
    }

    void subdivision(NormativeTermNode node) {
        attach(level1, node);
        level2 = node.openChildren();
        level3 = null;
        group = null;
    }

    void groupCodeItem(NormativeTermNode node) {
        attach(firstNonNull(level2, level1), node);
        level3 = node;
        group = null;
    }

    void groupHeader(NormativeTermNode node) {
        attach(firstNonNull(level2, level1), node);
        group = node.openChildren();
    }

    void leafItem(NormativeTermNode node) {
        // level 3 items become parents only once a leaf lands under them
        attach(firstNonNull(group, level3, level2, level1), node);
    }

    NormativeTermNode level1() {
        return level1;
    }

    NormativeTermNode level2() {
        return level2;
    }

    NormativeTermNode level3() {
        return level3;
    }

    NormativeTermNode group() {
        return group;
    }

    private void attach(NormativeTermNode parent, NormativeTermNode child) {
        if (parent == null) {
            roots.add(child);
        } else {
            parent.addChild(child);
        }
    }

    private static NormativeTermNode firstNonNull(NormativeTermNode... candidates) {
        for (NormativeTermNode candidate : candidates) {
            if (candidate != null) return candidate;
        }
        return null;
    }
}
