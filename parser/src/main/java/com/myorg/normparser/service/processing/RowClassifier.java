package com.myorg.normparser.service.processing;

import com.myorg.normparser.model.CodeValue;
import com.myorg.normparser.model.RowKind;
import com.myorg.normparser.model.SheetRow;

import java.util.List;
import java.util.function.Predicate;

/**
 * Decides which level of the hierarchy a content row belongs to.
 *
 * <p>Rules are tried in a fixed order and the first match wins. A non-numeric code never
 * matches the code rules, so such rows fall through to the group header and leaf rules.
 */
public final class RowClassifier {

    private static final int DIVISION_DIGITS = 1;
    private static final int SUBDIVISION_DIGITS = 3;
    private static final int GROUP_CODE_DIGITS = 5;
    private static final int LEAF_INDENT = 2;

    private static final List<Rule> RULES = List.of(
            new Rule(RowKind.SKIP,
                    r -> !r.hasCaption() && !r.hasCode() && !r.isRawTermPresent()),
            new Rule(RowKind.DIVISION,
                    r -> numericCodeOfLength(r, DIVISION_DIGITS)),
            new Rule(RowKind.SUBDIVISION,
                    r -> numericCodeOfLength(r, SUBDIVISION_DIGITS)),
            new Rule(RowKind.GROUP_CODE_ITEM,
                    r -> numericCodeOfLength(r, GROUP_CODE_DIGITS) && r.getIndent() == 0),
            new Rule(RowKind.GROUP_HEADER,
                    r -> !r.hasCode() && !r.hasTermText() && r.hasCaption()),
            new Rule(RowKind.LEAF_ITEM,
                    r -> r.getIndent() >= LEAF_INDENT)
    );

    private RowClassifier() {}

    public static RowKind classify(SheetRow row) {
        for (Rule rule : RULES) {
            if (rule.matches.test(row)) {
                return rule.kind;
            }
        }
        return RowKind.UNCLASSIFIED;
    }

    private static boolean numericCodeOfLength(SheetRow row, int digits) {
        if (!row.hasCode()) return false;
        CodeValue code = row.getCode();
        return code.isAllDigits() && code.length() == digits;
    }

    private static final class Rule {
        private final RowKind kind;
        private final Predicate<SheetRow> matches;

        private Rule(RowKind kind, Predicate<SheetRow> matches) {
            this.kind = kind;
            this.matches = matches;
        }
    }
}
