package io.github.simbo1905.styler.rules;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Leaf;
import io.github.simbo1905.styler.Node.Pair;
import io.github.simbo1905.styler.Node.Sequence;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// Turns `unless` into `if` where that reads no worse.
///
/// - `unless c do a else b end` becomes `if c do b else a end`
/// - `unless x == y do a end` becomes `if x != y do a end`, likewise for `===`, `>` and `>=` and
///   their inverses
public final class UnlessRewrite implements Rule {

    private static final Logger LOG = Logger.getLogger(UnlessRewrite.class.getName());

    private static final Map<String, String> INVERSE = Map.of(
            "==", "!=", "!=", "==",
            "===", "!==", "!==", "===",
            ">", "<=", "<=", ">",
            ">=", "<", "<", ">=");

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        final var node = zipper.node();
        if (!Syntax.isCall(node, "unless")) {
            return Walk.cont(zipper, context);
        }
        final var unless = (Call) node;
        if (unless.args().size() != 2 || !(unless.args().get(1) instanceof Sequence branches)) {
            return Walk.cont(zipper, context);
        }
        final var condition = unless.args().get(0);
        final var elements = branches.elements();

        if (elements.size() == 2
                && elements.get(0) instanceof Pair doBranch && Syntax.isAtom(doBranch.left(), Syntax.DO)
                && elements.get(1) instanceof Pair elseBranch && Syntax.isAtom(elseBranch.left(), Syntax.ELSE)) {
            final var swapped = new Sequence(List.of(
                    new Pair(doBranch.left(), elseBranch.right()),
                    new Pair(elseBranch.left(), doBranch.right())));
            LOG.fine(() -> "Swapping unless/else on line " + unless.line());
            return Walk.cont(zipper.replace(asIf(unless, condition, swapped)), context);
        }

        if (elements.size() == 1 && condition instanceof Call comparison
                && comparison.head() instanceof Leaf op && op.value() instanceof String operator
                && INVERSE.containsKey(operator) && comparison.args().size() == 2) {
            final var inverted = new Call(new Leaf(INVERSE.get(operator)), comparison.meta(), comparison.args());
            LOG.fine(() -> "Inverting unless " + operator + " on line " + unless.line());
            return Walk.cont(zipper.replace(asIf(unless, inverted, branches)), context);
        }
        return Walk.cont(zipper, context);
    }

    private static Node asIf(Call unless, Node condition, Sequence branches) {
        return Syntax.local("if", unless.meta(), List.of(condition, branches));
    }
}
