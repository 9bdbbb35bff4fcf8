package io.github.simbo1905.styler.rules;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Pair;
import io.github.simbo1905.styler.Node.Sequence;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// One-to-one rewrites that only need the focused node.
///
/// - `Enum.reverse(a) ++ b` becomes `Enum.reverse(a, b)`
/// - a `case` over `true`/`false` (or `true`/`_`) becomes an `if`, dropping an `else` that is just `nil`
/// - integer literals of five or more digits are re-delimited with `_` every three digits
public final class SingleNodeRewrites implements Rule {

    private static final Logger LOG = Logger.getLogger(SingleNodeRewrites.class.getName());

    private static final List<String> ENUM = List.of("Enum");

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        final var node = zipper.node();
        final var rewritten = reverseConcat(node)
                .or(() -> trivialCase(node))
                .or(() -> largeNumber(node));
        return Walk.cont(rewritten.map(zipper::replace).orElse(zipper), context);
    }

    private static Optional<Node> reverseConcat(Node node) {
        if (!Syntax.isCall(node, "++")) {
            return Optional.empty();
        }
        final var concat = (Call) node;
        if (concat.args().size() != 2) {
            return Optional.empty();
        }
        final var reverse = concat.args().get(0);
        return Syntax.remote(reverse)
                .filter(r -> r.is(ENUM, "reverse") && r.args().size() == 1)
                .map(r -> ((Call) reverse).withArgs(List.of(r.args().get(0), concat.args().get(1))));
    }

    private static Optional<Node> trivialCase(Node node) {
        if (!Syntax.isCall(node, "case")) {
            return Optional.empty();
        }
        final var caseCall = (Call) node;
        if (caseCall.args().size() != 2) {
            return Optional.empty();
        }
        final var clauses = Syntax.keywordValue(caseCall.args().get(1), Syntax.DO)
                .filter(Sequence.class::isInstance)
                .map(Sequence.class::cast)
                .filter(s -> s.elements().size() == 2);
        if (clauses.isEmpty()) {
            return Optional.empty();
        }
        final var a = clause(clauses.get().elements().get(0));
        final var b = clause(clauses.get().elements().get(1));
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        final var head = caseCall.args().get(0);
        final var aPattern = a.get().left();
        final var bPattern = b.get().left();
        final Pair ifBranches;
        if (isBoolean(aPattern, true) && (isBoolean(bPattern, false) || isWildcard(bPattern))) {
            ifBranches = new Pair(a.get().right(), b.get().right());
        } else if (isBoolean(aPattern, false) && isBoolean(bPattern, true)) {
            ifBranches = new Pair(b.get().right(), a.get().right());
        } else {
            return Optional.empty();
        }
        LOG.fine(() -> "Rewriting trivial case on line " + caseCall.line() + " as if");
        return Optional.of(ifNode(caseCall, head, ifBranches.left(), ifBranches.right()));
    }

    /// {@return pattern and body of a single-pattern `->` clause}
    private static Optional<Pair> clause(Node node) {
        if (!Syntax.isCall(node, "->")) {
            return Optional.empty();
        }
        final var args = ((Call) node).args();
        if (args.size() != 2 || !(args.get(0) instanceof Sequence patterns) || patterns.elements().size() != 1) {
            return Optional.empty();
        }
        return Optional.of(new Pair(patterns.elements().get(0), args.get(1)));
    }

    private static Node ifNode(Call caseCall, Node head, Node doBody, Node elseBody) {
        final Sequence branches;
        if (Syntax.literalValue(elseBody).isPresent() && Syntax.isAtom(elseBody, "nil")) {
            branches = Syntax.doBlock(doBody);
        } else {
            branches = new Sequence(List.of(
                    new Pair(Syntax.atom(Syntax.DO), doBody),
                    new Pair(Syntax.atom(Syntax.ELSE), elseBody)));
        }
        return Syntax.local("if", caseCall.meta(), List.of(head, branches));
    }

    private static boolean isBoolean(Node node, boolean value) {
        return Syntax.literalValue(node).map(v -> v.equals(value)).orElse(false);
    }

    private static boolean isWildcard(Node node) {
        return Syntax.isCall(node, "_") && ((Call) node).args().isEmpty();
    }

    private static Optional<Node> largeNumber(Node node) {
        final var value = Syntax.literalValue(node);
        if (value.isEmpty() || !(value.get() instanceof Number number) || number.doubleValue() < 10_000) {
            return Optional.empty();
        }
        final var call = (Call) node;
        if (!(call.meta().get(Syntax.TOKEN) instanceof String token)) {
            return Optional.empty();
        }
        final var delimited = delimitToken(token);
        if (delimited.equals(token)) {
            return Optional.empty();
        }
        return Optional.of(call.withMeta(call.meta().with(Syntax.TOKEN, delimited)));
    }

    /// Re-delimits a decimal number token: `100000` and `100_000_0` both become `100_000`-style
    /// groups of three. Hex, binary and octal tokens are returned unchanged.
    static String delimitToken(String token) {
        if (token.startsWith("0x") || token.startsWith("0b") || token.startsWith("0o")) {
            return token;
        }
        final int dot = token.indexOf('.');
        if (dot >= 0) {
            return delimit(token.substring(0, dot)) + token.substring(dot);
        }
        return delimit(token);
    }

    private static String delimit(String digits) {
        final var plain = digits.replace("_", "");
        final var out = new StringBuilder(plain.length() + plain.length() / 3);
        for (int i = 0; i < plain.length(); i++) {
            if (i > 0 && (plain.length() - i) % 3 == 0) {
                out.append('_');
            }
            out.append(plain.charAt(i));
        }
        return out.toString();
    }
}
