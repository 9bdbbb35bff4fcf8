package io.github.simbo1905.styler.rules;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Leaf;
import io.github.simbo1905.styler.Node.Meta;
import io.github.simbo1905.styler.Node.Sequence;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Trees;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// Makes every pipe chain start with a plain value.
///
/// - `foo(a, b) |> bar()` becomes `a |> foo(b) |> bar()`
/// - `case x do ... end |> bar()` becomes `case_result = case x do ... end` followed by
///   `case_result |> bar()`, the assignment inserted before the enclosing statement
///
/// Only the outermost pipe of a chain is examined.
public final class PipeChainStart implements Rule {

    private static final Logger LOG = Logger.getLogger(PipeChainStart.class.getName());

    static final Set<String> BLOCKS = Set.of("case", "if", "with", "cond", "for", "unless");

    private static final Set<String> VALUE_STARTS = Set.of(
            // value constructors
            "%", "%{}", "..", "<<>>", "@", "{}", "&", "fn",
            // simple operators
            "++", "--", "&&", "||",
            // arithmetic and comparison
            "-", "*", "+", "/", ">", "<", "<=", ">=", "==",
            // binary operators
            "<>", "<-", "|||", "&&&", "<<<", ">>>", "<<~", "~>>", "<~", "~>", "<~>", "<|>", "^^^", "~~~",
            // parser wrappers, quoting and ecto queries
            Syntax.BLOCK, Syntax.ALIASES, "unquote", "from");

    private static final Pattern SIGIL = Pattern.compile("sigil_[a-zA-Z]");

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        if (!Syntax.isPipe(zipper.node()) || isInnerPipe(zipper)) {
            return Walk.cont(zipper, context);
        }
        var start = zipper;
        int levels = 0;
        while (Syntax.isPipe(start.children().get(0))) {
            start = start.down().orElseThrow();
            levels++;
        }
        final var lhs = start.children().get(0);
        if (validStart(lhs)) {
            return Walk.cont(zipper, context);
        }

        final var name = Syntax.callName(lhs).orElse("");
        if (BLOCKS.contains(name)) {
            final var variable = Syntax.variable(name + "_result", Meta.NONE);
            final var line = Trees.firstLine(lhs);
            final var assignment = Syntax.local("=", line == null ? Meta.NONE : Meta.line(line), List.of(variable, lhs));
            LOG.fine(() -> "Extracting " + name + " block from the start of a pipe chain");
            // the statement is located while the block is still in it, so a new wrapper starts on its line
            final var statement = Trees.findNearestBlock(zipper);
            final var rewritten = statement.find(node -> node == lhs).orElseThrow().replace(variable);
            return Walk.cont(climbTo(rewritten, statement.depth()).insertLeft(assignment).left().orElseThrow(), context);
        }

        final var call = (Call) lhs;
        final var args = call.args();
        final var pipe = Syntax.pipe(call.meta(), args.get(0), call.withArgs(args.subList(1, args.size())));
        LOG.fine(() -> "Moving the first argument of the chain's first call to the start of the chain");
        return Walk.cont(climb(start.down().orElseThrow().replace(pipe).up().orElseThrow(), levels), context);
    }

    /// {@return true when the focus is the left hand side of an enclosing pipe}
    static boolean isInnerPipe(Zipper zipper) {
        return zipper.up().map(parent -> Syntax.isPipe(parent.node())).orElse(false)
                && zipper.leftSiblings().isEmpty();
    }

    private static Zipper climbTo(Zipper zipper, int depth) {
        var z = zipper;
        while (z.depth() > depth) {
            z = z.up().orElseThrow();
        }
        return z;
    }

    private static Zipper climb(Zipper zipper, int levels) {
        var z = zipper;
        for (int i = 0; i < levels; i++) {
            z = z.up().orElseThrow();
        }
        return z;
    }

    /// {@return true when `node` may start a pipe chain as it stands}
    static boolean validStart(Node node) {
        if (!(node instanceof Call call)) {
            return true;
        }
        final var name = Syntax.callName(call);
        if (name.isPresent()) {
            if (VALUE_STARTS.contains(name.get()) || call.args().isEmpty()) {
                return true;
            }
            return SIGIL.matcher(name.get()).matches();
        }
        final var remote = Syntax.remote(call);
        if (remote.isPresent()) {
            final var target = remote.get();
            if (target.module() instanceof Leaf module && "Access".equals(module.value()) && target.function().equals("get")) {
                return true;
            }
            if (isCharlist(target)) {
                return true;
            }
            return target.args().isEmpty();
        }
        if (call.head() instanceof Call dot && Syntax.isCall(dot, Syntax.DOT)) {
            // anonymous function call, `fun.(a)`
            return call.args().isEmpty();
        }
        return true;
    }

    /// Interpolated charlists compile to `List.to_charlist([...])`, which reads as a value.
    private static boolean isCharlist(Syntax.Remote target) {
        return target.module() instanceof Leaf module && "List".equals(module.value())
                && target.function().equals("to_charlist")
                && target.args().size() == 1
                && target.args().get(0) instanceof Sequence parts && !parts.elements().isEmpty();
    }
}
