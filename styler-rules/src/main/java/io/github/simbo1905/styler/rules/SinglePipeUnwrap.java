package io.github.simbo1905.styler.rules;

import java.util.ArrayList;
import java.util.logging.Logger;

import io.github.simbo1905.styler.LineRange;
import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Trees;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// Rewrites a pipe chain of a single step, `a |> f(b)`, as the plain call `f(a, b)`.
///
/// The call is printed on one line, so comments that sat inside the collapsed lines are moved up
/// onto its first line.
public final class SinglePipeUnwrap implements Rule {

    private static final Logger LOG = Logger.getLogger(SinglePipeUnwrap.class.getName());

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        if (!Syntax.isPipe(zipper.node()) || PipeChainStart.isInnerPipe(zipper)) {
            return Walk.cont(zipper, context);
        }
        final var pipe = (Call) zipper.node();
        final var lhs = pipe.args().get(0);
        if (Syntax.isPipe(lhs) || !(pipe.args().get(1) instanceof Call rhs) || Syntax.literalValue(rhs).isPresent()) {
            return Walk.cont(zipper, context);
        }

        final var first = Trees.minLine(pipe);
        var comments = context.comments();
        Node flatLhs = lhs;
        if (first != null) {
            final int last = Trees.maxLine(pipe);
            if (last > first) {
                comments = comments.displace(LineRange.of(first, last));
            }
            flatLhs = Trees.setLine(lhs, first);
        }
        final var args = new ArrayList<Node>(rhs.args().size() + 1);
        args.add(flatLhs);
        args.addAll(rhs.args());
        final var meta = first == null ? rhs.meta() : rhs.meta().withLine(first);
        LOG.fine(() -> "Unwrapping single pipe on line " + first);
        return Walk.cont(zipper.replace(new Call(rhs.head(), meta, args)), context.withComments(comments));
    }
}
