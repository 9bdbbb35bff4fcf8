package io.github.simbo1905.styler.rules;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Syntax.Remote;
import io.github.simbo1905.styler.Trees;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// Fuses two adjacent `Enum` steps of a pipe chain into one call.
///
/// - `lhs |> Enum.filter(f) |> Enum.count()` becomes `lhs |> Enum.count(f)`
/// - `lhs |> Enum.map(f) |> Enum.join(j)` becomes `lhs |> Enum.map_join(j, f)`
/// - `lhs |> Enum.map(f) |> Enum.into(%{})` becomes `lhs |> Map.new(f)`
/// - `lhs |> Enum.map(f) |> Enum.into(c)` becomes `lhs |> Enum.into(c, f)`
///
/// Nested calls outside a pipe chain are left alone.
public final class PipeChainOptimizer implements Rule {

    private static final Logger LOG = Logger.getLogger(PipeChainOptimizer.class.getName());

    private static final List<String> ENUM = List.of("Enum");
    private static final List<String> MAP = List.of("Map");

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        if (!Syntax.isPipe(zipper.node())) {
            return Walk.cont(zipper, context);
        }
        final var outer = (Call) zipper.node();
        if (!Syntax.isPipe(outer.args().get(0))) {
            return Walk.cont(zipper, context);
        }
        final var inner = (Call) outer.args().get(0);
        final var first = Syntax.remote(inner.args().get(1));
        final var second = Syntax.remote(outer.args().get(1));
        if (first.isEmpty() || second.isEmpty()) {
            return Walk.cont(zipper, context);
        }
        return fuse(first.get(), second.get())
                .map(rhs -> {
                    LOG.fine(() -> "Fused " + first.get().function() + " and " + second.get().function());
                    return Walk.cont(zipper.replace(Syntax.pipe(outer.meta(), inner.args().get(0), rhs)), context);
                })
                .orElseGet(() -> Walk.cont(zipper, context));
    }

    private static Optional<Node> fuse(Remote first, Remote second) {
        if (first.args().size() != 1) {
            return Optional.empty();
        }
        final var fn = Trees.deleteLine(first.args().get(0));
        final var meta = second.meta();
        if (first.is(ENUM, "filter") && second.is(ENUM, "count") && second.args().isEmpty()) {
            return Optional.of(Syntax.remoteCall(ENUM, "count", meta, List.of(fn)));
        }
        if (!first.is(ENUM, "map") || second.args().size() != 1) {
            return Optional.empty();
        }
        final var arg = Trees.deleteLine(second.args().get(0));
        if (second.is(ENUM, "join")) {
            return Optional.of(Syntax.remoteCall(ENUM, "map_join", meta, List.of(arg, fn)));
        }
        if (second.is(ENUM, "into")) {
            if (isEmptyMap(arg)) {
                return Optional.of(Syntax.remoteCall(MAP, "new", meta, List.of(fn)));
            }
            return Optional.of(Syntax.remoteCall(ENUM, "into", meta, List.of(arg, fn)));
        }
        return Optional.empty();
    }

    private static boolean isEmptyMap(Node node) {
        if (Syntax.isCall(node, "%{}")) {
            return ((Call) node).args().isEmpty();
        }
        return Syntax.remote(node).map(r -> r.is(MAP, "new") && r.args().isEmpty()).orElse(false);
    }
}
