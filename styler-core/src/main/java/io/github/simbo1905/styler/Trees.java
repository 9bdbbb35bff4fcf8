package io.github.simbo1905.styler;

import java.util.List;
import java.util.function.UnaryOperator;

import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Meta;

/// Whole-subtree metadata edits and block helpers shared by rules.
public final class Trees {

    private Trees() {
    }

    /// Applies `fn` to the metadata of every call in `node`'s subtree.
    public static Node updateAllMeta(Node node, UnaryOperator<Meta> fn) {
        return Zipper.zip(node).traverse(z -> z.node() instanceof Call call
                ? z.replace(call.withMeta(fn.apply(call.meta())))
                : z).node();
    }

    /// Moves every line in the subtree to `line`.
    public static Node setLine(Node node, int line) {
        return updateAllMeta(node, meta -> meta.hasLine() ? meta.withLine(line) : meta);
    }

    /// Adds `delta` to every line in the subtree.
    public static Node shiftLine(Node node, int delta) {
        if (delta == 0) {
            return node;
        }
        return updateAllMeta(node, meta -> meta.hasLine() ? meta.withLine(meta.line() + delta) : meta);
    }

    /// Drops every line in the subtree, so the printer keeps the node on its neighbour's line.
    public static Node deleteLine(Node node) {
        return updateAllMeta(node, meta -> meta.hasLine() ? meta.withLine(null) : meta);
    }

    /// Strips all metadata, for comparing trees regardless of position.
    public static Node withoutMeta(Node node) {
        return updateAllMeta(node, meta -> Meta.NONE);
    }

    /// {@return the highest line anywhere in the subtree, or 0 when there is none}
    public static int maxLine(Node node) {
        final var fold = Zipper.zip(node).traverse(0, (z, max) -> {
            final var line = z.node().line();
            return new Zipper.Fold<>(z, line != null && line > max ? line : max);
        });
        return fold.acc();
    }

    /// {@return the lowest line anywhere in the subtree, or null when there is none}
    public static Integer minLine(Node node) {
        final var fold = Zipper.zip(node).traverse((Integer) null, (z, min) -> {
            final var line = z.node().line();
            return new Zipper.Fold<>(z, line != null && (min == null || line < min) ? line : min);
        });
        return fold.acc();
    }

    /// {@return the first line of `node`, falling back to the lowest line inside it}
    public static Integer firstLine(Node node) {
        final var line = node.line();
        return line != null ? line : minLine(node);
    }

    /// Moves to the nearest position where statements can be inserted as siblings.
    ///
    /// That is the focus itself when its parent is a block, else the nearest ancestor that sits in
    /// a block. A focus that is the body of a `do`, a stab clause or the root is wrapped in a new
    /// block first.
    public static Zipper findNearestBlock(Zipper zipper) {
        var z = zipper;
        while (true) {
            final var up = z.up();
            if (up.isEmpty()) {
                return wrapInBlock(z);
            }
            final var parent = up.get().node();
            if (Syntax.isBlock(parent) && Syntax.literalValue(parent).isEmpty()) {
                return z;
            }
            if (parent instanceof Node.Pair || Syntax.isCall(parent, "->")) {
                return wrapInBlock(z);
            }
            z = up.get();
        }
    }

    /// Wraps the focus in a block and moves onto it, now the block's only statement.
    ///
    /// The block takes the lowest line in the focus, so a statement later inserted before the
    /// focus is not pushed below code it came from.
    public static Zipper wrapInBlock(Zipper zipper) {
        final var line = minLine(zipper.node());
        final var meta = line == null ? Meta.NONE : Meta.line(line);
        return zipper.replace(Syntax.block(meta, List.of(zipper.node()))).down().orElseThrow();
    }
}
