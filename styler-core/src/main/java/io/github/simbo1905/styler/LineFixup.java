package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node.Call;

/// Restores non-decreasing line metadata after edits have reordered statements.
///
/// The printer places blank lines from line deltas, so a statement that originally sat on line
/// 999 and now follows one from line 5 would otherwise print with odd spacing. Comments travel
/// with the statement they belong to.
public final class LineFixup {

    private static final Logger LOG = Logger.getLogger(LineFixup.class.getName());

    /// Repaired statements and the comments after moving them alongside.
    public record Fixed(List<Node> nodes, Comments comments) {
        public Fixed {
            nodes = List.copyOf(nodes);
            Objects.requireNonNull(comments, "comments must not be null");
        }
    }

    private LineFixup() {
    }

    /// Walks `nodes` with a running floor starting at `floor`.
    ///
    /// A node whose line is below the floor is moved onto the floor, its whole subtree shifted by
    /// the same amount. A node at or above the floor raises the floor to its line. Nodes without a
    /// line are left alone.
    public static List<Node> fixLineNumbers(List<Node> nodes, int floor) {
        return fixLineNumbers(nodes, floor, Comments.empty()).nodes();
    }

    /// As [#fixLineNumbers(List, int)], also moving each node's comments by the node's delta.
    ///
    /// A node owns the comments inside its line span plus the comment block directly above it, as
    /// [Comments#forLines(int, int)] defines. Nodes claim comments in order and a claimed comment
    /// is never moved twice.
    public static Fixed fixLineNumbers(List<Node> nodes, int floor, Comments comments) {
        Objects.requireNonNull(comments, "comments must not be null");
        final var fixed = new ArrayList<Node>(nodes.size());
        final var moved = new ArrayList<Comment>();
        var rest = comments;
        int current = floor;
        for (final var node : nodes) {
            final var line = node.line();
            if (line == null) {
                fixed.add(node);
                continue;
            }
            final var split = rest.forLines(Trees.minLine(node), Trees.maxLine(node));
            rest = split.rest();
            if (line < current) {
                final int delta = current - line;
                LOG.finer(() -> "Moving line " + line + " and " + split.matched().size() + " comment(s) by " + delta);
                fixed.add(Trees.shiftLine(node, delta));
                split.matched().forEach(comment -> moved.add(comment.withLine(comment.line() + delta)));
            } else {
                current = line;
                fixed.add(node);
                moved.addAll(split.matched());
            }
        }
        return new Fixed(fixed, rest.plus(moved));
    }

    /// Applies [#fixLineNumbers(List, int, Comments)] to the statements of every block in the
    /// tree, using the block's own line as the floor.
    public static SourceTree fixBlocks(SourceTree source) {
        Objects.requireNonNull(source, "source must not be null");
        final var fold = Zipper.zip(source.root()).traverse(source.comments(), (z, comments) -> {
            if (z.node() instanceof Call block && Syntax.isBlock(block)
                    && Syntax.literalValue(block).isEmpty() && block.args().size() > 1) {
                final var floor = block.line() == null ? 1 : block.line();
                final var result = fixLineNumbers(block.args(), floor, comments);
                final var next = result.nodes().equals(block.args()) ? z : z.replace(block.withArgs(result.nodes()));
                return new Zipper.Fold<>(next, result.comments());
            }
            return new Zipper.Fold<>(z, comments);
        });
        return new SourceTree(fold.zipper().node(), fold.acc(), source.file());
    }
}
