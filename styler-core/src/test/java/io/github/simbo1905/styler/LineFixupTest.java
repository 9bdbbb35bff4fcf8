package io.github.simbo1905.styler;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.simbo1905.styler.Node.Meta;

import static org.assertj.core.api.Assertions.assertThat;

class LineFixupTest extends StylerTestBase {

    private static List<Integer> lines(List<Node> nodes) {
        return nodes.stream().map(Node::line).toList();
    }

    @Test
    void outOfOrderLinesAreRaisedToTheRunningFloor() {
        final var nodes = List.of(stmt("a", 1), stmt("b", 2), stmt("c", 999), stmt("d", 1000), stmt("e", 5), stmt("f", 6));
        assertThat(lines(LineFixup.fixLineNumbers(nodes, 7))).containsExactly(7, 7, 999, 1000, 1000, 1000);
    }

    @Test
    void subtreesMoveWithTheirStatement() {
        final var call = Node.call("foo", Meta.line(2), Syntax.variable("x", Meta.line(3)));
        final var fixed = LineFixup.fixLineNumbers(List.of(stmt("a", 10), call), 1);
        assertThat(fixed.get(1)).isEqualTo(Node.call("foo", Meta.line(10), Syntax.variable("x", Meta.line(11))));
    }

    @Test
    void nodesWithoutLinesAreLeftAlone() {
        final var fixed = LineFixup.fixLineNumbers(List.of(stmt("a", 4), Node.leaf("x"), stmt("b", 2)), 1);
        assertThat(lines(fixed)).containsExactly(4, null, 4);
    }

    @Test
    void fixBlocksUsesTheBlockLineAsFloor() {
        final var block = Syntax.block(Meta.line(3), List.of(stmt("a", 1), stmt("b", 8), stmt("c", 4)));
        final var fixed = LineFixup.fixBlocks(SourceTree.of(Node.seq(block), "lib/a.ex"));
        final var statements = ((Node.Call) ((Node.Sequence) fixed.root()).elements().get(0)).args();
        assertThat(lines(statements)).containsExactly(3, 8, 8);
        assertThat(fixed.file()).isEqualTo("lib/a.ex");
    }

    @Test
    void commentsMoveWithTheStatementTheyAnnotate() {
        final var moved = Node.call("foo", Meta.line(3), Syntax.variable("x", Meta.line(4)));
        final var comments = Comments.of(
                new Comment(2, "# above foo"),
                new Comment(4, "# inside foo"),
                new Comment(9, "# above b"));

        final var fixed = LineFixup.fixLineNumbers(List.of(stmt("a", 6), moved, stmt("b", 10)), 1, comments);

        assertThat(lines(fixed.nodes())).containsExactly(6, 6, 10);
        assertThat(fixed.comments().list()).containsExactly(
                new Comment(5, "# above foo"),
                new Comment(7, "# inside foo"),
                new Comment(9, "# above b"));
    }

    @Test
    void commentsOfStatementsInPlaceStayPut() {
        final var comments = Comments.of(new Comment(1, "# a"), new Comment(3, "# b"));

        final var fixed = LineFixup.fixLineNumbers(List.of(stmt("a", 2), stmt("b", 4)), 1, comments);

        assertThat(fixed.nodes()).containsExactly(stmt("a", 2), stmt("b", 4));
        assertThat(fixed.comments()).isEqualTo(comments);
    }

    @Test
    void fixBlocksCarriesCommentsIntoNestedBlocks() {
        final var inner = Syntax.block(Meta.line(5), List.of(stmt("x", 5), stmt("y", 2)));
        final var comments = Comments.of(new Comment(1, "# about y"));

        final var fixed = LineFixup.fixBlocks(new SourceTree(Node.seq(inner), comments, "lib/a.ex"));

        assertThat(fixed.comments().list()).containsExactly(new Comment(4, "# about y"));
    }
}
