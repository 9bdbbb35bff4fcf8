package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.List;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import static org.assertj.core.api.Assertions.assertThat;

/// Relocation never loses comments and only ever moves the ones it is asked to.
class CommentsPropertyTest extends StylerTestBase {

    @Provide
    Arbitrary<List<Comment>> comments() {
        final var comment = Combinators.combine(
                Arbitraries.integers().between(1, 40),
                Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(6)
        ).as((line, text) -> new Comment(line, "# " + text));
        return comment.list().ofMaxSize(20);
    }

    @Provide
    Arbitrary<LineRange> ranges() {
        return Combinators.combine(
                Arbitraries.integers().between(1, 40),
                Arbitraries.integers().between(0, 10)
        ).as((first, width) -> LineRange.of(first, first + width));
    }

    @Property
    void displaceMovesExactlyTheCommentsInRange(@ForAll("comments") List<Comment> input,
                                                @ForAll("ranges") LineRange range) {
        final var result = Comments.of(input).displace(range).list();
        assertThat(result).hasSameSizeAs(input);
        assertThat(result).containsExactlyInAnyOrderElementsOf(expected(input, c ->
                range.contains(c.line()) ? c.withLine(range.first()) : c));
    }

    @Property
    void shiftMovesExactlyTheCommentsInRange(@ForAll("comments") List<Comment> input,
                                             @ForAll("ranges") LineRange range,
                                             @ForAll @IntRange(min = 0, max = 20) int delta,
                                             @ForAll boolean up) {
        // keep every moved line at or above 1 so no clamping applies
        final int d = up ? -Math.min(delta, range.first() - 1) : delta;
        final var result = Comments.of(input).shift(range, d).list();
        assertThat(result).hasSameSizeAs(input);
        assertThat(result).containsExactlyInAnyOrderElementsOf(expected(input, c ->
                range.contains(c.line()) ? c.withLine(c.line() + d) : c));
    }

    @Property
    void relocatedCommentsStaySorted(@ForAll("comments") List<Comment> input,
                                     @ForAll("ranges") LineRange range) {
        final var lines = Comments.of(input).shift(range, 7).displace(range).list().stream()
                .map(Comment::line)
                .toList();
        assertThat(lines).isSorted();
    }

    private static List<Comment> expected(List<Comment> input, java.util.function.UnaryOperator<Comment> fn) {
        final var out = new ArrayList<Comment>(input.size());
        for (final var c : input) {
            out.add(fn.apply(c));
        }
        return out;
    }
}
