package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Immutable, line ordered store of the comments of one file.
///
/// Comments are keyed only by line, so whenever a rule folds several lines of code into one, or
/// moves code, it relocates the affected comments through [#displace(LineRange)] or
/// [#shift(LineRange, int)]. Comments on the same line keep their relative order through every
/// operation, and no operation ever drops a comment.
public final class Comments {

    private static final Logger LOG = Logger.getLogger(Comments.class.getName());

    private static final Comparator<Comment> BY_LINE = Comparator.comparingInt(Comment::line);

    private static final Comments EMPTY = new Comments(List.of());

    /// One move of a [#shift(List)] batch.
    public record Shift(LineRange range, int delta) {
        public Shift {
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// Result of [#forLines(int, int)]: the comments belonging to a node and everything else.
    public record Split(List<Comment> matched, Comments rest) {
        public Split {
            matched = List.copyOf(matched);
            Objects.requireNonNull(rest, "rest must not be null");
        }
    }

    private final List<Comment> comments;

    private Comments(List<Comment> sorted) {
        this.comments = sorted;
    }

    /// {@return a store over `comments`, stably sorted by line}
    public static Comments of(List<Comment> comments) {
        Objects.requireNonNull(comments, "comments must not be null");
        if (comments.isEmpty()) {
            return EMPTY;
        }
        final var sorted = new ArrayList<>(comments);
        sorted.sort(BY_LINE);
        return new Comments(List.copyOf(sorted));
    }

    public static Comments of(Comment... comments) {
        return of(List.of(comments));
    }

    public static Comments empty() {
        return EMPTY;
    }

    public List<Comment> list() {
        return comments;
    }

    public int size() {
        return comments.size();
    }

    public boolean isEmpty() {
        return comments.isEmpty();
    }

    /// {@return this store plus `more`, re-sorted}
    public Comments plus(List<Comment> more) {
        if (more.isEmpty()) {
            return this;
        }
        final var all = new ArrayList<>(comments);
        all.addAll(more);
        return of(all);
    }

    /// Finds the comment block sitting directly above `line`.
    ///
    /// Walking upward from `line - 1`, each comment must be on the line just above the previous
    /// one, or on the same line as an already included comment. The first gap ends the block.
    ///
    /// @return the block in source order, empty when `line - 1` holds no comment
    public List<Comment> preceding(int line) {
        int idx = comments.size() - 1;
        while (idx >= 0 && comments.get(idx).line() >= line) {
            idx--;
        }
        int lowest = line;
        int start = idx + 1;
        while (idx >= 0) {
            final int at = comments.get(idx).line();
            if (at != lowest && at != lowest - 1) {
                break;
            }
            lowest = at;
            start = idx;
            idx--;
        }
        return comments.subList(start, findEnd(start, line));
    }

    private int findEnd(int start, int line) {
        int end = start;
        while (end < comments.size() && comments.get(end).line() < line) {
            end++;
        }
        return end;
    }

    /// Moves every comment inside `range` onto `range.first()`.
    public Comments displace(LineRange range) {
        Objects.requireNonNull(range, "range must not be null");
        final var out = new ArrayList<Comment>(comments.size());
        int moved = 0;
        for (final var comment : comments) {
            if (range.contains(comment.line()) && comment.line() != range.first()) {
                out.add(comment.withLine(range.first()));
                moved++;
            } else {
                out.add(comment);
            }
        }
        if (moved == 0) {
            return this;
        }
        final int count = moved;
        LOG.finer(() -> "Displaced " + count + " comment(s) onto line " + range.first());
        return of(out);
    }

    /// Moves every comment inside `range` by `delta` lines. Comments outside the range stay put.
    public Comments shift(LineRange range, int delta) {
        return shift(List.of(new Shift(range, delta)));
    }

    /// Applies several shifts in one pass.
    ///
    /// Each comment moves at most once, by the first shift whose range contains it, so swapping two
    /// regions does not send both back to the same place. Lines never go below 1.
    public Comments shift(List<Shift> shifts) {
        Objects.requireNonNull(shifts, "shifts must not be null");
        final var out = new ArrayList<Comment>(comments.size());
        for (final var comment : comments) {
            out.add(shifted(comment, shifts));
        }
        return of(out);
    }

    private static Comment shifted(Comment comment, List<Shift> shifts) {
        for (final var shift : shifts) {
            if (shift.range().contains(comment.line())) {
                return comment.withLine(Math.max(comment.line() + shift.delta(), 1));
            }
        }
        return comment;
    }

    /// Splits out the comments of a node spanning `start..last`.
    ///
    /// That is every comment inside the span, plus the comment block directly above `start`. For
    /// example with `# a` and `# b` on lines 2 and 3, code on line 4 with a trailing `# c`, and `# d`
    /// on line 5, `forLines(4, 6)` matches a, b, c and d.
    public Split forLines(int start, int last) {
        final var above = preceding(start);
        final var matched = new ArrayList<Comment>(above);
        final var rest = new ArrayList<Comment>();
        for (final var comment : comments) {
            if (comment.line() >= start && comment.line() <= last) {
                matched.add(comment);
            } else if (!above.contains(comment)) {
                rest.add(comment);
            }
        }
        return new Split(matched, of(rest));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Comments other && comments.equals(other.comments);
    }

    @Override
    public int hashCode() {
        return comments.hashCode();
    }

    @Override
    public String toString() {
        return "Comments" + comments;
    }
}
