package io.github.simbo1905.styler;

/// Inclusive range of source lines.
public record LineRange(int first, int last) {
    public LineRange {
        if (last < first) {
            throw new IllegalArgumentException("last line " + last + " is before first line " + first);
        }
    }

    public static LineRange of(int first, int last) {
        return new LineRange(first, last);
    }

    public boolean contains(int line) {
        return line >= first && line <= last;
    }
}
