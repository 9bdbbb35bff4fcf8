package io.github.simbo1905.styler;

import java.util.Objects;

/// A source comment anchored to a line. Comments live beside the tree, not inside it.
public record Comment(int line, String text) {
    public Comment {
        Objects.requireNonNull(text, "text must not be null");
    }

    public Comment withLine(int line) {
        return new Comment(line, text);
    }
}
