package io.github.simbo1905.styler;

import java.util.Objects;

/// A parsed file: its tree, its comments and its name.
public record SourceTree(Node root, Comments comments, String file) {
    public SourceTree {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(comments, "comments must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }

    public static SourceTree of(Node root, String file) {
        return new SourceTree(root, Comments.empty(), file);
    }
}
