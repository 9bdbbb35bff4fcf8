package io.github.simbo1905.styler;

import java.util.Objects;

/// Per-file state threaded through every rule call.
/// @param comments the file's comments, relocated by rules as they rewrite code
/// @param file the file name, for diagnostics only
/// @param config the run's configuration
public record StyleContext(Comments comments, String file, StylerConfig config) {
    public StyleContext {
        Objects.requireNonNull(comments, "comments must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    public StyleContext withComments(Comments comments) {
        return new StyleContext(comments, file, config);
    }

    /// {@return the aliases in force at the zipper's focus}
    public AliasEnv aliases(Zipper zipper) {
        return AliasEnv.at(zipper);
    }
}
