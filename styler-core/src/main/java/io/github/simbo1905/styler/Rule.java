package io.github.simbo1905.styler;

import io.github.simbo1905.styler.Zipper.Walk;

/// A rewrite applied at every node of the tree during the styling traversal.
///
/// The returned command steers the traversal:
/// - `CONT`: carry on, descending into the (possibly rewritten) focus
/// - `SKIP`: do not descend into the focus, and let no later rule look at it either
/// - `HALT`: this rule has nothing more to do in this file
///
/// The zipper handed back may differ from the one received; later rules and the traversal carry on
/// from it. Rules must not keep zippers between calls.
public interface Rule {

    Walk<StyleContext> run(Zipper zipper, StyleContext context);

    /// {@return the name used to enable the rule and in diagnostics}
    default String name() {
        return getClass().getSimpleName();
    }
}
