package io.github.simbo1905.styler;

import java.util.Optional;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Zipper.Fold;
import io.github.simbo1905.styler.Zipper.Walk;

/// A rule that needs to see a whole scope before changing any of it.
///
/// Running happens in three steps. [#scope] picks the subtree to work on, the focus itself or one
/// of its descendants. [#analyze] reads that subtree, without editing it, into a plan. [#rewrite]
/// applies the whole plan in one pass. The engine then gets back a zipper at the depth it started
/// from, so the traversal resumes at the same node.
///
/// @param <P> the plan produced by analysis
public abstract class AnalyzingRule<P> implements Rule {

    private static final Logger LOG = Logger.getLogger(AnalyzingRule.class.getName());

    /// {@return the subtree this rule works on, or empty when the focus is not one of its scopes}
    protected abstract Optional<Zipper> scope(Zipper zipper, StyleContext context);

    /// {@return what to change in `scope`, or empty when nothing qualifies}
    protected abstract Optional<P> analyze(Zipper scope, StyleContext context);

    /// Applies `plan`. The returned zipper must be inside, or at, `scope`.
    protected abstract Fold<StyleContext> rewrite(Zipper scope, P plan, StyleContext context);

    @Override
    public final Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        final var scope = scope(zipper, context);
        if (scope.isEmpty()) {
            return Walk.cont(zipper, context);
        }
        final var plan = analyze(scope.get(), context);
        if (plan.isEmpty()) {
            return Walk.cont(zipper, context);
        }
        LOG.fine(() -> name() + " rewriting with plan " + plan.get());
        final var rewritten = rewrite(scope.get(), plan.get(), context);
        return Walk.cont(climb(rewritten.zipper(), zipper.depth()), rewritten.acc());
    }

    private static Zipper climb(Zipper zipper, int depth) {
        var z = zipper;
        int at = z.depth();
        while (at > depth) {
            z = z.up().orElseThrow();
            at--;
        }
        return z;
    }
}
