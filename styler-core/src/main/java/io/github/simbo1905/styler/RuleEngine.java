package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Zipper.Command;
import io.github.simbo1905.styler.Zipper.Fold;
import io.github.simbo1905.styler.Zipper.Walk;

/// Runs an ordered list of rules over a tree in a single depth-first pass.
///
/// At each node the active rules run in list order, each seeing the zipper and context the previous
/// one returned. A rule answering `SKIP` is not shown the focus's subtree, while the other rules
/// still run at that node and below it. When every rule is skipping the traversal steps over the
/// subtree. A rule answering `HALT`, or one that throws while errors are only logged, is dropped
/// for the rest of the file. Once no rule is left the traversal stops early.
public final class RuleEngine {

    private static final Logger LOG = Logger.getLogger(RuleEngine.class.getName());

    private final List<Rule> rules;

    public RuleEngine(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = List.copyOf(rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    /// Styles the tree under `zipper`.
    /// @return the rewritten zipper, at the starting position, and the final context
    /// @throws StyleException when a rule throws and the config says [StylerConfig.OnError#RAISE]
    public Fold<StyleContext> run(Zipper zipper, StyleContext context) {
        final var active = new ArrayList<>(rules);
        // rule -> depth of the subtree it asked to skip
        final Map<Rule, Integer> skipping = new IdentityHashMap<>();
        LOG.fine(() -> "Styling " + context.file() + " with " + active.size() + " rule(s)");
        return zipper.traverseWhile(context, (z, ctx) -> visit(z, ctx, active, skipping));
    }

    private static Walk<StyleContext> visit(Zipper zipper, StyleContext context, List<Rule> active,
                                            Map<Rule, Integer> skipping) {
        // pre-order: reaching a node no deeper than the skipped one means its subtree is done
        final int depth = zipper.depth();
        skipping.values().removeIf(skippedAt -> depth <= skippedAt);
        var z = zipper;
        var ctx = context;
        final var it = active.iterator();
        while (it.hasNext()) {
            final var rule = it.next();
            if (skipping.containsKey(rule)) {
                continue;
            }
            final Walk<StyleContext> walk;
            try {
                walk = rule.run(z, ctx);
            } catch (RuntimeException e) {
                final var error = new StyleException(rule.name(), ctx.file(), e);
                if (ctx.config().onError() == StylerConfig.OnError.RAISE) {
                    throw error;
                }
                LOG.log(Level.WARNING, error, () -> error.getMessage() + ". Skipping rule and continuing on");
                it.remove();
                continue;
            }
            z = walk.zipper();
            ctx = walk.acc();
            if (walk.command() == Command.SKIP) {
                skipping.put(rule, z.depth());
            } else if (walk.command() == Command.HALT) {
                LOG.finer(() -> rule.name() + " halted");
                it.remove();
            }
        }
        if (active.isEmpty()) {
            return Walk.halt(z, ctx);
        }
        return skipping.keySet().containsAll(active) ? Walk.skip(z, ctx) : Walk.cont(z, ctx);
    }
}
