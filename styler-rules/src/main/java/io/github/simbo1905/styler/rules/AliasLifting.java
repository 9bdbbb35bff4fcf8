package io.github.simbo1905.styler.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.github.simbo1905.styler.AliasEnv;
import io.github.simbo1905.styler.AnalyzingRule;
import io.github.simbo1905.styler.LineFixup;
import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Meta;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Trees;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Fold;
import io.github.simbo1905.styler.Zipper.Walk;

/// Introduces an alias for a long module path used repeatedly inside a module.
///
/// A path of three or more segments that occurs at least twice in a `defmodule` body gets an
/// `alias` declaration after the module's leading directives, and every occurrence is shortened
/// to its last segment:
///
/// ```
/// defmodule A do                    defmodule A do
///   def f, do: X.Y.Zed.f()            alias X.Y.Zed
///   def g, do: X.Y.Zed.g()    =>      def f, do: Zed.f()
/// end                                 def g, do: Zed.g()
///                                   end
/// ```
///
/// A path is not lifted when its short name is already bound by an alias, excluded by
/// configuration, the name of a nested module, or the first segment of some other path used in
/// the body, since the new alias would change what those references mean. When two paths share a
/// short name, the one seen first in source order wins if it occurs twice. `quote` blocks are
/// neither counted nor rewritten.
public final class AliasLifting extends AnalyzingRule<AliasLifting.Plan> {

    private static final Logger LOG = Logger.getLogger(AliasLifting.class.getName());

    private static final Set<String> MODULE_DEFINITIONS = Set.of("defmodule", "defimpl", "defprotocol");

    private static final Set<String> DIRECTIVES = Set.of("use", "import", "alias", "require");

    private static final Set<String> LEADING_ATTRIBUTES = Set.of("moduledoc", "shortdoc", "behaviour");

    /// What to lift in one module body.
    /// @param stanza number of leading directive statements the new aliases go after
    /// @param env aliases in force after those directives
    /// @param lifts full paths to alias, keyed by short name, in the order they were first seen
    record Plan(int stanza, AliasEnv env, Map<String, List<String>> lifts) {
        Plan {
            Objects.requireNonNull(env, "env must not be null");
            lifts = Collections.unmodifiableMap(new LinkedHashMap<>(lifts));
        }

        boolean lifts(List<String> fullPath) {
            return lifts.containsValue(fullPath);
        }
    }

    /// Occurrence counts gathered while reading a module body.
    private static final class Candidates {
        final Map<String, Map<List<String>, Integer>> counts = new LinkedHashMap<>();
        final Set<String> disqualified = new HashSet<>();

        void count(String as, List<String> fullPath) {
            counts.computeIfAbsent(as, k -> new LinkedHashMap<>()).merge(fullPath, 1, Integer::sum);
        }

        Map<String, List<String>> select() {
            final var selected = new LinkedHashMap<String, List<String>>();
            counts.forEach((as, paths) -> {
                if (disqualified.contains(as)) {
                    LOG.fine(() -> "Not lifting " + as + ": the name is already in use");
                    return;
                }
                paths.entrySet().stream()
                        .filter(e -> e.getValue() >= 2)
                        .findFirst()
                        .ifPresent(e -> selected.put(as, e.getKey()));
            });
            return selected;
        }
    }

    @Override
    protected Optional<Zipper> scope(Zipper zipper, StyleContext context) {
        if (!Syntax.isCall(zipper.node(), "defmodule") || ((Call) zipper.node()).args().size() != 2) {
            return Optional.empty();
        }
        return zipper.down()
                .map(Zipper::rightmost)
                .filter(z -> Syntax.keywordValue(z.node(), Syntax.DO).isPresent())
                .flatMap(Zipper::down)
                .flatMap(Zipper::down)
                .flatMap(Zipper::right);
    }

    @Override
    protected Optional<Plan> analyze(Zipper body, StyleContext context) {
        final var statements = Syntax.statements(body.node());
        final var stanza = stanzaLength(statements);
        if (stanza == statements.size()) {
            return Optional.empty();
        }
        final var env = AliasEnv.at(body).define(statements.subList(0, stanza));
        final var taken = new HashSet<>(env.names());
        final var bound = env.invert();
        final var candidates = new Candidates();

        for (final var statement : statements.subList(stanza, statements.size())) {
            Zipper.zip(Syntax.block(List.of(statement))).traverseWhile(candidates, (z, acc) -> {
                final var node = z.node();
                if (Syntax.isCall(node, "quote")) {
                    return Walk.skip(z, acc);
                }
                final var path = Syntax.aliasSegments(node);
                if (path.isEmpty() || path.get().isEmpty()) {
                    return Walk.cont(z, acc);
                }
                final var segments = path.get();
                final var definition = definedModule(z);
                if (definition.isPresent()) {
                    if (definition.get().equals("defmodule")) {
                        acc.disqualified.add(segments.get(segments.size() - 1));
                    }
                    return Walk.skip(z, acc);
                }
                acc.disqualified.add(segments.get(0));
                final var last = segments.get(segments.size() - 1);
                if (segments.size() >= 3 && !taken.contains(last) && !context.config().excludesFromLifting(last)) {
                    final var full = env.expand(segments);
                    if (!bound.containsKey(full)) {
                        acc.count(last, full);
                    }
                }
                return Walk.skip(z, acc);
            });
        }

        final var lifts = candidates.select();
        if (lifts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Plan(stanza, env, lifts));
    }

    @Override
    protected Fold<StyleContext> rewrite(Zipper body, Plan plan, StyleContext context) {
        final var statements = Syntax.statements(body.node());
        final var stanza = plan.stanza();
        final Integer line = stanza > 0 ? Integer.valueOf(Trees.maxLine(statements.get(stanza - 1)))
                : Trees.firstLine(statements.get(0));
        final var meta = line == null || line == 0 ? Meta.NONE : Meta.line(line);

        final var declarations = new ArrayList<Node>();
        plan.lifts().values().forEach(path ->
                declarations.add(Syntax.local("alias", meta, List.of(Syntax.aliases(meta, path)))));

        final var rest = shorten(Syntax.block(statements.subList(stanza, statements.size())), plan);

        final var updated = new ArrayList<Node>(statements.subList(0, stanza));
        updated.addAll(declarations);
        updated.addAll(((Call) rest).args());
        final var first = Trees.firstLine(statements.get(0));
        final var fixed = LineFixup.fixLineNumbers(updated, first == null ? 1 : first, context.comments());

        final var blockMeta = body.node() instanceof Call call && Syntax.isBlock(call) ? call.meta() : Meta.NONE;
        LOG.fine(() -> "Lifted " + plan.lifts().keySet() + " in " + context.file());
        return new Fold<>(body.replace(Syntax.block(blockMeta, fixed.nodes())), context.withComments(fixed.comments()));
    }

    /// Replaces lifted paths with their short name and drops now redundant nested declarations.
    private static Node shorten(Node statements, Plan plan) {
        return Zipper.zip(statements).traverseWhile(z -> {
            final var node = z.node();
            if (Syntax.isCall(node, "quote")) {
                return Zipper.Visit.skip(z);
            }
            if (isRedundantDeclaration(z, plan)) {
                return Zipper.Visit.cont(z.remove());
            }
            final var path = Syntax.aliasSegments(node);
            if (path.isEmpty() || path.get().isEmpty() || definedModule(z).isPresent()) {
                return Zipper.Visit.cont(z);
            }
            final var full = plan.env().expand(path.get());
            if (plan.lifts(full)) {
                final var shortName = full.get(full.size() - 1);
                return Zipper.Visit.skip(z.replace(Syntax.aliases(((Call) node).meta(), List.of(shortName))));
            }
            return Zipper.Visit.skip(z);
        }).node();
    }

    /// {@return true for `alias X.Y.Z` of a lifted path, sitting directly in a block}
    private static boolean isRedundantDeclaration(Zipper z, Plan plan) {
        final var binding = AliasEnv.binding(z.node());
        if (binding.isEmpty()) {
            return false;
        }
        final var path = binding.get().path();
        final var full = plan.env().expand(path);
        if (!plan.lifts(full) || !binding.get().as().equals(full.get(full.size() - 1))) {
            return false;
        }
        return z.up().map(parent -> Syntax.isBlock(parent.node()) && Syntax.literalValue(parent.node()).isEmpty())
                .orElse(false);
    }

    /// {@return the defining call's name when the focus is the name of a module being defined}
    private static Optional<String> definedModule(Zipper z) {
        if (!z.leftSiblings().isEmpty()) {
            return Optional.empty();
        }
        return z.up()
                .flatMap(parent -> Syntax.callName(parent.node()))
                .filter(MODULE_DEFINITIONS::contains);
    }

    /// {@return how many statements at the top of a module body are directives}
    static int stanzaLength(List<Node> statements) {
        int count = 0;
        for (final var statement : statements) {
            if (!isDirective(statement)) {
                break;
            }
            count++;
        }
        return count;
    }

    private static boolean isDirective(Node statement) {
        final var name = Syntax.callName(statement);
        if (name.isEmpty()) {
            return false;
        }
        if (DIRECTIVES.contains(name.get())) {
            return true;
        }
        if (name.get().equals("@")) {
            final var args = ((Call) statement).args();
            return args.size() == 1 && Syntax.callName(args.get(0)).filter(LEADING_ATTRIBUTES::contains).isPresent();
        }
        return false;
    }
}
