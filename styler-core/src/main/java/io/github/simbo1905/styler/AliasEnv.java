package io.github.simbo1905.styler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Sequence;

/// Short name to full module path bindings in force at some point of a file.
///
/// Given `alias Foo.Bar` the environment maps `Bar` to `[Foo, Bar]`. Environments are immutable:
/// [#define(Node)] returns a new one, and nested scopes get their own environment by composing the
/// outer declarations explicitly ([#at(Zipper)]), never by looking up a parent.
public record AliasEnv(Map<String, List<String>> bindings) {

    private static final AliasEnv EMPTY = new AliasEnv(Map.of());

    /// Short name and full path introduced by one `alias` declaration.
    public record Binding(String as, List<String> path) {
        public Binding {
            Objects.requireNonNull(as, "as must not be null");
            path = List.copyOf(path);
        }
    }

    public AliasEnv {
        Objects.requireNonNull(bindings, "bindings must not be null");
        final var copy = new LinkedHashMap<String, List<String>>();
        bindings.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        bindings = Collections.unmodifiableMap(copy);
    }

    public static AliasEnv empty() {
        return EMPTY;
    }

    /// Reads `alias A.B` or `alias A.B, as: X`. Any other shape, including `alias __MODULE__`,
    /// is not a binding this environment tracks.
    public static Optional<Binding> binding(Node node) {
        if (!Syntax.isCall(node, "alias")) {
            return Optional.empty();
        }
        final var args = ((Call) node).args();
        if (args.isEmpty()) {
            return Optional.empty();
        }
        final var path = Syntax.aliasSegments(args.get(0));
        if (path.isEmpty() || path.get().isEmpty()) {
            return Optional.empty();
        }
        if (args.size() == 1) {
            final var segments = path.get();
            return Optional.of(new Binding(segments.get(segments.size() - 1), segments));
        }
        if (args.size() == 2 && args.get(1) instanceof Sequence opts && opts.elements().size() == 1) {
            return Syntax.keywordValue(opts, "as")
                    .flatMap(Syntax::aliasSegments)
                    .filter(as -> as.size() == 1)
                    .map(as -> new Binding(as.get(0), path.get()));
        }
        return Optional.empty();
    }

    /// Builds the environment visible at the zipper's focus: every alias declared before it in each
    /// enclosing block, outermost first.
    public static AliasEnv at(Zipper zipper) {
        final var levels = new ArrayDeque<Crumb>();
        for (var c = zipper.crumb(); c != null; c = c.up()) {
            levels.push(c);
        }
        var env = EMPTY;
        for (final var crumb : levels) {
            env = env.define(crumb.left().toReversedList());
        }
        return env;
    }

    /// {@return this environment plus the binding declared by `declaration`, or this one unchanged
    /// when `declaration` is not an alias this environment understands}
    public AliasEnv define(Node declaration) {
        return binding(declaration).map(this::define).orElse(this);
    }

    public AliasEnv define(List<Node> declarations) {
        var env = this;
        for (final var declaration : declarations) {
            env = env.define(declaration);
        }
        return env;
    }

    /// Adds a binding; the declared path is itself expanded against the bindings already present.
    public AliasEnv define(Binding binding) {
        final var updated = new LinkedHashMap<>(bindings);
        updated.put(binding.as(), expand(binding.path()));
        return new AliasEnv(updated);
    }

    /// Lengthens `path` when its first segment is a bound short name.
    public List<String> expand(List<String> path) {
        if (path.isEmpty()) {
            return path;
        }
        final var full = bindings.get(path.get(0));
        if (full == null) {
            return path;
        }
        final var out = new ArrayList<String>(full.size() + path.size() - 1);
        out.addAll(full);
        out.addAll(path.subList(1, path.size()));
        return List.copyOf(out);
    }

    /// Expands every module path in `node`'s subtree.
    public Node expandAst(Node node) {
        if (bindings.isEmpty()) {
            return node;
        }
        return Zipper.zip(node).traverse(z -> Syntax.aliasSegments(z.node())
                .map(path -> z.replace(Syntax.aliases(((Call) z.node()).meta(), expand(path))))
                .orElse(z)).node();
    }

    /// {@return full path to short name, for finding an alias that can be reused}
    public Map<List<String>, String> invert() {
        final var inverted = new LinkedHashMap<List<String>, String>();
        bindings.forEach((as, path) -> inverted.put(path, as));
        return Collections.unmodifiableMap(inverted);
    }

    public Optional<List<String>> lookup(String as) {
        return Optional.ofNullable(bindings.get(as));
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
