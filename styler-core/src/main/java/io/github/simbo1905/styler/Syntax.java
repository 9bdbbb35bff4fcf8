package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Leaf;
import io.github.simbo1905.styler.Node.Meta;
import io.github.simbo1905.styler.Node.Pair;
import io.github.simbo1905.styler.Node.Sequence;

/// Shapes the parser uses for common constructs, with builders and matchers for each.
///
/// Module paths are `__aliases__` calls over segment leaves, `Mod.fun(args)` is a call whose head
/// is a `.` call, and blocks, `do` bodies and parser wrapped literals are `__block__` calls.
public sealed interface Syntax permits Syntax.Nothing {
    enum Nothing implements Syntax { INSTANCE }

    String BLOCK = "__block__";
    String ALIASES = "__aliases__";
    String DOT = ".";
    String PIPE = "|>";
    String DO = "do";
    String ELSE = "else";

    /// Meta attribute set on string literals; atoms have none.
    String DELIMITER = "delimiter";
    /// Meta attribute holding a literal's source text.
    String TOKEN = "token";

    /// Remote call decomposed into its parts.
    record Remote(Node module, String function, Meta meta, List<Node> args) {
        public Remote {
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(meta, "meta must not be null");
            args = List.copyOf(args);
        }

        /// {@return the module path segments when the target is a literal module path}
        public Optional<List<String>> moduleSegments() {
            return aliasSegments(module);
        }

        public boolean is(List<String> path, String fun) {
            return function.equals(fun) && moduleSegments().map(path::equals).orElse(false);
        }
    }

    // ---- builders ----

    static Call block(List<Node> statements) {
        return new Call(new Leaf(BLOCK), Meta.NONE, statements);
    }

    static Call block(Meta meta, List<Node> statements) {
        return new Call(new Leaf(BLOCK), meta, statements);
    }

    static Call aliases(List<String> segments) {
        return aliases(Meta.NONE, segments);
    }

    static Call aliases(Meta meta, List<String> segments) {
        return new Call(new Leaf(ALIASES), meta, segments.stream().<Node>map(Leaf::new).toList());
    }

    static Call remoteCall(Node module, String function, Meta meta, List<Node> args) {
        final var dot = new Call(new Leaf(DOT), meta, List.of(module, new Leaf(function)));
        return new Call(dot, meta, args);
    }

    static Call remoteCall(List<String> module, String function, Meta meta, List<Node> args) {
        return remoteCall(aliases(meta, module), function, meta, args);
    }

    static Call local(String name, Meta meta, List<Node> args) {
        return new Call(new Leaf(name), meta, args);
    }

    static Call variable(String name, Meta meta) {
        return new Call(new Leaf(name), meta, List.of());
    }

    static Call pipe(Meta meta, Node lhs, Node rhs) {
        return new Call(new Leaf(PIPE), meta, List.of(lhs, rhs));
    }

    static Call literal(Object value, Meta meta) {
        return new Call(new Leaf(BLOCK), meta, List.of(new Leaf(value)));
    }

    static Call atom(String name) {
        return literal(name, Meta.NONE);
    }

    /// Keyword entry such as `as: X` or `do: body`.
    static Pair keyword(String key, Node value) {
        return new Pair(new Call(new Leaf(BLOCK), Meta.NONE.with("format", "keyword"), List.of(new Leaf(key))), value);
    }

    /// `do ... end` clause list holding only a `do` body.
    static Sequence doBlock(Node body) {
        return new Sequence(List.of(new Pair(atom(DO), body)));
    }

    // ---- matchers ----

    /// {@return the head name when `node` is a call with a plain identifier head}
    static Optional<String> callName(Node node) {
        if (node instanceof Call call && call.head() instanceof Leaf leaf && leaf.value() instanceof String name) {
            return Optional.of(name);
        }
        return Optional.empty();
    }

    static boolean isCall(Node node, String name) {
        return callName(node).map(name::equals).orElse(false);
    }

    static boolean isBlock(Node node) {
        return isCall(node, BLOCK);
    }

    static boolean isPipe(Node node) {
        return isCall(node, PIPE) && ((Call) node).args().size() == 2;
    }

    /// {@return the segments of a literal module path such as `A.B.C`}
    static Optional<List<String>> aliasSegments(Node node) {
        if (!isCall(node, ALIASES)) {
            return Optional.empty();
        }
        final var segments = new ArrayList<String>();
        for (final var arg : ((Call) node).args()) {
            if (!(arg instanceof Leaf leaf) || !(leaf.value() instanceof String segment)) {
                return Optional.empty();
            }
            segments.add(segment);
        }
        return Optional.of(List.copyOf(segments));
    }

    static Optional<Remote> remote(Node node) {
        if (node instanceof Call call
                && call.head() instanceof Call dot
                && isCall(dot, DOT)
                && dot.args().size() == 2
                && dot.args().get(1) instanceof Leaf fun
                && fun.value() instanceof String function) {
            return Optional.of(new Remote(dot.args().get(0), function, call.meta(), call.args()));
        }
        return Optional.empty();
    }

    /// {@return the value of a parser wrapped literal such as `1`, `:ok` or `"text"`}
    static Optional<Object> literalValue(Node node) {
        if (isBlock(node) && node instanceof Call call && call.args().size() == 1
                && call.args().get(0) instanceof Leaf leaf) {
            return Optional.of(leaf.value());
        }
        return Optional.empty();
    }

    static boolean isAtom(Node node, String name) {
        return node instanceof Call call
                && call.meta().get(DELIMITER) == null
                && literalValue(node).map(name::equals).orElse(false);
    }

    /// Looks up `key` in a keyword list or `do` clause list.
    static Optional<Node> keywordValue(Node keywords, String key) {
        if (!(keywords instanceof Sequence sequence)) {
            return Optional.empty();
        }
        for (final var element : sequence.elements()) {
            if (element instanceof Pair pair && isAtom(pair.left(), key)) {
                return Optional.of(pair.right());
            }
        }
        return Optional.empty();
    }

    /// {@return the statements of a block, or the node itself as a single statement}
    static List<Node> statements(Node node) {
        if (isBlock(node) && literalValue(node).isEmpty()) {
            return ((Call) node).args();
        }
        return List.of(node);
    }
}
