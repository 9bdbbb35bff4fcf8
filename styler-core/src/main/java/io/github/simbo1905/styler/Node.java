package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Generic syntax tree node that rules and the [Zipper] operate over.
///
/// A tree is built from four shapes:
/// - [Leaf]: an identifier, atom or literal value
/// - [Sequence]: an ordered list of nodes
/// - [Pair]: a fixed two element tuple, used for keyword entries and `do` clauses
/// - [Call]: a head, metadata and arguments; when the head is itself a [Call] the node is a
///   qualified call such as `a.b()`
///
/// Every shape defines a children extraction ([#children()]) and a children replacement
/// ([#withChildren(List)]) that are exact inverses of each other. The zipper relies on that pair
/// to decompose a parent on the way down and rebuild it on the way up.
public sealed interface Node permits Node.Leaf, Node.Sequence, Node.Pair, Node.Call {

    /// Head of the synthetic tuple produced when a [Pair] is rebuilt with other than two children.
    String TUPLE = "{}";

    /// {@return the children of this node in source order}
    List<Node> children();

    /// Rebuilds this node around new children, keeping its tag, head and metadata.
    /// @param children the replacement children
    /// @return a node of the same shape holding `children`
    Node withChildren(List<Node> children);

    /// {@return the source line recorded on this node, or null when it carries none}
    default Integer line() {
        return null;
    }

    /// Terminal value. Identifiers and atoms are `String`s, literals keep their Java value.
    record Leaf(Object value) implements Node {
        public Leaf {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public Node withChildren(List<Node> children) {
            if (!children.isEmpty()) {
                throw new IllegalStateException("a leaf cannot hold children: " + value);
            }
            return this;
        }
    }

    /// Ordered list of nodes.
    record Sequence(List<Node> elements) implements Node {
        public Sequence {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        @Override
        public List<Node> children() {
            return elements;
        }

        @Override
        public Node withChildren(List<Node> children) {
            return new Sequence(children);
        }
    }

    /// Two element tuple.
    record Pair(Node left, Node right) implements Node {
        public Pair {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        /// A pair only survives with exactly two children; any other count becomes a `{}` tuple call.
        @Override
        public Node withChildren(List<Node> children) {
            if (children.size() == 2) {
                return new Pair(children.get(0), children.get(1));
            }
            return new Call(new Leaf(TUPLE), Meta.NONE, children);
        }
    }

    /// Invocation-like node. The children of a qualified call are `[head, args...]`,
    /// those of any other call are just `args`.
    record Call(Node head, Meta meta, List<Node> args) implements Node {
        public Call {
            Objects.requireNonNull(head, "head must not be null");
            Objects.requireNonNull(meta, "meta must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }

        /// {@return true when the head is itself a call, e.g. `a.b()`}
        public boolean isQualified() {
            return head instanceof Call;
        }

        @Override
        public List<Node> children() {
            if (!isQualified()) {
                return args;
            }
            final var children = new ArrayList<Node>(args.size() + 1);
            children.add(head);
            children.addAll(args);
            return children;
        }

        @Override
        public Node withChildren(List<Node> children) {
            if (!isQualified()) {
                return new Call(head, meta, children);
            }
            if (children.isEmpty()) {
                throw new IllegalStateException("a qualified call needs a head");
            }
            return new Call(children.get(0), meta, children.subList(1, children.size()));
        }

        @Override
        public Integer line() {
            return meta.line();
        }

        /// {@return a copy of this call with `meta` replaced}
        public Call withMeta(Meta meta) {
            return new Call(head, meta, args);
        }

        /// {@return a copy of this call with `args` replaced}
        public Call withArgs(List<Node> args) {
            return new Call(head, meta, args);
        }
    }

    /// Call metadata: the source line (absent on synthesized nodes) and any extra parser attributes
    /// such as the original literal `token`.
    record Meta(Integer line, Map<String, Object> attributes) {

        public static final Meta NONE = new Meta(null, Map.of());

        public Meta {
            Objects.requireNonNull(attributes, "attributes must not be null");
            attributes = Map.copyOf(attributes);
        }

        public static Meta line(int line) {
            return new Meta(line, Map.of());
        }

        public boolean hasLine() {
            return line != null;
        }

        public Meta withLine(Integer line) {
            return new Meta(line, attributes);
        }

        public Object get(String key) {
            return attributes.get(key);
        }

        public Meta with(String key, Object value) {
            final var updated = new LinkedHashMap<String, Object>(attributes);
            updated.put(key, value);
            return new Meta(line, updated);
        }
    }

    static Leaf leaf(Object value) {
        return new Leaf(value);
    }

    static Sequence seq(Node... elements) {
        return new Sequence(Arrays.asList(elements));
    }

    static Sequence seq(List<Node> elements) {
        return new Sequence(elements);
    }

    static Pair pair(Node left, Node right) {
        return new Pair(left, right);
    }

    static Call call(String name, Meta meta, Node... args) {
        return new Call(new Leaf(name), meta, Arrays.asList(args));
    }

    static Call call(Node head, Meta meta, List<Node> args) {
        return new Call(head, meta, args);
    }
}
