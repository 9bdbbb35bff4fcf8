package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/// Cursor over a [Node] tree with constant time local navigation and editing.
///
/// A zipper is the focused node plus a [Crumb] trail back to the root. Editing the focus never
/// copies the rest of the tree: the parent is rebuilt lazily, one level at a time, when [#up()] is
/// called. Neighbours that do not exist are reported as [Optional#empty()]; only [#remove()] at the
/// root is an error.
///
/// Traversals are iterative so deep trees do not grow the Java stack.
public record Zipper(Node node, Crumb crumb) {

    /// What a traversal callback asks for next.
    public enum Command {
        /// carry on into the focus's children
        CONT,
        /// move on without descending into the focus
        SKIP,
        /// stop the traversal
        HALT
    }

    /// Direction for [#skip(Direction)] and [#find(Direction, Predicate)].
    public enum Direction { NEXT, PREV }

    /// Outcome of an accumulator-free [#traverseWhile(Function)] callback.
    public record Visit(Command command, Zipper zipper) {
        public Visit {
            Objects.requireNonNull(command, "command must not be null");
            Objects.requireNonNull(zipper, "zipper must not be null");
        }

        public static Visit cont(Zipper zipper) {
            return new Visit(Command.CONT, zipper);
        }

        public static Visit skip(Zipper zipper) {
            return new Visit(Command.SKIP, zipper);
        }

        public static Visit halt(Zipper zipper) {
            return new Visit(Command.HALT, zipper);
        }
    }

    /// Outcome of an accumulating [#traverseWhile(Object, BiFunction)] callback.
    public record Walk<A>(Command command, Zipper zipper, A acc) {
        public Walk {
            Objects.requireNonNull(command, "command must not be null");
            Objects.requireNonNull(zipper, "zipper must not be null");
        }

        public static <A> Walk<A> cont(Zipper zipper, A acc) {
            return new Walk<>(Command.CONT, zipper, acc);
        }

        public static <A> Walk<A> skip(Zipper zipper, A acc) {
            return new Walk<>(Command.SKIP, zipper, acc);
        }

        public static <A> Walk<A> halt(Zipper zipper, A acc) {
            return new Walk<>(Command.HALT, zipper, acc);
        }
    }

    /// Zipper and accumulator returned by the accumulating traversals.
    public record Fold<A>(Zipper zipper, A acc) {
        public Fold {
            Objects.requireNonNull(zipper, "zipper must not be null");
        }
    }

    public Zipper {
        Objects.requireNonNull(node, "node must not be null");
    }

    /// {@return a zipper focused on `node` with no context}
    public static Zipper zip(Node node) {
        return new Zipper(node, null);
    }

    public boolean isRoot() {
        return crumb == null;
    }

    /// {@return how many levels below the root the focus sits}
    public int depth() {
        int depth = 0;
        for (var c = crumb; c != null; c = c.up()) {
            depth++;
        }
        return depth;
    }

    public List<Node> children() {
        return node.children();
    }

    /// {@return the left siblings in source order}
    public List<Node> leftSiblings() {
        return crumb == null ? List.of() : crumb.left().toReversedList();
    }

    /// {@return the right siblings in source order}
    public List<Node> rightSiblings() {
        return crumb == null ? List.of() : crumb.right().toList();
    }

    // ---- navigation ----

    public Optional<Zipper> down() {
        final var children = node.children();
        if (children.isEmpty()) {
            return Optional.empty();
        }
        final var right = Siblings.of(children.subList(1, children.size()));
        return Optional.of(new Zipper(children.get(0), new Crumb(Siblings.EMPTY, node, right, crumb)));
    }

    public Optional<Zipper> up() {
        if (crumb == null) {
            return Optional.empty();
        }
        return Optional.of(new Zipper(rebuildParent(), crumb.up()));
    }

    private Node rebuildParent() {
        final var children = new ArrayList<Node>(crumb.left().size() + 1 + crumb.right().size());
        children.addAll(crumb.left().toReversedList());
        children.add(node);
        children.addAll(crumb.right().toList());
        return crumb.parent().withChildren(children);
    }

    public Optional<Zipper> left() {
        if (crumb == null || crumb.left().isEmpty()) {
            return Optional.empty();
        }
        final var left = crumb.left();
        return Optional.of(new Zipper(left.head(),
                new Crumb(left.tail(), crumb.parent(), crumb.right().push(node), crumb.up())));
    }

    public Optional<Zipper> right() {
        if (crumb == null || crumb.right().isEmpty()) {
            return Optional.empty();
        }
        final var right = crumb.right();
        return Optional.of(new Zipper(right.head(),
                new Crumb(crumb.left().push(node), crumb.parent(), right.tail(), crumb.up())));
    }

    public Zipper leftmost() {
        if (crumb == null || crumb.left().isEmpty()) {
            return this;
        }
        final var ordered = crumb.left().toReversedList();
        final var right = crumb.right().push(node).pushAll(ordered.subList(1, ordered.size()));
        return new Zipper(ordered.get(0), new Crumb(Siblings.EMPTY, crumb.parent(), right, crumb.up()));
    }

    public Zipper rightmost() {
        if (crumb == null || crumb.right().isEmpty()) {
            return this;
        }
        final var ordered = crumb.right().toList();
        final var last = ordered.size() - 1;
        final var left = crumb.left().push(node).pushEach(ordered.subList(0, last));
        return new Zipper(ordered.get(last), new Crumb(left, crumb.parent(), Siblings.EMPTY, crumb.up()));
    }

    /// {@return the zipper at the root with every pending edit folded in}
    public Zipper top() {
        var z = this;
        while (z.crumb != null) {
            z = new Zipper(z.rebuildParent(), z.crumb.up());
        }
        return z;
    }

    /// {@return the root node with every pending edit folded in}
    public Node root() {
        return top().node;
    }

    /// Depth-first pre-order successor.
    public Optional<Zipper> next() {
        final var down = down();
        return down.isPresent() ? down : skip(Direction.NEXT);
    }

    /// Depth-first pre-order predecessor, the inverse of [#next()].
    public Optional<Zipper> prev() {
        final var left = left();
        if (left.isPresent()) {
            return Optional.of(left.get().prevDown());
        }
        return up();
    }

    private Zipper prevDown() {
        var z = this;
        var down = z.down();
        while (down.isPresent()) {
            z = down.get().rightmost();
            down = z.down();
        }
        return z;
    }

    public Optional<Zipper> skip() {
        return skip(Direction.NEXT);
    }

    /// Moves to the next (or previous) node without entering the focus's own children.
    public Optional<Zipper> skip(Direction direction) {
        var z = this;
        while (true) {
            final var sideways = direction == Direction.NEXT ? z.right() : z.left();
            if (sideways.isPresent()) {
                return sideways;
            }
            final var up = z.up();
            if (up.isEmpty()) {
                return Optional.empty();
            }
            z = up.get();
        }
    }

    // ---- traversal ----

    /// Applies `fn` to every node of the focused subtree in depth-first pre-order.
    /// @return the zipper at the starting position, holding the rewritten subtree
    public Zipper traverse(UnaryOperator<Zipper> fn) {
        return traverseWhile(z -> Visit.cont(fn.apply(z)));
    }

    /// Accumulating form of [#traverse(UnaryOperator)].
    public <A> Fold<A> traverse(A acc, BiFunction<Zipper, A, Fold<A>> fn) {
        return traverseWhile(acc, (z, a) -> {
            final var fold = fn.apply(z, a);
            return Walk.cont(fold.zipper(), fold.acc());
        });
    }

    /// Pre-order traversal steered by the callback's [Command].
    /// @return the zipper at the starting position, holding the rewritten subtree
    public Zipper traverseWhile(Function<Zipper, Visit> fn) {
        return traverseWhile(null, (z, ignored) -> {
            final var visit = fn.apply(z);
            return new Walk<>(visit.command(), visit.zipper(), null);
        }).zipper();
    }

    /// Accumulating pre-order traversal steered by the callback's [Command].
    ///
    /// When this zipper is not the root only its subtree is walked, and the result is put back in
    /// the original context.
    public <A> Fold<A> traverseWhile(A acc, BiFunction<Zipper, A, Walk<A>> fn) {
        var z = zip(node);
        var current = acc;
        while (true) {
            final var walk = fn.apply(z, current);
            current = walk.acc();
            z = walk.zipper();
            final Optional<Zipper> following = switch (walk.command()) {
                case CONT -> z.next();
                case SKIP -> z.skip(Direction.NEXT);
                case HALT -> Optional.empty();
            };
            if (following.isEmpty()) {
                break;
            }
            z = following.get();
        }
        return new Fold<>(new Zipper(z.root(), crumb), current);
    }

    /// {@return true when some node of the focused subtree satisfies `predicate`}
    public boolean any(Predicate<Node> predicate) {
        return Boolean.TRUE.equals(traverseWhile(Boolean.FALSE, (z, found) ->
                predicate.test(z.node) ? Walk.halt(z, Boolean.TRUE) : Walk.cont(z, found)).acc());
    }

    /// Walks forward from, and including, the current position.
    public Optional<Zipper> find(Predicate<Node> predicate) {
        return find(Direction.NEXT, predicate);
    }

    /// Walks from, and including, the current position until `predicate` matches.
    public Optional<Zipper> find(Direction direction, Predicate<Node> predicate) {
        Optional<Zipper> z = Optional.of(this);
        while (z.isPresent()) {
            final var at = z.get();
            if (predicate.test(at.node)) {
                return z;
            }
            z = direction == Direction.NEXT ? at.next() : at.prev();
        }
        return Optional.empty();
    }

    // ---- editing ----

    public Zipper replace(Node replacement) {
        return new Zipper(replacement, crumb);
    }

    public Zipper update(UnaryOperator<Node> fn) {
        return new Zipper(fn.apply(node), crumb);
    }

    public Zipper replaceChildren(List<Node> children) {
        return replace(node.withChildren(children));
    }

    /// Adds `sibling` to the left without moving. At the root the root is first wrapped in a block.
    public Zipper insertLeft(Node sibling) {
        final var z = ensureSiblingContext();
        return new Zipper(z.node, z.crumb.withLeft(z.crumb.left().push(sibling)));
    }

    /// Adds `sibling` to the right without moving. At the root the root is first wrapped in a block.
    public Zipper insertRight(Node sibling) {
        final var z = ensureSiblingContext();
        return new Zipper(z.node, z.crumb.withRight(z.crumb.right().push(sibling)));
    }

    /// Inserts `siblings` to the left, in source order, without moving.
    public Zipper prependSiblings(List<Node> siblings) {
        final var z = ensureSiblingContext();
        return new Zipper(z.node, z.crumb.withLeft(z.crumb.left().pushEach(siblings)));
    }

    /// Inserts `siblings` to the right, in source order, without moving.
    public Zipper insertSiblings(List<Node> siblings) {
        final var z = ensureSiblingContext();
        return new Zipper(z.node, z.crumb.withRight(z.crumb.right().pushAll(siblings)));
    }

    private Zipper ensureSiblingContext() {
        if (crumb != null) {
            return this;
        }
        return zip(Syntax.block(List.of(node))).down().orElseThrow();
    }

    /// Adds `child` as the first of the focus's children.
    public Zipper insertChild(Node child) {
        final var children = new ArrayList<Node>(node.children().size() + 1);
        children.add(child);
        children.addAll(node.children());
        return replaceChildren(children);
    }

    /// Adds `child` as the last of the focus's children.
    public Zipper appendChild(Node child) {
        final var children = new ArrayList<Node>(node.children());
        children.add(child);
        return replaceChildren(children);
    }

    /// Deletes the focus.
    /// @return the zipper at the node that preceded the focus in depth-first order
    /// @throws IllegalStateException at the root, where there is nothing to remove into
    public Zipper remove() {
        if (crumb == null) {
            throw new IllegalStateException("cannot remove the root node");
        }
        final var left = crumb.left();
        if (!left.isEmpty()) {
            return new Zipper(left.head(), crumb.withLeft(left.tail())).prevDown();
        }
        return new Zipper(crumb.parent().withChildren(crumb.right().toList()), crumb.up());
    }

    @Override
    public String toString() {
        return "Zipper[node=" + node + ", depth=" + depth() + "]";
    }
}
