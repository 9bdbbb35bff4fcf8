package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Persistent singly linked list of sibling nodes, nearest sibling first.
///
/// Moving the zipper one step sideways pops one list and pushes onto the other, so both
/// operations share every cell they do not touch.
final class Siblings {

    static final Siblings EMPTY = new Siblings(null, null, 0);

    private final Node head;
    private final Siblings tail;
    private final int size;

    private Siblings(Node head, Siblings tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    /// Builds a list whose head is `nodes.get(0)`.
    static Siblings of(List<Node> nodes) {
        var result = EMPTY;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            result = result.push(nodes.get(i));
        }
        return result;
    }

    Siblings push(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return new Siblings(node, this, size + 1);
    }

    /// Pushes `nodes` so that `nodes.get(0)` ends up nearest.
    Siblings pushAll(List<Node> nodes) {
        var result = this;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            result = result.push(nodes.get(i));
        }
        return result;
    }

    /// Pushes `nodes` in order so that the last of them ends up nearest.
    Siblings pushEach(List<Node> nodes) {
        var result = this;
        for (final var node : nodes) {
            result = result.push(node);
        }
        return result;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    Node head() {
        if (isEmpty()) {
            throw new IllegalStateException("no siblings");
        }
        return head;
    }

    Siblings tail() {
        if (isEmpty()) {
            throw new IllegalStateException("no siblings");
        }
        return tail;
    }

    /// {@return the siblings nearest first}
    List<Node> toList() {
        final var out = new ArrayList<Node>(size);
        for (var cell = this; !cell.isEmpty(); cell = cell.tail) {
            out.add(cell.head);
        }
        return out;
    }

    /// {@return the siblings farthest first, i.e. in source order for a left list}
    List<Node> toReversedList() {
        final var out = new Node[size];
        int i = size - 1;
        for (var cell = this; !cell.isEmpty(); cell = cell.tail) {
            out[i--] = cell.head;
        }
        return List.of(out);
    }

    @Override
    public String toString() {
        return "Siblings" + toList();
    }
}
