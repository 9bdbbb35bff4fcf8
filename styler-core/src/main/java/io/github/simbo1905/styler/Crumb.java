package io.github.simbo1905.styler;

/// One level of zipper context: the siblings around the focus and the parent they were taken from.
///
/// `parent` is the node as it was before descending; rebuilding only consults its shape, never its
/// old children. `up` is null at the outermost level.
record Crumb(Siblings left, Node parent, Siblings right, Crumb up) {

    Crumb withLeft(Siblings left) {
        return new Crumb(left, parent, right, up);
    }

    Crumb withRight(Siblings right) {
        return new Crumb(left, parent, right, up);
    }
}
