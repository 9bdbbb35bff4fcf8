package io.github.simbo1905.styler.rules;

import java.util.List;

import io.github.simbo1905.styler.Rule;

/// The default rule catalog, in the order rules run at each node.
///
/// Pipe rules come first so that a chain optimized into a single call can be unwrapped by
/// [SinglePipeUnwrap] at the same node. [AliasLifting] is last at each node, but it works from the
/// `defmodule` node, so it sees the module body before any other rule has visited the statements
/// in it. The traversal then descends into the lifted body and the other rules style it.
public final class StyleRules {

    private StyleRules() {
    }

    public static List<Rule> catalog() {
        return List.of(
                new PipeChainStart(),
                new PipeChainOptimizer(),
                new SinglePipeUnwrap(),
                new SingleNodeRewrites(),
                new UnlessRewrite(),
                new Deprecations(),
                new AliasLifting());
    }
}
