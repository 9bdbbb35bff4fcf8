package io.github.simbo1905.styler.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Comments;
import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Meta;
import io.github.simbo1905.styler.Node.Pair;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.SourceTree;
import io.github.simbo1905.styler.Styler;
import io.github.simbo1905.styler.StylerConfig;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Trees;

/// Base class for rule tests.
/// - Emits an INFO banner per test.
/// - Builds the trees the parser would produce for small snippets.
/// - Styles them with one rule or the whole catalog.
public class RulesTestBase extends RulesLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.styler.rules");

    static final String FILE = "lib/example.ex";

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    // ---- styling ----

    static SourceTree style(StylerConfig config, List<Rule> rules, Node root, Comments comments) {
        return new Styler(config, rules).style(new SourceTree(root, comments, FILE));
    }

    static Node style(Rule rule, Node root) {
        return style(StylerConfig.standard(), List.of(rule), root, Comments.empty()).root();
    }

    static Node style(StylerConfig config, Rule rule, Node root) {
        return style(config, List.of(rule), root, Comments.empty()).root();
    }

    static Node styleAll(Node root) {
        return style(StylerConfig.standard(), StyleRules.catalog(), root, Comments.empty()).root();
    }

    /// Tree without positions, for comparing shapes.
    static Node plain(Node node) {
        return Trees.withoutMeta(node);
    }

    // ---- snippets ----

    static Meta at(int line) {
        return Meta.line(line);
    }

    static Call var(String name, int line) {
        return Syntax.variable(name, at(line));
    }

    static Call lit(Object value, int line) {
        return Syntax.literal(value, at(line));
    }

    static Call local(String name, int line, Node... args) {
        return Syntax.local(name, at(line), List.of(args));
    }

    /// `Mod.Path.fun(args)` with the module path given dotted.
    static Call remote(String module, String fun, int line, Node... args) {
        return Syntax.remoteCall(path(module), fun, at(line), List.of(args));
    }

    static Call aliases(String module, int line) {
        return Syntax.aliases(at(line), path(module));
    }

    static Call pipe(int line, Node lhs, Node rhs) {
        return Syntax.pipe(at(line), lhs, rhs);
    }

    static Call block(int line, Node... statements) {
        return Syntax.block(at(line), List.of(statements));
    }

    static Call alias(String module, int line) {
        return local("alias", line, aliases(module, line));
    }

    /// `pattern -> body` clause.
    static Call clause(Node pattern, Node body) {
        return Node.call("->", Meta.NONE, Node.seq(pattern), body);
    }

    /// `do ... else ... end` clause list.
    static Node doElse(Node doBody, Node elseBody) {
        return Node.seq(new Pair(Syntax.atom(Syntax.DO), doBody), new Pair(Syntax.atom(Syntax.ELSE), elseBody));
    }

    /// `def name, do: body`
    static Call def(String name, int line, Node body) {
        return local("def", line, var(name, line), Node.seq(Syntax.keyword(Syntax.DO, body)));
    }

    /// `defmodule Name do ... end` with the statements as its body.
    static Call defmodule(String name, int line, Node... body) {
        return local("defmodule", line, aliases(name, line), Syntax.doBlock(block(line, body)));
    }

    static List<String> path(String dotted) {
        return Arrays.asList(dotted.split("\\."));
    }
}
