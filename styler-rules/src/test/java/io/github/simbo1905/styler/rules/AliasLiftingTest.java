package io.github.simbo1905.styler.rules;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.StylerConfig;
import io.github.simbo1905.styler.Syntax;

import static org.assertj.core.api.Assertions.assertThat;

class AliasLiftingTest extends RulesTestBase {

    private static final AliasLifting RULE = new AliasLifting();

    private static final Node MODULEDOC = local("@", 2, local("moduledoc", 2, lit(false, 2)));

    /// Statements of the first `defmodule` body in `root`.
    private static List<Node> body(Node root) {
        final var doList = ((Call) root).args().get(1);
        return Syntax.statements(Syntax.keywordValue(doList, Syntax.DO).orElseThrow());
    }

    @Test
    void repeatedLongPathIsLiftedAfterTheDirectives() {
        final var root = defmodule("A", 1,
                MODULEDOC,
                def("f", 3, remote("X.Y.Zed", "f", 3)),
                def("g", 4, remote("X.Y.Zed", "g", 4)));

        final var styled = style(RULE, root);

        assertThat(plain(styled)).isEqualTo(plain(defmodule("A", 1,
                MODULEDOC,
                alias("X.Y.Zed", 2),
                def("f", 3, remote("Zed", "f", 3)),
                def("g", 4, remote("Zed", "g", 4)))));
        assertThat(body(styled)).extracting(Node::line).containsExactly(2, 2, 3, 4);
    }

    @Test
    void withoutDirectivesTheAliasGoesFirst() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Zed", "g", 3)));

        final var styled = style(RULE, root);

        assertThat(body(styled)).first().satisfies(statement ->
                assertThat(plain(statement)).isEqualTo(plain(alias("X.Y.Zed", 2))));
    }

    @Test
    void singleUseIsNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Other", "g", 3)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void shortPathsAreNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("Y.Zed", "f", 2)),
                def("g", 3, remote("Y.Zed", "g", 3)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void excludedNamesAreNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Zed", "g", 3)));
        final var config = StylerConfig.standard().withAliasLiftingExclude(Set.of("Elixir.Zed"));

        assertThat(style(config, RULE, root)).isEqualTo(root);
    }

    @Test
    void standardLibraryNamesAreNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Enum", "f", 2)),
                def("g", 3, remote("X.Y.Enum", "g", 3)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void existingAliasNameIsNotReused() {
        final var root = defmodule("A", 1,
                alias("Other.Zed", 2),
                def("f", 3, remote("X.Y.Zed", "f", 3)),
                def("g", 4, remote("X.Y.Zed", "g", 4)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void alreadyAliasedPathIsLeftAlone() {
        final var root = defmodule("A", 1,
                alias("X.Y.Zed", 2),
                def("f", 3, remote("X.Y.Zed", "f", 3)),
                def("g", 4, remote("X.Y.Zed", "g", 4)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void nameUsedAsAPathPrefixIsNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Zed", "g", 3)),
                def("h", 4, remote("Zed.Thing", "h", 4)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void nestedModuleNameIsNotLifted() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Zed", "g", 3)),
                defmodule("Zed", 4, var("ok", 5)));

        assertThat(style(RULE, root)).isEqualTo(root);
    }

    @Test
    void firstSeenOfTwoCollidingPathsWins() {
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("P.Q.Zed", "g", 3)),
                def("h", 4, remote("X.Y.Zed", "h", 4)),
                def("i", 5, remote("P.Q.Zed", "i", 5)));

        final var styled = style(RULE, root);

        assertThat(plain(styled)).isEqualTo(plain(defmodule("A", 1,
                alias("X.Y.Zed", 2),
                def("f", 2, remote("Zed", "f", 2)),
                def("g", 3, remote("P.Q.Zed", "g", 3)),
                def("h", 4, remote("Zed", "h", 4)),
                def("i", 5, remote("P.Q.Zed", "i", 5)))));
    }

    @Test
    void nestedAliasOfALiftedPathIsRemoved() {
        final var nested = local("def", 4, var("h", 4), Syntax.doBlock(block(4,
                alias("X.Y.Zed", 5),
                lit("ok", 6))));
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                nested);

        final var styled = style(RULE, root);

        assertThat(plain(styled)).isEqualTo(plain(defmodule("A", 1,
                alias("X.Y.Zed", 2),
                def("f", 2, remote("Zed", "f", 2)),
                local("def", 4, var("h", 4), Syntax.doBlock(block(4, lit("ok", 6)))))));
    }

    @Test
    void quotedCodeIsNeitherCountedNorRewritten() {
        final var quoted = local("quote", 4, Syntax.doBlock(remote("X.Y.Zed", "q", 5)));
        final var root = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                def("g", 3, remote("X.Y.Zed", "g", 3)),
                quoted);

        final var styled = style(RULE, root);

        assertThat(body(styled)).hasSize(4);
        assertThat(body(styled).get(3)).isEqualTo(quoted);

        final var onlyInQuote = defmodule("A", 1,
                def("f", 2, remote("X.Y.Zed", "f", 2)),
                quoted);
        assertThat(style(RULE, onlyInQuote)).isEqualTo(onlyInQuote);
    }
}
