package io.github.simbo1905.styler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node.Meta;

/// Base class for core tests.
/// - Emits an INFO banner per test.
/// - Builds small trees without parser noise.
public class StylerTestBase extends StylerLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.styler");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    /// Sequence whose non-node items become leaves.
    static Node list(Object... items) {
        return Node.seq(Arrays.stream(items).map(StylerTestBase::node).toList());
    }

    static Node node(Object item) {
        return item instanceof Node n ? n : Node.leaf(item);
    }

    /// Statement call `name` on `line`.
    static Node stmt(String name, int line) {
        return Syntax.variable(name, Meta.line(line));
    }

    static Node aliasDecl(int line, String... path) {
        return Node.call("alias", Meta.line(line), Syntax.aliases(Meta.line(line), List.of(path)));
    }
}
