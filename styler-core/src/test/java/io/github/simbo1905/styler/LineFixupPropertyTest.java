package io.github.simbo1905.styler;

import java.util.List;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import static org.assertj.core.api.Assertions.assertThat;

class LineFixupPropertyTest extends StylerTestBase {

    @Provide
    Arbitrary<List<Node>> statements() {
        return Arbitraries.integers().between(1, 2000)
                .<Node>map(line -> stmt("s", line))
                .list().ofMinSize(1).ofMaxSize(30);
    }

    @Property
    void fixedLinesNeverDecreaseAndStartAtTheFloor(@ForAll("statements") List<Node> nodes,
                                                  @ForAll @IntRange(min = 1, max = 2000) int floor) {
        final var lines = LineFixup.fixLineNumbers(nodes, floor).stream().map(Node::line).toList();
        assertThat(lines).hasSameSizeAs(nodes);
        assertThat(lines).isSorted();
        assertThat(lines.get(0)).isGreaterThanOrEqualTo(floor);
    }

    @Property
    void inOrderLinesAtOrAboveTheFloorAreUntouched(@ForAll("statements") List<Node> nodes) {
        final var sorted = nodes.stream()
                .sorted(java.util.Comparator.comparing(Node::line))
                .toList();
        assertThat(LineFixup.fixLineNumbers(sorted, 1)).isEqualTo(sorted);
    }
}
