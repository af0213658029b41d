package com.netgraph.core.compare;

import com.netgraph.core.NetlistFixtures;
import com.netgraph.core.model.NetlistResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link NetlistComparator}.
 */
class NetlistComparatorTest {

    private static final String BASE = """
        module top (input a, input b, output y);
            wire n1;
            AND2 u1 (.A(a), .B(b), .Y(n1));
            INV u2 (.A(n1), .Y(y));
        endmodule
        """;

    private final NetlistComparator comparator = new NetlistComparator();

    @Test
    void compare_sameSource_isEquivalent() throws Exception {
        StructuralDiff diff = comparator.compare(parse(BASE).modules(), parse(BASE).modules());

        assertThat(diff.isEquivalent()).isTrue();
    }

    @Test
    void compare_formattingOnlyChanges_isEquivalent() throws Exception {
        String reformatted = """
            // same design, different layout
            module top (
                input a,
                input b,
                output y
            );
                wire n1;
                AND2 u1 (
                    .A(a),
                    .B(b),
                    .Y(n1)
                );
                INV u2 (.A(n1), .Y(y));
            endmodule
            """;

        assertThat(comparator.compare(parse(BASE).modules(), parse(reformatted).modules()).isEquivalent()).isTrue();
    }

    @Test
    void compare_rewiredPin_reportsPinDifference() throws Exception {
        String rewired = BASE.replace(".A(n1), .Y(y)", ".A(a), .Y(y)");

        StructuralDiff diff = comparator.compare(parse(BASE).modules(), parse(rewired).modules());

        assertThat(diff.differences()).singleElement()
            .satisfies(line -> assertThat(line).contains("pins of u2 differ"));
    }

    @Test
    void compare_portWidthChange_reportsPortDifference() throws Exception {
        String widened = BASE.replace("input a,", "input [1:0] a,");

        StructuralDiff diff = comparator.compare(parse(BASE).modules(), parse(widened).modules());

        assertThat(diff.differences()).anySatisfy(line -> assertThat(line).contains("input ports differ"));
    }

    @Test
    void compare_missingModules_reportedOnBothSides() throws Exception {
        NetlistResult left = parse(BASE);
        NetlistResult right = parse(BASE.replace("module top", "module other"));

        StructuralDiff diff = comparator.compare(left.modules(), right.modules());

        assertThat(diff.differences()).containsExactly(
            "Module top missing on right",
            "Module other missing on left");
    }

    @Test
    void compare_extraInstance_reportsCount() throws Exception {
        String extra = BASE.replace("endmodule", "    INV u3 (.A(y), .Y());\nendmodule");

        StructuralDiff diff = comparator.compare(parse(BASE).modules(), parse(extra).modules());

        assertThat(diff.differences()).containsExactly("top: instance count 2 vs 3");
    }

    @Test
    void compare_nullSide_throwsException() {
        assertThatThrownBy(() -> comparator.compare(null, List.of()))
            .isInstanceOf(NullPointerException.class);
    }

    private static NetlistResult parse(String source) throws Exception {
        return NetlistFixtures.parse(source);
    }
}
