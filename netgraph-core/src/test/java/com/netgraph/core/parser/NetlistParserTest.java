package com.netgraph.core.parser;

import com.netgraph.core.NetlistFixtures;
import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.CellType;
import com.netgraph.core.model.DiagnosticKind;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetType;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.model.Pin;
import com.netgraph.core.model.Port;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NetlistParser}.
 */
class NetlistParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_wireClauseWithSharedWidth_declaresEachIdentifier() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top (input x);
                wire [3:0] a, b;
            endmodule
            """);

        Module top = result.modules().get(0);
        assertThat(top.netList()).containsExactly(
            new Net("a", NetType.WIRE, new BitRange(3, 0)),
            new Net("b", NetType.WIRE, new BitRange(3, 0)));
    }

    @Test
    void parse_wireClauseWithInlineWidth_overridesClauseDefault() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top;
                wire [3:0] a, [7:0] b, c;
                wire d;
            endmodule
            """);

        assertThat(result.modules().get(0).netList()).containsExactly(
            new Net("a", NetType.WIRE, new BitRange(3, 0)),
            new Net("b", NetType.WIRE, new BitRange(7, 0)),
            new Net("c", NetType.WIRE, new BitRange(3, 0)),
            new Net("d", NetType.WIRE, null));
    }

    @Test
    void parse_sameDeclaredWireOnTwoPins_sharesNet() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top (input a, output y);
                wire n1;
                INV u1 (.A(a), .Y(n1));
                INV u2 (.A(n1), .Y(y));
                BUF u3 (.A(n1), .Y());
            endmodule
            """);

        Module top = result.modules().get(0);
        Pin driver = pin(top, "u1", "Y");
        Pin load = pin(top, "u2", "A");
        Pin other = pin(top, "u3", "A");

        assertThat(driver.net()).isEqualTo(load.net()).isEqualTo(other.net());
        assertThat(top.netOf(load)).contains(new Net("n1", NetType.WIRE, null));
    }

    @Test
    void parse_samePortNameOnTwoPins_createsDistinctPortDerivedNets() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top (input q, output y);
                AND2 u1 (.A(q), .B(q), .Y(y));
            endmodule
            """);

        Module top = result.modules().get(0);
        Pin first = pin(top, "u1", "A");
        Pin second = pin(top, "u1", "B");
        Port q = top.findPort("q").orElseThrow();

        assertThat(first.net()).isNotEqualTo(second.net());
        assertThat(top.netOf(first)).contains(new Net("q", NetType.PORT_DERIVED, BitRange.SINGLE));
        assertThat(q.derivedNets()).containsExactly(first.net(), second.net());
        assertThat(top.nets()).contains(first.net(), second.net());
    }

    @Test
    void parse_identicalConstants_createsDistinctConstantNets() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top (output y);
                AND2 u1 (.A(1'b0), .B(1'b0), .Y(y));
            endmodule
            """);

        Module top = result.modules().get(0);
        Pin first = pin(top, "u1", "A");
        Pin second = pin(top, "u1", "B");

        assertThat(first.net()).isNotEqualTo(second.net());
        assertThat(top.netOf(first)).contains(new Net("1'b0", NetType.CONSTANT, null));
        assertThat(top.netOf(second)).contains(new Net("1'b0", NetType.CONSTANT, null));
        assertThat(top.nets()).doesNotContain(first.net(), second.net());
    }

    @Test
    void parse_bitSelectOfDeclaredWire_createsSingleBitNetLinkedToPort() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC);

        Module bus = result.findModule("bus_logic").orElseThrow();
        Pin selected = pin(bus, "g0", "A");
        Port a = bus.findPort("a").orElseThrow();

        assertThat(bus.netOf(selected)).contains(new Net("a[0]", NetType.WIRE_SINGLE, BitRange.SINGLE));
        assertThat(bus.derivedNets(a)).extracting(Net::name).containsExactly("a[0]", "a[1]");
        assertThat(bus.nets()).doesNotContain(selected.net());
    }

    @Test
    void parse_bitSelectOfInternalWire_createsUnlinkedSingleBitNet() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC);

        Module bus = result.findModule("bus_logic").orElseThrow();

        assertThat(bus.netOf(pin(bus, "g0", "Y"))).contains(new Net("t[0]", NetType.WIRE_SINGLE, BitRange.SINGLE));
        assertThat(bus.allPorts()).allSatisfy(port ->
            assertThat(bus.derivedNets(port)).extracting(Net::name).doesNotContain("t[0]"));
    }

    @Test
    void parse_bitSelectOfUndeclaredPort_fallsBackToPortDerivedNet() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC);

        Module bus = result.findModule("bus_logic").orElseThrow();
        Port y = bus.findPort("y").orElseThrow();

        assertThat(bus.netOf(pin(bus, "b0", "Y"))).contains(new Net("y[0]", NetType.PORT_DERIVED, BitRange.SINGLE));
        assertThat(bus.derivedNets(y)).extracting(Net::name).containsExactly("y[0]", "y[1]");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void parse_emptyConnection_leavesPinUnconnectedWithoutDiagnostic() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC);

        Module bus = result.findModule("bus_logic").orElseThrow();

        assertThat(pin(bus, "z0", "LO").connection()).isEmpty();
        assertThat(result.hasDiagnostics()).isFalse();
    }

    @Test
    void parse_unknownIdentifier_recordsUnresolvedDiagnosticAndContinues() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module top (input a, output y);
                INV u1 (.A(ghost), .Y(y));
                INV u2 (.A(a), .Y(y));
            endmodule
            """);

        Module top = result.modules().get(0);

        assertThat(pin(top, "u1", "A").connection()).isEmpty();
        assertThat(top.instances()).hasSize(2);
        assertThat(result.diagnostics(DiagnosticKind.UNRESOLVED_REFERENCE)).singleElement()
            .satisfies(diagnostic -> {
                assertThat(diagnostic.module()).isEqualTo("top");
                assertThat(diagnostic.line()).isEqualTo(2);
                assertThat(diagnostic.message()).contains("ghost").contains("u1");
            });
    }

    @Test
    void parse_multiLineInstance_collectsPinsUntilTerminator() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.FULL_ADDER);

        Module adder = result.findModule("full_adder").orElseThrow();
        Instance ha2 = adder.findInstance("ha2").orElseThrow();

        assertThat(ha2.pins()).extracting(Pin::name).containsExactly("a", "b", "s", "c");
        assertThat(adder.instances()).extracting(Instance::name).containsExactly("ha1", "ha2", "o1");
    }

    @Test
    void parse_instanceOfKnownModule_isHierarchicalIgnoringCase() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            module Leaf (input a, output y);
            endmodule
            module top (input a, output y);
                LEAF l1 (.a(a), .y(y));
                NAND2 n1 (.A(a), .B(a), .Y(y));
            endmodule
            """);

        Module top = result.findModule("top").orElseThrow();

        assertThat(top.findInstance("l1").orElseThrow().cellType()).isEqualTo(CellType.HIERARCHICAL);
        assertThat(top.findInstance("n1").orElseThrow().cellType()).isEqualTo(CellType.LEAF_LEVEL);
    }

    @Test
    void parse_hierarchicalInstance_takesPinDirectionsFromTemplate() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.FULL_ADDER);

        Module adder = result.findModule("full_adder").orElseThrow();

        assertThat(pin(adder, "ha1", "a").direction()).isEqualTo(Direction.INPUT);
        assertThat(pin(adder, "ha1", "s").direction()).isEqualTo(Direction.OUTPUT);
        assertThat(pin(adder, "o1", "A").direction()).isNull();
    }

    @Test
    void parse_headerAndBodyPorts_recordedInDeclarationOrder() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.FULL_ADDER);

        Module half = result.findModule("half_adder").orElseThrow();
        Module full = result.findModule("full_adder").orElseThrow();

        assertThat(half.inputs()).extracting(Port::name).containsExactly("a", "b");
        assertThat(half.outputs()).extracting(Port::name).containsExactly("s", "c");
        assertThat(full.inputs()).extracting(Port::name).containsExactly("a", "b", "cin");
        assertThat(full.outputs()).extracting(Port::name).containsExactly("sum", "cout");
    }

    @Test
    void parse_widePort_recordsWidth() throws NetlistException {
        NetlistResult result = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC);

        Module bus = result.findModule("bus_logic").orElseThrow();

        assertThat(bus.findPort("a").orElseThrow().width()).isEqualTo(new BitRange(3, 0));
        assertThat(bus.findPort("en").orElseThrow().width()).isNull();
        assertThat(bus.findPort("y").orElseThrow().direction()).isEqualTo(Direction.OUTPUT);
    }

    @Test
    void parse_commentsAndBlankLines_areIgnored() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("""
            // module fake (input a);

            module top (input a, output y);
                // INV ignored (.A(a), .Y(y));
                INV u1 (.A(a), .Y(y));
            endmodule
            """);

        assertThat(result.modules()).extracting(Module::name).containsExactly("top");
        assertThat(result.modules().get(0).instances()).extracting(Instance::name).containsExactly("u1");
    }

    @Test
    void parse_moreModulesThanEndmodules_throwsStructuralMismatch() {
        assertThatThrownBy(() -> NetlistFixtures.parseResource(NetlistFixtures.UNBALANCED))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> assertThat(((NetlistException) e).getKind()).isEqualTo(ErrorKind.STRUCTURAL_MISMATCH))
            .hasMessageContaining("(1)")
            .hasMessageContaining("(0)");
    }

    @Test
    void parse_extraEndmoduleWithSkippedTemplatePass_throwsStructuralMismatch() {
        NetlistParser parser = new NetlistParser();

        assertThatThrownBy(() -> parser.parseSource("""
            module top;
            endmodule
            endmodule
            """, List.of()))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> assertThat(((NetlistException) e).getKind()).isEqualTo(ErrorKind.STRUCTURAL_MISMATCH));
    }

    @Test
    void parse_unterminatedPinToken_throwsMalformedInstanceLine() {
        assertThatThrownBy(() -> NetlistFixtures.parse("""
            module top (input a, output y);
                INV u1 (.A(a), .Y(y;
            endmodule
            """))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> {
                NetlistException error = (NetlistException) e;
                assertThat(error.getKind()).isEqualTo(ErrorKind.MALFORMED_INSTANCE_LINE);
                assertThat(error.getLine()).isEqualTo(2);
            });
    }

    @Test
    void parse_partSelectConnection_throwsMalformedInstanceLine() {
        assertThatThrownBy(() -> NetlistFixtures.parse("""
            module top (input [3:0] a, output y);
                wire [3:0] a;
                AND4 u1 (.A(a[3:0]), .Y(y));
            endmodule
            """))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> assertThat(((NetlistException) e).getKind()).isEqualTo(ErrorKind.MALFORMED_INSTANCE_LINE));
    }

    @Test
    void parse_wireRangeBeyondIntBounds_throwsMalformedDeclaration() {
        NetlistParser parser = new NetlistParser();

        assertThatThrownBy(() -> parser.parseSource("""
            module m (
              input a
            );
              wire [99999999999:0] w;
            endmodule
            """, List.of()))
            .isInstanceOf(NetlistException.class)
            .hasMessageContaining("99999999999")
            .satisfies(e -> {
                NetlistException error = (NetlistException) e;
                assertThat(error.getKind()).isEqualTo(ErrorKind.MALFORMED_DECLARATION);
                assertThat(error.getLine()).isEqualTo(4);
            });
    }

    @Test
    void parse_portRangeBeyondIntBounds_throwsMalformedDeclaration() {
        NetlistParser parser = new NetlistParser();

        assertThatThrownBy(() -> parser.parseSource("""
            module m (input [0:4294967296] a);
            endmodule
            """, List.of()))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> {
                NetlistException error = (NetlistException) e;
                assertThat(error.getKind()).isEqualTo(ErrorKind.MALFORMED_DECLARATION);
                assertThat(error.getLine()).isEqualTo(1);
            });
    }

    @Test
    void parse_missingFile_throwsIoError() {
        NetlistParser parser = new NetlistParser();

        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.v"), List.of()))
            .isInstanceOf(NetlistException.class)
            .satisfies(e -> assertThat(((NetlistException) e).getKind()).isEqualTo(ErrorKind.IO_ERROR));
    }

    @Test
    void parse_emptySource_returnsNoModules() throws NetlistException {
        NetlistResult result = NetlistFixtures.parse("");

        assertThat(result.modules()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    private static Pin pin(Module module, String instance, String pin) {
        return module.findInstance(instance).orElseThrow().pins().stream()
            .filter(p -> p.name().equals(pin))
            .findFirst()
            .orElseThrow();
    }
}
