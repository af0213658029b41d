package com.netgraph.core.generator.impl;

import com.netgraph.core.NetlistFixtures;
import com.netgraph.core.compare.NetlistComparator;
import com.netgraph.core.compare.StructuralDiff;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.NetlistResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link VerilogGenerator}.
 */
class VerilogGeneratorTest {

    private VerilogGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new VerilogGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("verilog");
    }

    @Test
    void getFileExtension_returnsV() {
        assertThat(generator.getFileExtension()).isEqualTo("v");
    }

    @Test
    void generate_withNullModules_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, config))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_defaultName_isOutputNetlistFile() throws NetlistException {
        GeneratedArtifact artifact = generator.generate(parse(NetlistFixtures.BUS_LOGIC), config);

        assertThat(artifact.fileName()).isEqualTo("output_netlist_file.v");
        assertThat(artifact.content()).doesNotStartWith("//");
    }

    @Test
    void generate_withBaseNameAndHeader_appliesConfig() throws NetlistException {
        GeneratorConfig custom = new GeneratorConfig(true, Map.of(GeneratorConfig.BASE_NAME, "rebuilt"));

        GeneratedArtifact artifact = generator.generate(parse(NetlistFixtures.BUS_LOGIC), custom);

        assertThat(artifact.fileName()).isEqualTo("rebuilt.v");
        assertThat(artifact.content()).startsWith("// Generated by netgraph\n");
    }

    @Test
    void renderModule_busLogic_writesExpectedSource() throws NetlistException {
        String source = generator.renderModule(parse(NetlistFixtures.BUS_LOGIC).get(0));

        assertThat(source).isEqualTo("""
            module bus_logic (
                input [3:0] a,
                input en,
                output [1:0] y
            );

                wire [3:0] a;
                wire [1:0] t;

                AND2 g0 (.A(a[0]), .B(en), .Y(t[0]));
                AND2 g1 (.A(a[1]), .B(1'b1), .Y(t[1]));
                BUF b0 (.A(t[0]), .Y(y[0]));
                BUF b1 (.A(t[1]), .Y(y[1]));
                TIE z0 (.LO(), .HI(4'b1010));
            endmodule

            """);
    }

    @Test
    void renderModule_withoutPortsOrWires_keepsHeaderShape() {
        String source = generator.renderModule(new Module("empty", null, null, null, null, null));

        assertThat(source).isEqualTo("module empty (\n\n);\n\nendmodule\n\n");
    }

    @Test
    void generate_output_reparsesToEquivalentNetlist() throws NetlistException {
        List<Module> original = parse(NetlistFixtures.FULL_ADDER);

        String source = generator.generate(original, config).content();
        NetlistResult reparsed = NetlistFixtures.parse(source);

        StructuralDiff diff = new NetlistComparator().compare(original, reparsed.modules());
        assertThat(diff.isEquivalent()).as(diff.differences().toString()).isTrue();
        assertThat(reparsed.diagnostics()).isEmpty();
    }

    private static List<Module> parse(String resource) throws NetlistException {
        return NetlistFixtures.parseResource(resource).modules();
    }
}
