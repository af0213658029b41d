package com.netgraph.core.generator.impl;

import com.netgraph.core.NetlistFixtures;
import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.model.Module;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SummaryGenerator}.
 */
class SummaryGeneratorTest {

    private SummaryGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SummaryGenerator();
    }

    @Test
    void getFileExtension_returnsMd() {
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void generate_fullAdder_containsTotalsAndSections() throws Exception {
        List<Module> modules = NetlistFixtures.parseResource(NetlistFixtures.FULL_ADDER).modules();

        GeneratedArtifact artifact = generator.generate(modules, GeneratorConfig.defaults());

        assertThat(artifact.fileName()).isEqualTo("netlist_summary.md");
        assertThat(artifact.content())
            .startsWith("# Netlist Summary")
            .contains("**Modules:** 2")
            .contains("**Instances:** 5")
            .contains("## half_adder")
            .contains("## full_adder")
            .contains("| ha1 | half_adder | hierarchical |")
            .contains("| o1 | OR2 | leaf-level |");
    }

    @Test
    void generate_busLogic_showsDerivedNetsAndUnconnectedPins() throws Exception {
        List<Module> modules = NetlistFixtures.parseResource(NetlistFixtures.BUS_LOGIC).modules();

        String content = generator.generate(modules, GeneratorConfig.defaults()).content();

        assertThat(content)
            .contains("| a | input | [3:0] | a[0], a[1] |")
            .contains("| y[0] | port-derived | [1:0] |")
            .contains("LO → _unconnected_");
    }

    @Test
    void generate_emptyModule_printsPlaceholders() {
        Module empty = new Module("empty", null, null, null, null, null);

        String content = generator.generate(List.of(empty), GeneratorConfig.defaults()).content();

        assertThat(content)
            .contains("No ports.")
            .contains("No nets.")
            .contains("No instances.");
    }
}
