package com.spinemlgen.generator;

import com.google.gson.Gson;
import com.spinemlgen.core.TranslationException.ReferenceException;
import com.spinemlgen.generator.ir.NetworkIr;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorMainTest {

    private static Path quietConfig(Path dir, String extra) throws IOException {
        Path config = dir.resolve("config.json");
        Files.writeString(config, "{\"quiet\": true" + extra + "}");
        return config;
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class, () -> GeneratorMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"unknown-cmd"}));
    }

    @Test
    void missingNetworkFlagThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--network", "/tmp/net.xml"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--foo", "bar"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        Exception ex = assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--network"}));
        assertNotNull(ex.getMessage());
    }

    @Test
    void invalidDtThrowsUsageException() {
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--network", "n.xml", "--output", "/tmp", "--dt", "fast"}));
        assertThrows(GeneratorMain.UsageException.class,
                () -> GeneratorMain.run(new String[]{"generate", "--network", "n.xml", "--output", "/tmp", "--dt", "-1"}));
    }

    @Test
    void generatesNetworkIr(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out");
        Path irPath = GeneratorMain.run(new String[]{
                "generate",
                "--network", Networks.fixture("network.xml").toString(),
                "--output", out.toString(),
                "--config", quietConfig(tmp, "").toString()});

        assertEquals(out.resolve("network_model.json"), irPath);
        assertTrue(Files.exists(out.resolve("metadata.json")));

        NetworkIr.IrRoot root = new Gson().fromJson(Files.readString(irPath), NetworkIr.IrRoot.class);
        assertEquals("network", root.networkName);
        assertEquals(3, root.populations.size());
        assertEquals(3, root.projections.size());
        assertEquals(4, root.models.size());
        assertEquals("neuron_body::LeakyIntegrateAndFire.xml[]", root.models.get(0).id);
    }

    @Test
    void configSuppliesNameAndOutputAndDtFlagOverrides(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("from-config");
        Path config = quietConfig(tmp, ", \"network_name\": \"balanced\", \"dt\": 0.1, \"output_dir\": \""
                + out.toString().replace("\\", "\\\\") + "\"");

        Path irPath = GeneratorMain.run(new String[]{
                "generate",
                "--network", Networks.fixture("network.xml").toString(),
                "--config", config.toString(),
                "--dt", "0.5"});

        assertEquals(out.resolve("balanced_model.json"), irPath);
        NetworkIr.IrRoot root = new Gson().fromJson(Files.readString(irPath), NetworkIr.IrRoot.class);
        assertEquals(0.5, root.dt);
        assertEquals(1, root.projections.get(0).delaySteps);
        assertEquals(2, root.projections.get(1).delaySteps);
    }

    @Test
    void repeatedRunsProduceIdenticalIr(@TempDir Path tmp) throws Exception {
        String[] args = {
                "generate",
                "--network", Networks.fixture("network.xml").toString(),
                "--output", tmp.resolve("out").toString(),
                "--config", quietConfig(tmp, "").toString()};

        String first = Files.readString(GeneratorMain.run(args));
        String second = Files.readString(GeneratorMain.run(args));
        assertEquals(first, second);
    }

    @Test
    void translationErrorsPropagate(@TempDir Path tmp) throws Exception {
        Path network = Networks.network(tmp, Networks.spikeSourceProjecting("A", "Missing",
                Networks.ONE_TO_ONE + Networks.WEIGHT_UPDATE + Networks.POST_SYNAPSE));

        assertThrows(ReferenceException.class, () -> GeneratorMain.run(new String[]{
                "generate",
                "--network", network.toString(),
                "--output", tmp.resolve("out").toString(),
                "--config", quietConfig(tmp, "").toString()}));
    }
}
