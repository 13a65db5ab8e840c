package com.spinemlgen.generator;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/** Locates the network fixtures under src/test/resources/networks. */
final class Networks {

    private Networks() {}

    static Path fixture(String fileName) {
        URL url = Networks.class.getResource("/networks/" + fileName);
        if (url == null) throw new IllegalArgumentException("No fixture: " + fileName);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Writes a low-level network document holding {@code populations} into {@code dir}. */
    static Path network(Path dir, String populations) throws IOException {
        Path file = dir.resolve("net.xml");
        Files.writeString(file, """
                <LL:SpineML xmlns="http://www.shef.ac.uk/SpineMLNetworkLayer"
                            xmlns:LL="http://www.shef.ac.uk/SpineMLLowLevelNetworkLayer">
                """ + populations + "\n</LL:SpineML>\n");
        return file;
    }

    /** A spike source population with one projection whose synapse body is {@code synapse}. */
    static String spikeSourceProjecting(String source, String target, String synapse) {
        return """
                <LL:Population>
                    <LL:Neuron name="%s" size="4" url="SpikeSource"/>
                    <LL:Projection dst_population="%s">
                        <LL:Synapse>
                %s
                        </LL:Synapse>
                    </LL:Projection>
                </LL:Population>
                """.formatted(source, target, synapse);
    }

    static final String WEIGHT_UPDATE = """
            <LL:WeightUpdate url="StaticWeight.xml"><Property name="w"><FixedValue value="1"/></Property></LL:WeightUpdate>
            """;

    static final String POST_SYNAPSE = """
            <LL:PostSynapse url="CurrentExp.xml"/>
            """;

    static final String ONE_TO_ONE = """
            <OneToOneConnection><Delay><FixedValue value="1"/></Delay></OneToOneConnection>
            """;
}
