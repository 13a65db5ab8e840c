package com.spinemlgen.generator.network;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.TranslationException.UnsupportedFeatureException;
import com.spinemlgen.core.reader.ComponentReader;
import com.spinemlgen.core.reader.Dom;
import com.spinemlgen.generator.network.NetworkDescription.ModelProperties;
import com.spinemlgen.generator.network.NetworkDescription.PopulationDescription;
import com.spinemlgen.generator.network.NetworkDescription.ProjectionDescription;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reads a low-level SpineML network document ({@code LL:SpineML}) into a {@link NetworkDescription}.
 *
 * Every {@code Property} with a {@code FixedValue} is fixed; any other property is variable and
 * becomes part of the {@link ModelKey}.
 */
public class NetworkReader {

    /** Neuron url that denotes a spike source instead of a component document. */
    public static final String SPIKE_SOURCE = "SpikeSource";

    /** Supported connectors, in the order they are looked for. */
    static final String[] CONNECTOR_TAGS = {
        "OneToOneConnection", "AllToAllConnection", "FixedProbabilityConnection", "ConnectionList"
    };

    public NetworkDescription read(Path networkPath) {
        return read(networkPath, null);
    }

    /**
     * @param networkName name to give the network; null to derive it from the file name
     */
    public NetworkDescription read(Path networkPath, String networkName) {
        if (!Files.exists(networkPath)) {
            throw new ConfigurationException("Network file not found: " + networkPath);
        }
        Document document;
        try (InputStream in = Files.newInputStream(networkPath)) {
            document = ComponentReader.parse(in, networkPath.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Could not open network file: " + networkPath + ": " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (root == null || !"SpineML".equals(Dom.tagOf(root))) {
            throw new ConfigurationException("XML file: " + networkPath
                    + " is not a low-level SpineML network - it has no root SpineML node");
        }

        Path basePath = networkPath.toAbsolutePath().getParent();
        List<PopulationDescription> populations = new ArrayList<>();
        for (Element population : Dom.children(root, "Population")) {
            populations.add(readPopulation(population, basePath));
        }
        String name = networkName != null ? networkName : baseName(networkPath);
        return new NetworkDescription(name, basePath, populations);
    }

    private PopulationDescription readPopulation(Element population, Path basePath) {
        Element neuron = Dom.child(population, "Neuron");
        if (neuron == null) {
            throw new ConfigurationException("'Population' node has no 'Neuron' node");
        }
        String rawName = Dom.attr(neuron, "name");
        if (rawName == null) {
            throw new ConfigurationException("'Neuron' node has no name");
        }
        String name = SafeNames.getSafeName(rawName);
        int size = readSize(neuron, name);

        ModelProperties neuronProperties = SPIKE_SOURCE.equals(Dom.attr(neuron, "url"))
                ? null
                : readModelProperties(neuron, basePath, "Neuron '" + name + "'");

        List<ProjectionDescription> projections = new ArrayList<>();
        for (Element projection : Dom.children(population, "Projection")) {
            projections.add(readProjection(projection, name, basePath));
        }
        return new PopulationDescription(name, size, neuronProperties, projections);
    }

    private ProjectionDescription readProjection(Element projection, String source, Path basePath) {
        String rawTarget = Dom.attr(projection, "dst_population");
        if (rawTarget == null) {
            throw new ConfigurationException("Projection from population '" + source + "' has no dst_population");
        }
        String target = SafeNames.getSafeName(rawTarget);
        String where = "Projection " + source + "->" + target;

        Element synapse = Dom.child(projection, "Synapse");
        if (synapse == null) {
            throw new ConfigurationException("'Projection' node has no 'Synapse' node (" + where + ")");
        }
        Element weightUpdate = Dom.child(synapse, "WeightUpdate");
        if (weightUpdate == null) {
            throw new ConfigurationException("'Synapse' node has no 'WeightUpdate' node (" + where + ")");
        }
        Element postSynapse = Dom.child(synapse, "PostSynapse");
        if (postSynapse == null) {
            throw new ConfigurationException("'Synapse' node has no 'PostSynapse' node (" + where + ")");
        }

        Element connector = findConnector(synapse, where);
        return new ProjectionDescription(
                source, target, Dom.tagOf(connector), readDelay(connector, where),
                readModelProperties(weightUpdate, basePath, where + " weight update"),
                readModelProperties(postSynapse, basePath, where + " postsynapse"));
    }

    /** The component url plus the fixed/variable split of its properties. */
    static ModelProperties readModelProperties(Element node, Path basePath, String where) {
        String url = Dom.attr(node, "url");
        if (url == null) {
            throw new ConfigurationException(where + " has no url");
        }

        Map<String, Double> fixedValues = new LinkedHashMap<>();
        TreeSet<String> variableParams = new TreeSet<>();
        for (Element property : Dom.children(node, "Property")) {
            String name = Dom.attr(property, "name");
            if (name == null) {
                throw new ConfigurationException(where + " has a Property without a name");
            }
            Element fixedValue = Dom.child(property, "FixedValue");
            if (fixedValue != null) {
                fixedValues.put(name, parseDouble(Dom.attr(fixedValue, "value"), where + " property '" + name + "'"));
            } else {
                variableParams.add(name);
            }
        }
        return new ModelProperties(new ModelKey(basePath.resolve(url), variableParams), fixedValues);
    }

    private static Element findConnector(Element synapse, String where) {
        for (String tag : CONNECTOR_TAGS) {
            Element connector = Dom.child(synapse, tag);
            if (connector != null) {
                return connector;
            }
        }
        throw new UnsupportedFeatureException("No supported connection type found for projection (" + where + ")");
    }

    /** Delay of the connector in ms; only a single fixed value is supported. */
    static double readDelay(Element connector, String where) {
        Element delay = Dom.child(connector, "Delay");
        if (delay == null) {
            throw new ConfigurationException("Connector has no 'Delay' node (" + where + ")");
        }
        Element fixedValue = Dom.child(delay, "FixedValue");
        if (fixedValue == null) {
            throw new UnsupportedFeatureException(
                    "Only projections with a single delay value are supported (" + where + ")");
        }
        double value = parseDouble(Dom.attr(fixedValue, "value"), where + " delay");
        if (value < 0) {
            throw new UnsupportedFeatureException("Negative delay " + value + " ms is not supported (" + where + ")");
        }
        return value;
    }

    private static int readSize(Element neuron, String name) {
        String size = Dom.attr(neuron, "size");
        try {
            return Integer.parseInt(size);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Population '" + name + "' has an invalid size: " + size, e);
        }
    }

    private static double parseDouble(String value, String where) {
        if (value == null) {
            throw new ConfigurationException(where + ": FixedValue has no value");
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(where + ": FixedValue '" + value + "' is not a number", e);
        }
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
