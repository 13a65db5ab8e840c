package com.spinemlgen.generator.network;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A low-level SpineML network as read from its document, in document order.
 *
 * @param basePath directory of the network file; component URLs are resolved against it
 */
public record NetworkDescription(
    String name,
    Path basePath,
    List<PopulationDescription> populations
) {

    /**
     * @param neuron null for a spike source
     */
    public record PopulationDescription(
        String name,
        int size,
        ModelProperties neuron,
        List<ProjectionDescription> projections
    ) {
        public boolean isSpikeSource() { return neuron == null; }
    }

    /**
     * @param connector element name of the connectivity, e.g. {@code OneToOneConnection}
     * @param delay     synaptic delay in ms
     */
    public record ProjectionDescription(
        String source,
        String target,
        String connector,
        double delay,
        ModelProperties weightUpdate,
        ModelProperties postsynapse
    ) {}

    /**
     * Properties of one model reference: which are variable (part of the key) and the values
     * of the fixed ones.
     */
    public record ModelProperties(ModelKey key, Map<String, Double> fixedValues) {

        /** Every property named by the reference, fixed or variable, sorted. */
        public Set<String> propertyNames() {
            Set<String> names = new TreeSet<>(fixedValues.keySet());
            names.addAll(key.variableParams());
            return Collections.unmodifiableSet(names);
        }
    }
}
