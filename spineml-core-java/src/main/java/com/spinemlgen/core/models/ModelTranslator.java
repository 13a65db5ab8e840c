package com.spinemlgen.core.models;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.core.reader.ComponentReader;

import java.nio.file.Path;
import java.util.Set;

/**
 * Entry point for translating one component document into a {@link SpineMLModel}.
 *
 * Translation is a pure function of the document and the variable parameter set: translating
 * the same inputs twice yields identical regime IDs, variable order and code.
 */
public class ModelTranslator {

    public static final String DEFAULT_SPIKE_PORT = "spike";

    private final ComponentReader reader;
    private final TranslationListener listener;
    private final String spikePort;

    public ModelTranslator() {
        this(TranslationListener.NONE, DEFAULT_SPIKE_PORT);
    }

    public ModelTranslator(TranslationListener listener, String spikePort) {
        this.reader = new ComponentReader(listener);
        this.listener = listener;
        this.spikePort = spikePort;
    }

    public NeuronModel translateNeuron(Path url, Set<String> variableParams) {
        return new NeuronModel(reader.read(url, ComponentKind.NEURON_BODY), variableParams, spikePort, listener);
    }

    public PostsynapticModel translatePostsynaptic(Path url, Set<String> variableParams) {
        return new PostsynapticModel(reader.read(url, ComponentKind.POSTSYNAPTIC), variableParams, listener);
    }

    public WeightUpdateModel translateWeightUpdate(Path url, Set<String> variableParams) {
        return new WeightUpdateModel(reader.read(url, ComponentKind.WEIGHT_UPDATE), variableParams, listener);
    }

    /** Reads the component at {@code url}, which must be of the given kind, and translates it. */
    public SpineMLModel translate(Path url, ComponentKind kind, Set<String> variableParams) {
        return translate(reader.read(url, kind), variableParams);
    }

    /** Translates an already-read component according to its kind. */
    public SpineMLModel translate(ComponentClass component, Set<String> variableParams) {
        return switch (component.getKind()) {
            case NEURON_BODY   -> new NeuronModel(component, variableParams, spikePort, listener);
            case POSTSYNAPTIC  -> new PostsynapticModel(component, variableParams, listener);
            case WEIGHT_UPDATE -> new WeightUpdateModel(component, variableParams, listener);
        };
    }
}
