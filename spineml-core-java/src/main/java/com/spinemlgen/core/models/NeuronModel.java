package com.spinemlgen.core.models;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.handler.ConditionHandler;
import com.spinemlgen.core.handler.ObjectHandler;
import com.spinemlgen.core.handler.RegimeHandlers;
import com.spinemlgen.core.handler.ThresholdConditionHandler;
import com.spinemlgen.core.handler.TimeDerivativeHandler;
import com.spinemlgen.core.handler.UnsupportedHandler;
import com.spinemlgen.core.reader.ComponentClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A neuron body: regime-guarded simulation code plus the spike threshold condition.
 * Analog inputs read the summed synaptic current {@code $(Isyn)}.
 */
public class NeuronModel extends SpineMLModel {

    public static final String SIM_CODE = "simCode";
    public static final String THRESHOLD_CONDITION_CODE = "thresholdConditionCode";
    static final String SYNAPTIC_INPUT = "Isyn";

    NeuronModel(ComponentClass component, Set<String> variableParams, String spikePort, TranslationListener listener) {
        super(component, variableParams, listener);

        RegimeCodeStream simCode = new RegimeCodeStream();
        ThresholdConditionHandler threshold = new ThresholdConditionHandler(component, spikePort);
        ObjectHandler unsupported = new UnsupportedHandler(component);
        RegimeHandlers handlers = new RegimeHandlers(
                new ConditionHandler(component, simCode).andThen(threshold),
                unsupported,
                unsupported,
                new TimeDerivativeHandler(component, simCode));
        generateModelCode(component, handlers, List.of(simCode), listener);

        Map<String, String> ports = new LinkedHashMap<>();
        for (String port : component.getAnalogReceivePorts()) ports.put(port, SYNAPTIC_INPUT);
        for (String port : component.getAnalogReducePorts()) ports.put(port, SYNAPTIC_INPUT);

        Map<String, String> raw = new LinkedHashMap<>();
        raw.put(SIM_CODE, simCode.code());
        raw.put(THRESHOLD_CONDITION_CODE, threshold.getThresholdConditionCode());
        substituteCode(raw, ports, listener);
    }

    public String getSimCode()                { return code(SIM_CODE); }
    public String getThresholdConditionCode() { return code(THRESHOLD_CONDITION_CODE); }
}
