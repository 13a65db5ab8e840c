package com.spinemlgen.core.models;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.handler.ConditionHandler;
import com.spinemlgen.core.handler.EventHandler;
import com.spinemlgen.core.handler.RegimeHandlers;
import com.spinemlgen.core.handler.TimeDerivativeHandler;
import com.spinemlgen.core.handler.UnsupportedHandler;
import com.spinemlgen.core.reader.ComponentClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A weight update model: presynaptic spike handling in {@code simCode} and continuous
 * synapse dynamics in {@code synapseDynamicsCode}. Analog receive ports read the presynaptic
 * neuron's variables as {@code $(name_pre)}.
 */
public class WeightUpdateModel extends SpineMLModel {

    public static final String SIM_CODE = "simCode";
    public static final String SYNAPSE_DYNAMICS_CODE = "synapseDynamicsCode";
    static final String PRE_SUFFIX = "_pre";

    WeightUpdateModel(ComponentClass component, Set<String> variableParams, TranslationListener listener) {
        super(component, variableParams, listener);

        RegimeCodeStream simCode = new RegimeCodeStream();
        RegimeCodeStream synapseDynamicsCode = new RegimeCodeStream();
        RegimeHandlers handlers = new RegimeHandlers(
                new ConditionHandler(component, synapseDynamicsCode),
                new EventHandler(component, simCode),
                new UnsupportedHandler(component),
                new TimeDerivativeHandler(component, synapseDynamicsCode));
        generateModelCode(component, handlers, List.of(simCode, synapseDynamicsCode), listener);

        Map<String, String> ports = new LinkedHashMap<>();
        for (String port : component.getAnalogReceivePorts()) ports.put(port, port + PRE_SUFFIX);

        Map<String, String> raw = new LinkedHashMap<>();
        raw.put(SIM_CODE, simCode.code());
        raw.put(SYNAPSE_DYNAMICS_CODE, synapseDynamicsCode.code());
        substituteCode(raw, ports, listener);
    }

    public String getSimCode()             { return code(SIM_CODE); }
    public String getSynapseDynamicsCode() { return code(SYNAPSE_DYNAMICS_CODE); }
}
