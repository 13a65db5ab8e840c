package com.spinemlgen.core.models;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.codegen.TokenSubstitution;
import com.spinemlgen.core.handler.ConditionHandler;
import com.spinemlgen.core.handler.ImpulseHandler;
import com.spinemlgen.core.handler.RegimeHandlers;
import com.spinemlgen.core.handler.TimeDerivativeHandler;
import com.spinemlgen.core.handler.UnsupportedHandler;
import com.spinemlgen.core.reader.ComponentClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A postsynaptic model.
 *
 * <ul>
 *   <li>{@code decayCode}: conditions and time derivatives, regime-guarded</li>
 *   <li>{@code impulseCode}: OnImpulse handling, regime-guarded; impulse ports read {@code $(inSyn)}</li>
 *   <li>{@code applyInputCode}: adds every analog send port to the neuron's {@code $(Isyn)}</li>
 * </ul>
 * Analog receive ports read the postsynaptic neuron's variables as {@code $(name_post)}.
 */
public class PostsynapticModel extends SpineMLModel {

    public static final String DECAY_CODE = "decayCode";
    public static final String IMPULSE_CODE = "impulseCode";
    public static final String APPLY_INPUT_CODE = "applyInputCode";
    static final String INPUT = "inSyn";
    static final String POST_SUFFIX = "_post";

    PostsynapticModel(ComponentClass component, Set<String> variableParams, TranslationListener listener) {
        super(component, variableParams, listener);

        RegimeCodeStream decayCode = new RegimeCodeStream();
        RegimeCodeStream impulseCode = new RegimeCodeStream();
        RegimeHandlers handlers = new RegimeHandlers(
                new ConditionHandler(component, decayCode),
                new UnsupportedHandler(component),
                new ImpulseHandler(component, impulseCode),
                new TimeDerivativeHandler(component, decayCode));
        generateModelCode(component, handlers, List.of(decayCode, impulseCode), listener);

        StringBuilder applyInputCode = new StringBuilder();
        for (String port : component.getAnalogSendPorts()) {
            applyInputCode.append(TokenSubstitution.token(NeuronModel.SYNAPTIC_INPUT))
                    .append(" += ").append(TokenSubstitution.token(port)).append(";\n");
        }

        Map<String, String> ports = new LinkedHashMap<>();
        for (String port : component.getAnalogReceivePorts()) ports.put(port, port + POST_SUFFIX);
        for (String port : component.getImpulseReceivePorts()) ports.put(port, INPUT);

        Map<String, String> raw = new LinkedHashMap<>();
        raw.put(DECAY_CODE, decayCode.code());
        raw.put(IMPULSE_CODE, impulseCode.code());
        raw.put(APPLY_INPUT_CODE, applyInputCode.toString());
        substituteCode(raw, ports, listener);
    }

    public String getDecayCode()      { return code(DECAY_CODE); }
    public String getImpulseCode()    { return code(IMPULSE_CODE); }
    public String getApplyInputCode() { return code(APPLY_INPUT_CODE); }
}
