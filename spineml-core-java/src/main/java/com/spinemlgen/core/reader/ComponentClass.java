package com.spinemlgen.core.reader;

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A SpineML component class as read from its document: name, kind, regimes with their
 * shared {@link RegimeTable}, declared parameters, state variables and ports.
 *
 * Instances are immutable; the regime elements are only ever read.
 */
public final class ComponentClass {

    private final String url;
    private final String name;
    private final ComponentKind kind;
    private final List<Element> regimes;
    private final RegimeTable regimeTable;
    private final List<String> parameterNames;
    private final List<String> stateVariableNames;
    private final List<String> analogReceivePorts;
    private final List<String> analogReducePorts;
    private final List<String> analogSendPorts;
    private final List<String> impulseReceivePorts;

    ComponentClass(String url, String name, ComponentKind kind,
                   List<Element> regimes, RegimeTable regimeTable,
                   List<String> parameterNames, List<String> stateVariableNames,
                   List<String> analogReceivePorts, List<String> analogReducePorts,
                   List<String> analogSendPorts, List<String> impulseReceivePorts) {
        this.url = url;
        this.name = name;
        this.kind = kind;
        this.regimes = List.copyOf(regimes);
        this.regimeTable = regimeTable;
        this.parameterNames = List.copyOf(parameterNames);
        this.stateVariableNames = List.copyOf(stateVariableNames);
        this.analogReceivePorts = List.copyOf(analogReceivePorts);
        this.analogReducePorts = List.copyOf(analogReducePorts);
        this.analogSendPorts = List.copyOf(analogSendPorts);
        this.impulseReceivePorts = List.copyOf(impulseReceivePorts);
    }

    public String getUrl()                       { return url; }
    public String getName()                      { return name; }
    public ComponentKind getKind()               { return kind; }
    public List<Element> getRegimes()            { return regimes; }
    public RegimeTable getRegimeTable()          { return regimeTable; }
    public List<String> getParameterNames()      { return parameterNames; }
    public List<String> getStateVariableNames()  { return stateVariableNames; }
    public List<String> getAnalogReceivePorts()  { return analogReceivePorts; }
    public List<String> getAnalogReducePorts()   { return analogReducePorts; }
    public List<String> getAnalogSendPorts()     { return analogSendPorts; }
    public List<String> getImpulseReceivePorts() { return impulseReceivePorts; }

    public boolean hasMultipleRegimes() { return regimeTable.hasMultipleRegimes(); }

    /**
     * Splits the declared names into free parameters and variables.
     *
     * Variables are the caller's {@code variableParams} plus every state variable, sorted by
     * name; {@code _regimeID} is appended when the component has more than one regime.
     * Free parameters are the declared parameters, in declaration order, that are not variables.
     */
    public VariableClassification classify(Set<String> variableParams) {
        Set<String> variables = new TreeSet<>(variableParams);
        variables.addAll(stateVariableNames);

        List<String> paramNames = new ArrayList<>();
        for (String p : parameterNames) {
            if (!variables.contains(p) && !paramNames.contains(p)) {
                paramNames.add(p);
            }
        }

        List<ModelVariable> vars = new ArrayList<>();
        for (String v : variables) {
            vars.add(ModelVariable.scalar(v));
        }
        if (hasMultipleRegimes()) {
            vars.add(new ModelVariable(VariableClassification.REGIME_ID_VARIABLE, ModelVariable.UNSIGNED_INT));
        }
        return new VariableClassification(paramNames, vars, hasMultipleRegimes());
    }
}
