package com.spinemlgen.core.reader;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Partition of a component's names into free parameters and variables.
 *
 * @param paramNames       free parameters, in {@code <Parameter>} declaration order
 * @param vars             variables sorted by name, with {@code _regimeID} last when present
 * @param multipleRegimes  whether the component has more than one regime
 */
public record VariableClassification(
    List<String> paramNames,
    List<ModelVariable> vars,
    boolean multipleRegimes
) {

    public static final String REGIME_ID_VARIABLE = "_regimeID";

    public VariableClassification {
        paramNames = List.copyOf(paramNames);
        vars = List.copyOf(vars);
    }

    public List<String> varNames() {
        return vars.stream().map(ModelVariable::name).collect(Collectors.toList());
    }
}
