package com.spinemlgen.core.values;

import com.spinemlgen.core.models.SpineMLModel;

import java.util.List;
import java.util.Map;

/**
 * Externally supplied initial variable values, ordered like {@link SpineMLModel#getVars()}.
 */
public class VarValues {

    private final Map<String, Double> values;
    private final SpineMLModel model;

    public VarValues(Map<String, Double> values, SpineMLModel model) {
        this.values = values;
        this.model = model;
    }

    public List<Double> getValues() {
        return ValueResolver.resolve(model.getVarNames(), values);
    }
}
