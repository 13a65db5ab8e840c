package com.spinemlgen.core.values;

import com.spinemlgen.core.models.SpineMLModel;

import java.util.List;
import java.util.Map;

/**
 * Externally supplied parameter values, ordered like {@link SpineMLModel#getParamNames()}.
 */
public class ParamValues {

    private final Map<String, Double> values;
    private final SpineMLModel model;

    public ParamValues(Map<String, Double> values, SpineMLModel model) {
        this.values = values;
        this.model = model;
    }

    public List<Double> getValues() {
        return ValueResolver.resolve(model.getParamNames(), values);
    }
}
