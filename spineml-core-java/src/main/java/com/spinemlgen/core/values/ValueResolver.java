package com.spinemlgen.core.values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a sparse name-to-value table onto a dense vector in a model's declared name order.
 */
public final class ValueResolver {

    private ValueResolver() {}

    /**
     * For each name in {@code order}, the value in {@code sparseValues} or {@code 0.0} when absent.
     * Keys of {@code sparseValues} that are not in {@code order} are ignored.
     */
    public static List<Double> resolve(List<String> order, Map<String, Double> sparseValues) {
        List<Double> values = new ArrayList<>(order.size());
        for (String name : order) {
            Double value = sparseValues.get(name);
            values.add(value != null ? value : 0.0);
        }
        return values;
    }
}
