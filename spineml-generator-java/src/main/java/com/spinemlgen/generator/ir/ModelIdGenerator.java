package com.spinemlgen.generator.ir;

import com.spinemlgen.core.reader.ComponentKind;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Generates deterministic, stable model IDs following the convention:
 *   <kind>::<component-url>[<variable>,<variable>...]
 * with the variable properties sorted, e.g. {@code neuron_body::LIF.xml[V,tau]}.
 */
public class ModelIdGenerator {

    public static String forModel(ComponentKind kind, String url, Collection<String> variableParams) {
        return kind.typeName() + "::" + url + "[" + String.join(",", new TreeSet<>(variableParams)) + "]";
    }
}
