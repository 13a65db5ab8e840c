package com.spinemlgen.core.reader;

import java.util.Optional;

/**
 * The three kinds of SpineML component class this translator understands, keyed by the
 * {@code type} attribute of {@code <ComponentClass>}.
 */
public enum ComponentKind {

    NEURON_BODY("neuron_body"),
    POSTSYNAPTIC("postsynaptic"),
    WEIGHT_UPDATE("weight_update");

    private final String typeName;

    ComponentKind(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() { return typeName; }

    public static Optional<ComponentKind> fromTypeName(String typeName) {
        for (ComponentKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
