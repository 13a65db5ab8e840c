package com.spinemlgen.core.reader;

/**
 * A variable of a translated model: its name and the scalar type the simulator allocates for it.
 */
public record ModelVariable(String name, String type) {

    public static final String SCALAR = "scalar";
    public static final String UNSIGNED_INT = "unsigned int";

    public static ModelVariable scalar(String name) {
        return new ModelVariable(name, SCALAR);
    }
}
