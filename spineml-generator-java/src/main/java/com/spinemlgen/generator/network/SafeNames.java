package com.spinemlgen.generator.network;

/**
 * Population names become identifiers in generated code, so anything outside
 * {@code [A-Za-z0-9_]} is replaced by an underscore.
 */
public final class SafeNames {

    private SafeNames() {}

    public static String getSafeName(String name) {
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
