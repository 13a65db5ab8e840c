package com.spinemlgen.generator.network;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identifies one translated model: the component document and the properties that are
 * variable rather than fixed, kept sorted. Two references with equal keys share a single translation.
 */
public record ModelKey(Path url, Set<String> variableParams) {

    public ModelKey {
        url = url.toAbsolutePath().normalize();
        variableParams = Collections.unmodifiableSortedSet(new TreeSet<>(variableParams));
    }
}
