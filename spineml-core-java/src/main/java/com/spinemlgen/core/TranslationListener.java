package com.spinemlgen.core;

import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.core.reader.ModelVariable;

import java.util.List;
import java.util.Map;

/**
 * Observer for the informational output of a translation: model name, regimes, the
 * parameter/variable classification, port substitutions and the finished code buffers.
 *
 * Implementations must not influence the translation. Use {@link #NONE} to silence it.
 */
public interface TranslationListener {

    TranslationListener NONE = new Adapter();

    void onModel(String url, String name, ComponentKind kind);

    void onRegime(String name, int regimeId);

    void onParameters(List<String> paramNames);

    void onVariables(List<ModelVariable> vars);

    /** Port name to the identifier it is wrapped as. */
    void onPorts(Map<String, String> portReplacements);

    void onCode(String bufferName, String code);

    /** Progress of a network build: populations, projections, cache misses. */
    void onInfo(String message);

    void onWarning(String message);

    /** No-op base so implementations only override what they report. */
    class Adapter implements TranslationListener {
        @Override public void onModel(String url, String name, ComponentKind kind) {}
        @Override public void onRegime(String name, int regimeId) {}
        @Override public void onParameters(List<String> paramNames) {}
        @Override public void onVariables(List<ModelVariable> vars) {}
        @Override public void onPorts(Map<String, String> portReplacements) {}
        @Override public void onCode(String bufferName, String code) {}
        @Override public void onInfo(String message) {}
        @Override public void onWarning(String message) {}
    }
}
