package com.spinemlgen.core;

import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.core.reader.ModelVariable;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Writes translation diagnostics to stderr, prefixed with {@code [spineml-gen]}.
 */
public class StderrTranslationListener extends TranslationListener.Adapter {

    private static final String PREFIX = "[spineml-gen] ";

    private final PrintStream out;

    public StderrTranslationListener() {
        this(System.err);
    }

    public StderrTranslationListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onModel(String url, String name, ComponentKind kind) {
        out.println(PREFIX + "Model name: " + name + " (" + kind.typeName() + ", " + url + ")");
    }

    @Override
    public void onRegime(String name, int regimeId) {
        out.println(PREFIX + "  Regime name: " + name + ", id: " + regimeId);
    }

    @Override
    public void onParameters(List<String> paramNames) {
        out.println(PREFIX + "  Parameters:");
        for (String p : paramNames) {
            out.println(PREFIX + "    " + p);
        }
    }

    @Override
    public void onVariables(List<ModelVariable> vars) {
        out.println(PREFIX + "  Variables:");
        for (ModelVariable v : vars) {
            out.println(PREFIX + "    " + v.name() + ":" + v.type());
        }
    }

    @Override
    public void onPorts(Map<String, String> portReplacements) {
        if (portReplacements.isEmpty()) return;
        out.println(PREFIX + "  Ports:");
        portReplacements.forEach((port, replacement) ->
                out.println(PREFIX + "    " + port + " -> " + replacement));
    }

    @Override
    public void onCode(String bufferName, String code) {
        out.println(PREFIX + "  " + bufferName + ":");
        out.println(code);
    }

    @Override
    public void onInfo(String message) {
        out.println(PREFIX + message);
    }

    @Override
    public void onWarning(String message) {
        out.println(PREFIX + "WARNING: " + message);
    }
}
