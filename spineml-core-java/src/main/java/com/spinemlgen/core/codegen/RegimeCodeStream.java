package com.spinemlgen.core.codegen;

/**
 * Accumulates the code of one output buffer, regime by regime.
 *
 * Handlers append to the scratch buffer of the regime being traversed. At the end of each
 * regime {@link #onRegimeEnd} moves the scratch text into the finished code, wrapped in an
 * {@code if(_regimeID == ID)} guard when the component has more than one regime. Regimes that
 * produced no text contribute nothing, not even a guard.
 */
public class RegimeCodeStream {

    private static final String INDENT = "    ";

    private final StringBuilder regimeCode = new StringBuilder();
    private final StringBuilder code = new StringBuilder();
    private boolean firstNonEmptyRegime = true;

    public RegimeCodeStream appendLine(String line) {
        regimeCode.append(line).append('\n');
        return this;
    }

    public void onRegimeEnd(boolean multipleRegimes, int currentRegimeId) {
        if (regimeCode.length() == 0) {
            return;
        }

        if (multipleRegimes) {
            if (firstNonEmptyRegime) {
                firstNonEmptyRegime = false;
            } else {
                code.append("else ");
            }
            code.append("if(_regimeID == ").append(currentRegimeId).append(") {\n");
            indentInto(regimeCode, code);
            code.append("}\n");
        } else {
            code.append(regimeCode);
        }

        regimeCode.setLength(0);
    }

    /** Text of every regime ended so far. */
    public String code() {
        return code.toString();
    }

    /** Text written since the last regime end. */
    public String pendingRegimeCode() {
        return regimeCode.toString();
    }

    private static void indentInto(CharSequence text, StringBuilder target) {
        for (String line : text.toString().split("\n")) {
            if (!line.isEmpty()) {
                target.append(INDENT).append(line);
            }
            target.append('\n');
        }
    }
}
