package com.spinemlgen.core.codegen;

import com.spinemlgen.core.reader.ModelVariable;
import com.spinemlgen.core.reader.VariableClassification;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites bare identifiers in generated code into the {@code $(name)} token form the
 * downstream code generator binds to parameters and variables.
 *
 * An occurrence only matches when it is not part of a longer identifier, and an occurrence
 * that is already wrapped is left alone, so every rewrite is idempotent.
 */
public final class TokenSubstitution {

    private static final String IDENTIFIER_CHAR = "[A-Za-z0-9_]";

    private TokenSubstitution() {}

    public static String token(String name) {
        return "$(" + name + ")";
    }

    /** Wraps every standalone {@code variableName} as {@code $(variableName)}. */
    public static String wrapVariableNames(String code, String variableName) {
        return wrapAndReplaceVariableNames(code, variableName, variableName);
    }

    /** Replaces every standalone {@code variableName} with {@code $(replaceVariableName)}. */
    public static String wrapAndReplaceVariableNames(String code, String variableName, String replaceVariableName) {
        Pattern pattern = Pattern.compile(
                "(?<!" + IDENTIFIER_CHAR + ")(?<!\\$\\()" + Pattern.quote(variableName) + "(?!" + IDENTIFIER_CHAR + ")");
        return pattern.matcher(code).replaceAll(Matcher.quoteReplacement(token(replaceVariableName)));
    }

    /**
     * Applies every substitution a model needs to one code buffer: each free parameter, each
     * variable (including {@code _regimeID}), then each port under its replacement name.
     */
    public static String substituteModelVariables(String code, VariableClassification classification,
                                                  Map<String, String> portReplacements) {
        String result = code;
        for (String p : classification.paramNames()) {
            result = wrapVariableNames(result, p);
        }
        for (ModelVariable v : classification.vars()) {
            result = wrapVariableNames(result, v.name());
        }
        for (Map.Entry<String, String> port : portReplacements.entrySet()) {
            result = wrapAndReplaceVariableNames(result, port.getKey(), port.getValue());
        }
        return result;
    }
}
