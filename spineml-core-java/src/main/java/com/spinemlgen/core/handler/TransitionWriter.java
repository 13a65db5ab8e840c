package com.spinemlgen.core.handler;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.reader.Dom;
import com.spinemlgen.core.reader.VariableClassification;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Statement emission shared by the transition handlers.
 */
final class TransitionWriter {

    static final String INDENT = "    ";

    private TransitionWriter() {}

    /** One {@code variable = expression;} line per StateAssignment child, in document order. */
    static void writeStateAssignments(Element transition, RegimeCodeStream out, String indent, String url) {
        for (Element assignment : Dom.children(transition, "StateAssignment")) {
            String variable = Dom.attr(assignment, "variable");
            if (variable == null) {
                throw new ConfigurationException("Component " + url + ": StateAssignment in regime '"
                        + regimeNameOf(transition) + "' has no variable");
            }
            out.appendLine(indent + variable + " = " + mathInline(assignment, url) + ";");
        }
    }

    /** Moves the automaton to {@code targetRegimeId}; single-regime models have no regime variable. */
    static void writeRegimeChange(boolean multipleRegimes, int targetRegimeId, RegimeCodeStream out, String indent) {
        if (multipleRegimes) {
            out.appendLine(indent + VariableClassification.REGIME_ID_VARIABLE + " = " + targetRegimeId + ";");
        }
    }

    static String mathInline(Element parent, String url) {
        String text = Dom.childText(parent, "MathInline");
        if (text == null || text.isEmpty()) {
            throw new ConfigurationException("Component " + url + ": <" + Dom.tagOf(parent)
                    + "> in regime '" + regimeNameOf(parent) + "' has no MathInline expression");
        }
        return text;
    }

    /** Trigger expression of an OnCondition. */
    static String triggerOf(Element condition, String url) {
        Element trigger = Dom.child(condition, "Trigger");
        String text = trigger == null ? null : Dom.childText(trigger, "MathInline");
        if (text == null || text.isEmpty()) {
            throw new ConfigurationException("Component " + url + ": no trigger condition for transition in regime '"
                    + regimeNameOf(condition) + "'");
        }
        return text;
    }

    /** Name of the nearest enclosing Regime, for error messages. */
    static String regimeNameOf(Element node) {
        for (Node n = node; n != null; n = n.getParentNode()) {
            if (n instanceof Element && "Regime".equals(Dom.tagOf((Element) n))) {
                return Dom.attr((Element) n, "name");
            }
        }
        return "?";
    }
}
