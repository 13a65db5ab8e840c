package com.spinemlgen.core.handler;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.Dom;
import org.w3c.dom.Element;

/**
 * Integrates a TimeDerivative with a forward Euler step: {@code x += DT * (dx/dt);}.
 */
public class TimeDerivativeHandler implements ObjectHandler {

    private final ComponentClass component;
    private final RegimeCodeStream out;

    public TimeDerivativeHandler(ComponentClass component, RegimeCodeStream out) {
        this.component = component;
        this.out = out;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        String variable = Dom.attr(node, "variable");
        if (variable == null) {
            throw new ConfigurationException("Component " + component.getUrl() + ": TimeDerivative in regime '"
                    + TransitionWriter.regimeNameOf(node) + "' has no variable");
        }
        // TODO: pick the integration scheme per derivative once linear dynamics can be detected
        out.appendLine(variable + " += DT * (" + TransitionWriter.mathInline(node, component.getUrl()) + ");");
    }
}
