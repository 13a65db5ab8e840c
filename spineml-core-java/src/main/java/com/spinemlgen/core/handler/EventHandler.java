package com.spinemlgen.core.handler;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.Dom;
import org.w3c.dom.Element;

/**
 * Weight-update OnEvent (a presynaptic spike): state assignments, one postsynaptic input
 * delivery per ImpulseOut, then the regime change.
 */
public class EventHandler implements ObjectHandler {

    static final String ADD_TO_INSYN = "$(addtoinSyn)";
    static final String UPDATE_LINSYN = "$(updatelinsyn);";

    private final ComponentClass component;
    private final RegimeCodeStream out;

    public EventHandler(ComponentClass component, RegimeCodeStream out) {
        this.component = component;
        this.out = out;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        TransitionWriter.writeStateAssignments(node, out, "", component.getUrl());

        for (Element impulseOut : Dom.children(node, "ImpulseOut")) {
            String port = Dom.attr(impulseOut, "port");
            if (port == null) {
                throw new ConfigurationException("Component " + component.getUrl() + ": ImpulseOut in regime '"
                        + TransitionWriter.regimeNameOf(node) + "' has no port");
            }
            out.appendLine(ADD_TO_INSYN + " = " + port + ";");
            out.appendLine(UPDATE_LINSYN);
        }

        TransitionWriter.writeRegimeChange(component.hasMultipleRegimes(), targetRegimeId, out, "");
    }
}
