package com.spinemlgen.core.handler;

import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.reader.ComponentClass;
import org.w3c.dom.Element;

/**
 * Postsynaptic OnImpulse: the state assignments run when an impulse arrives, followed by the
 * regime change. The impulse's source port is bound to the accumulated input during token
 * substitution.
 */
public class ImpulseHandler implements ObjectHandler {

    private final ComponentClass component;
    private final RegimeCodeStream out;

    public ImpulseHandler(ComponentClass component, RegimeCodeStream out) {
        this.component = component;
        this.out = out;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        TransitionWriter.writeStateAssignments(node, out, "", component.getUrl());
        TransitionWriter.writeRegimeChange(component.hasMultipleRegimes(), targetRegimeId, out, "");
    }
}
