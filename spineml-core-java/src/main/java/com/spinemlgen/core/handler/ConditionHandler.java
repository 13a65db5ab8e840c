package com.spinemlgen.core.handler;

import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.reader.ComponentClass;
import org.w3c.dom.Element;

/**
 * Emits an OnCondition as a guarded block: the trigger test, its state assignments and the
 * regime change.
 */
public class ConditionHandler implements ObjectHandler {

    private final ComponentClass component;
    private final RegimeCodeStream out;

    public ConditionHandler(ComponentClass component, RegimeCodeStream out) {
        this.component = component;
        this.out = out;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        String trigger = TransitionWriter.triggerOf(node, component.getUrl());

        out.appendLine("if(" + trigger + ") {");
        TransitionWriter.writeStateAssignments(node, out, TransitionWriter.INDENT, component.getUrl());
        TransitionWriter.writeRegimeChange(component.hasMultipleRegimes(), targetRegimeId, out, TransitionWriter.INDENT);
        out.appendLine("}");
    }
}
