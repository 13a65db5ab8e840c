package com.spinemlgen.core.handler;

import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.Dom;
import com.spinemlgen.core.reader.VariableClassification;
import org.w3c.dom.Element;

/**
 * Builds a neuron's spike threshold test by OR-ing the trigger of every OnCondition that emits
 * an event on the spike port. In multi-regime models each trigger is ANDed with its regime.
 */
public class ThresholdConditionHandler implements ObjectHandler {

    private final ComponentClass component;
    private final String spikePort;
    private final StringBuilder thresholdCondition = new StringBuilder();

    public ThresholdConditionHandler(ComponentClass component, String spikePort) {
        this.component = component;
        this.spikePort = spikePort;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        if (!emitsSpike(node)) {
            return;
        }
        String trigger = TransitionWriter.triggerOf(node, component.getUrl());

        if (thresholdCondition.length() > 0) {
            thresholdCondition.append(" || ");
        }
        if (component.hasMultipleRegimes()) {
            thresholdCondition.append("(").append(VariableClassification.REGIME_ID_VARIABLE)
                    .append(" == ").append(currentRegimeId)
                    .append(" && (").append(trigger).append("))");
        } else {
            thresholdCondition.append("(").append(trigger).append(")");
        }
    }

    public String getThresholdConditionCode() {
        return thresholdCondition.toString();
    }

    private boolean emitsSpike(Element condition) {
        for (Element eventOut : Dom.children(condition, "EventOut")) {
            if (spikePort.equals(Dom.attr(eventOut, "port"))) {
                return true;
            }
        }
        return false;
    }
}
