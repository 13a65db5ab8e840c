package com.spinemlgen.core.codegen;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.handler.RegimeHandlers;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.ComponentReader;
import com.spinemlgen.core.reader.Dom;
import com.spinemlgen.core.reader.RegimeTable;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Walks a component's regimes in document order and drives the handlers.
 *
 * For every regime: each OnCondition, OnEvent and OnImpulse goes to its handler with the
 * resolved target regime ID, each TimeDerivative goes to the derivative handler targeting the
 * current regime, then every code stream is told the regime has ended. The same walk is used
 * for all model kinds; only the handlers differ.
 */
public class RegimeTraversal {

    private final TranslationListener listener;

    public RegimeTraversal(TranslationListener listener) {
        this.listener = listener;
    }

    /**
     * @return whether the component has more than one regime
     */
    public boolean generateModelCode(ComponentClass component, RegimeHandlers handlers, List<RegimeCodeStream> streams) {
        RegimeTable regimeTable = component.getRegimeTable();
        boolean multipleRegimes = regimeTable.hasMultipleRegimes();

        for (Element regime : component.getRegimes()) {
            String regimeName = Dom.attr(regime, "name");
            int currentRegimeId = regimeTable.idOf(regimeName);
            listener.onRegime(regimeName, currentRegimeId);

            for (Element condition : Dom.children(regime, "OnCondition")) {
                handlers.condition().onObject(condition, currentRegimeId,
                        resolveTarget(component, regimeName, condition));
            }
            for (Element event : Dom.children(regime, "OnEvent")) {
                handlers.event().onObject(event, currentRegimeId,
                        resolveTarget(component, regimeName, event));
            }
            for (Element impulse : Dom.children(regime, "OnImpulse")) {
                handlers.impulse().onObject(impulse, currentRegimeId,
                        resolveTarget(component, regimeName, impulse));
            }
            for (Element timeDerivative : Dom.children(regime, "TimeDerivative")) {
                handlers.timeDerivative().onObject(timeDerivative, currentRegimeId, currentRegimeId);
            }

            for (RegimeCodeStream stream : streams) {
                stream.onRegimeEnd(multipleRegimes, currentRegimeId);
            }
        }
        return multipleRegimes;
    }

    private static int resolveTarget(ComponentClass component, String regimeName, Element transition) {
        String target = ComponentReader.targetRegimeOf(transition, regimeName, component.getUrl());
        return component.getRegimeTable().resolveTarget(regimeName, Dom.tagOf(transition), target);
    }
}
