package com.spinemlgen.core.handler;

import com.spinemlgen.core.TranslationException.UnsupportedFeatureException;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.Dom;
import org.w3c.dom.Element;

/**
 * Rejects a node kind the model kind has no translation for.
 */
public class UnsupportedHandler implements ObjectHandler {

    private final ComponentClass component;

    public UnsupportedHandler(ComponentClass component) {
        this.component = component;
    }

    @Override
    public void onObject(Element node, int currentRegimeId, int targetRegimeId) {
        throw new UnsupportedFeatureException("Component " + component.getName() + " (" + component.getUrl()
                + "): <" + Dom.tagOf(node) + "> in regime '" + TransitionWriter.regimeNameOf(node)
                + "' is not supported in " + component.getKind().typeName() + " components");
    }
}
