package com.spinemlgen.core.reader;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.TranslationException.ReferenceException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bijective mapping from regime name to a dense integer ID, assigned in document order.
 *
 * Built once per component by {@link ComponentReader} and shared by every handler that
 * emits regime-conditioned code.
 */
public final class RegimeTable {

    private final String componentUrl;
    private final Map<String, Integer> ids;

    private RegimeTable(String componentUrl, Map<String, Integer> ids) {
        this.componentUrl = componentUrl;
        this.ids = Collections.unmodifiableMap(ids);
    }

    static RegimeTable build(String componentUrl, List<String> regimeNames) {
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (String name : regimeNames) {
            if (ids.containsKey(name)) {
                throw new ConfigurationException("Component " + componentUrl
                        + " declares regime '" + name + "' more than once");
            }
            ids.put(name, ids.size());
        }
        return new RegimeTable(componentUrl, ids);
    }

    public boolean hasMultipleRegimes() { return ids.size() > 1; }

    /** Regime names in ID order. */
    public List<String> names() { return List.copyOf(ids.keySet()); }

    public int idOf(String regimeName) {
        Integer id = ids.get(regimeName);
        if (id == null) {
            throw new ReferenceException("Component " + componentUrl + " has no regime named '" + regimeName + "'");
        }
        return id;
    }

    /**
     * Resolves the target of a transition leaving {@code sourceRegime}.
     *
     * @throws ReferenceException if the target regime does not exist
     */
    public int resolveTarget(String sourceRegime, String transitionTag, String targetRegime) {
        Integer id = ids.get(targetRegime);
        if (id == null) {
            throw new ReferenceException("Component " + componentUrl + ": <" + transitionTag
                    + "> in regime '" + sourceRegime + "' targets unknown regime '" + targetRegime + "'");
        }
        return id;
    }

    public Map<String, Integer> asMap() { return ids; }
}
