package com.spinemlgen.core.models;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.codegen.RegimeCodeStream;
import com.spinemlgen.core.codegen.RegimeTraversal;
import com.spinemlgen.core.codegen.TokenSubstitution;
import com.spinemlgen.core.handler.RegimeHandlers;
import com.spinemlgen.core.reader.ComponentClass;
import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.core.reader.ModelVariable;
import com.spinemlgen.core.reader.VariableClassification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A component translated into the form the downstream code generator consumes: free parameter
 * names, typed variables and named, token-substituted code buffers.
 *
 * Subclasses supply the handlers and buffers of their model kind; the traversal and the
 * substitution pass are shared.
 */
public abstract class SpineMLModel {

    private final String url;
    private final String name;
    private final ComponentKind kind;
    private final VariableClassification classification;
    private final Map<String, String> codeBuffers = new LinkedHashMap<>();
    private boolean multipleRegimes;

    protected SpineMLModel(ComponentClass component, Set<String> variableParams, TranslationListener listener) {
        this.url = component.getUrl();
        this.name = component.getName();
        this.kind = component.getKind();
        this.classification = component.classify(variableParams);
        listener.onParameters(classification.paramNames());
        listener.onVariables(classification.vars());
    }

    protected void generateModelCode(ComponentClass component, RegimeHandlers handlers,
                                     List<RegimeCodeStream> streams, TranslationListener listener) {
        multipleRegimes = new RegimeTraversal(listener).generateModelCode(component, handlers, streams);
    }

    /** Substitutes parameters, variables and ports in each raw buffer and stores the result. */
    protected void substituteCode(Map<String, String> rawBuffers, Map<String, String> portReplacements,
                                  TranslationListener listener) {
        listener.onPorts(portReplacements);
        for (Map.Entry<String, String> buffer : rawBuffers.entrySet()) {
            String code = TokenSubstitution.substituteModelVariables(buffer.getValue(), classification, portReplacements);
            codeBuffers.put(buffer.getKey(), code);
            listener.onCode(buffer.getKey(), code);
        }
    }

    public String getUrl()              { return url; }
    public String getName()             { return name; }
    public ComponentKind getKind()      { return kind; }
    public boolean hasMultipleRegimes() { return multipleRegimes; }

    public List<String> getParamNames()    { return classification.paramNames(); }
    public List<ModelVariable> getVars()   { return classification.vars(); }
    public List<String> getVarNames()      { return classification.varNames(); }

    /** Finished code by buffer name, in the order the model kind defines them. */
    public Map<String, String> getCodeBuffers() {
        return Collections.unmodifiableMap(codeBuffers);
    }

    protected String code(String bufferName) {
        return codeBuffers.getOrDefault(bufferName, "");
    }
}
