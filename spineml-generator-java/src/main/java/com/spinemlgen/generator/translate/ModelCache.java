package com.spinemlgen.generator.translate;

import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.models.ModelTranslator;
import com.spinemlgen.core.models.SpineMLModel;
import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.generator.network.ModelKey;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates each distinct (component, variable properties) pair once per kind; later
 * references to the same key get the same model instance.
 */
public class ModelCache {

    /** Cache entry identity: the same document may not be read as two kinds. */
    public record Entry(ComponentKind kind, ModelKey key) {}

    private final ModelTranslator translator;
    private final TranslationListener listener;
    private final Map<Entry, SpineMLModel> models = new LinkedHashMap<>();

    public ModelCache(ModelTranslator translator, TranslationListener listener) {
        this.translator = translator;
        this.listener = listener;
    }

    public SpineMLModel getOrCreate(ComponentKind kind, ModelKey key) {
        Entry entry = new Entry(kind, key);
        SpineMLModel existing = models.get(entry);
        if (existing != null) {
            return existing;
        }
        listener.onInfo("Creating new model: " + key.url().getFileName() + " " + key.variableParams());
        SpineMLModel model = translator.translate(key.url(), kind, key.variableParams());
        models.put(entry, model);
        return model;
    }

    public int size() {
        return models.size();
    }
}
