package com.spinemlgen.generator.translate;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.TranslationException.ReferenceException;
import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.models.SpineMLModel;
import com.spinemlgen.core.reader.ComponentKind;
import com.spinemlgen.core.reader.ModelVariable;
import com.spinemlgen.core.values.ParamValues;
import com.spinemlgen.core.values.VarValues;
import com.spinemlgen.generator.ir.ModelIdGenerator;
import com.spinemlgen.generator.ir.NetworkIr.IrModel;
import com.spinemlgen.generator.ir.NetworkIr.IrModelInstance;
import com.spinemlgen.generator.ir.NetworkIr.IrPopulation;
import com.spinemlgen.generator.ir.NetworkIr.IrProjection;
import com.spinemlgen.generator.ir.NetworkIr.IrRoot;
import com.spinemlgen.generator.ir.NetworkIr.IrVar;
import com.spinemlgen.generator.network.ModelKey;
import com.spinemlgen.generator.network.NetworkDescription;
import com.spinemlgen.generator.network.NetworkDescription.ModelProperties;
import com.spinemlgen.generator.network.NetworkDescription.PopulationDescription;
import com.spinemlgen.generator.network.NetworkDescription.ProjectionDescription;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the translation of a whole network.
 * Produces the IR root from a network description, translating each distinct model once.
 */
public class NetworkTranslator {

    public static final String IR_VERSION = "0.1";
    public static final String GENERATOR_VERSION = "0.1.0";

    private final ModelCache cache;
    private final TranslationListener listener;
    private final double dt;

    public NetworkTranslator(ModelCache cache, TranslationListener listener, double dt) {
        this.cache = cache;
        this.listener = listener;
        this.dt = dt;
    }

    public IrRoot translate(NetworkDescription network) {
        // 1. Population sizes, keyed by safe name
        Map<String, Integer> populationSizes = new LinkedHashMap<>();
        for (PopulationDescription population : network.populations()) {
            if (populationSizes.put(population.name(), population.size()) != null) {
                throw new ConfigurationException("Population '" + population.name() + "' is declared more than once");
            }
        }

        // 2. Neuron populations
        Map<SpineMLModel, ModelKey> keys = new LinkedHashMap<>();
        List<IrPopulation> populations = new ArrayList<>();
        for (PopulationDescription population : network.populations()) {
            listener.onInfo("Population " + population.name() + " consisting of " + population.size() + " neurons");
            IrPopulation p = new IrPopulation();
            p.name = population.name();
            p.size = population.size();
            p.spikeSource = population.isSpikeSource();
            if (!population.isSpikeSource()) {
                p.neuron = instantiate(ComponentKind.NEURON_BODY, population.neuron(),
                        "population '" + population.name() + "'", network.basePath(), keys);
            }
            populations.add(p);
        }

        // 3. Projections, with their weight update and postsynaptic models
        List<IrProjection> projections = new ArrayList<>();
        for (PopulationDescription population : network.populations()) {
            for (ProjectionDescription projection : population.projections()) {
                populationSize(projection.source(), populationSizes);
                populationSize(projection.target(), populationSizes);
                listener.onInfo("Projection from population:" + projection.source() + "->" + projection.target());

                String name = projection.source() + "_" + projection.target();
                IrProjection p = new IrProjection();
                p.name = name;
                p.source = projection.source();
                p.target = projection.target();
                p.connector = projection.connector();
                p.delaySteps = delaySteps(projection.delay());
                // a weight update without variable properties can share one global weight
                p.globalG = projection.weightUpdate().key().variableParams().isEmpty();
                p.weightUpdate = instantiate(ComponentKind.WEIGHT_UPDATE, projection.weightUpdate(),
                        "projection '" + name + "' weight update", network.basePath(), keys);
                p.postsynapse = instantiate(ComponentKind.POSTSYNAPTIC, projection.postsynapse(),
                        "projection '" + name + "' postsynapse", network.basePath(), keys);
                projections.add(p);
            }
        }

        // 4. Every distinct model, once
        List<IrModel> models = new ArrayList<>();
        for (Map.Entry<SpineMLModel, ModelKey> entry : keys.entrySet()) {
            models.add(toIrModel(entry.getKey(), entry.getValue(), network.basePath()));
        }

        IrRoot root = new IrRoot();
        root.irVersion = IR_VERSION;
        root.generatorVersion = GENERATOR_VERSION;
        root.networkName = network.name();
        root.dt = dt;
        root.populations = populations;
        root.projections = projections;
        root.models = models;
        return root;
    }

    /** Delay in ms rounded to the nearest whole number of time steps. */
    public int delaySteps(double delay) {
        return (int) Math.round(delay / dt);
    }

    private IrModelInstance instantiate(ComponentKind kind, ModelProperties properties, String where,
                                        Path basePath, Map<SpineMLModel, ModelKey> keys) {
        SpineMLModel model = cache.getOrCreate(kind, properties.key());
        keys.putIfAbsent(model, properties.key());

        for (String property : properties.fixedValues().keySet()) {
            if (!model.getParamNames().contains(property) && !model.getVarNames().contains(property)) {
                listener.onWarning("Property '" + property + "' of " + where + " is not declared by component "
                        + model.getName() + " and is ignored");
            }
        }

        IrModelInstance instance = new IrModelInstance();
        instance.model = ModelIdGenerator.forModel(kind, relativeUrl(properties.key(), basePath),
                properties.key().variableParams());
        instance.paramValues = new ParamValues(properties.fixedValues(), model).getValues();
        instance.varValues = new VarValues(properties.fixedValues(), model).getValues();
        return instance;
    }

    private static int populationSize(String name, Map<String, Integer> populationSizes) {
        Integer size = populationSizes.get(name);
        if (size == null) {
            throw new ReferenceException("Cannot find neuron population: " + name);
        }
        return size;
    }

    private static IrModel toIrModel(SpineMLModel model, ModelKey key, Path basePath) {
        IrModel m = new IrModel();
        m.url = relativeUrl(key, basePath);
        m.id = ModelIdGenerator.forModel(model.getKind(), m.url, key.variableParams());
        m.kind = model.getKind().typeName();
        m.name = model.getName();
        m.paramNames = model.getParamNames();
        m.vars = new ArrayList<>();
        for (ModelVariable v : model.getVars()) {
            IrVar var = new IrVar();
            var.name = v.name();
            var.type = v.type();
            m.vars.add(var);
        }
        m.multipleRegimes = model.hasMultipleRegimes();
        m.code = new LinkedHashMap<>(model.getCodeBuffers());
        return m;
    }

    /** Component url relative to the network file, with forward slashes, so the IR is machine independent. */
    private static String relativeUrl(ModelKey key, Path basePath) {
        Path url = key.url();
        Path base = basePath.toAbsolutePath().normalize();
        Path relative = url.startsWith(base) ? base.relativize(url) : url;
        return relative.toString().replace('\\', '/');
    }
}
