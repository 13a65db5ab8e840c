package com.spinemlgen.generator.ir;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs of the network IR handed to the downstream code generator.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class NetworkIr {

    private NetworkIr() {}

    public static class IrRoot {
        @SerializedName("ir_version")        public String irVersion;
        @SerializedName("generator_version") public String generatorVersion;
        @SerializedName("network_name")      public String networkName;
        @SerializedName("dt")                public double dt;
        @SerializedName("populations")       public List<IrPopulation> populations;
        @SerializedName("projections")       public List<IrProjection> projections;
        @SerializedName("models")            public List<IrModel> models;
    }

    public static class IrPopulation {
        @SerializedName("name")         public String name;
        @SerializedName("size")         public int size;
        @SerializedName("spike_source") public boolean spikeSource;
        @SerializedName("neuron")       public IrModelInstance neuron;   // null for spike sources
    }

    public static class IrProjection {
        @SerializedName("name")          public String name;
        @SerializedName("source")        public String source;
        @SerializedName("target")        public String target;
        @SerializedName("connector")     public String connector;
        @SerializedName("delay_steps")   public int delaySteps;
        @SerializedName("global_g")      public boolean globalG;
        @SerializedName("weight_update") public IrModelInstance weightUpdate;
        @SerializedName("postsynapse")   public IrModelInstance postsynapse;
    }

    /** A reference to a model together with its parameter and initial variable vectors. */
    public static class IrModelInstance {
        @SerializedName("model")        public String model;
        @SerializedName("param_values") public List<Double> paramValues;
        @SerializedName("var_values")   public List<Double> varValues;
    }

    public static class IrModel {
        @SerializedName("id")               public String id;
        @SerializedName("kind")             public String kind;  // neuron_body, postsynaptic, weight_update
        @SerializedName("name")             public String name;
        @SerializedName("url")              public String url;
        @SerializedName("param_names")      public List<String> paramNames;
        @SerializedName("vars")             public List<IrVar> vars;
        @SerializedName("multiple_regimes") public boolean multipleRegimes;
        @SerializedName("code")             public Map<String, String> code;
    }

    public static class IrVar {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;
    }
}
