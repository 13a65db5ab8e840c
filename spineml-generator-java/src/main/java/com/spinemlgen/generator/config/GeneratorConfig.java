package com.spinemlgen.generator.config;

import com.google.gson.annotations.SerializedName;
import com.spinemlgen.core.models.ModelTranslator;

/**
 * Deserialized form of the optional generator configuration file.
 * Every field may be omitted; the getters supply the defaults.
 */
public class GeneratorConfig {

    public static final double DEFAULT_DT = 0.1;

    /** Simulation time step in ms, used to turn delays into steps (default: 0.1). */
    @SerializedName("dt")
    private Double dt;

    /** Name of the generated network (default: network file name without extension). */
    @SerializedName("network_name")
    private String networkName;

    /** Event port whose OnCondition triggers form a neuron's threshold (default: "spike"). */
    @SerializedName("spike_port")
    private String spikePort;

    /** Suppresses translation diagnostics on stderr (default: false). */
    @SerializedName("quiet")
    private Boolean quiet;

    @SerializedName("output_dir")
    private String outputDir;

    public double getDt()          { return dt != null ? dt : DEFAULT_DT; }
    public String getNetworkName() { return networkName; }
    public String getSpikePort()   { return spikePort != null ? spikePort : ModelTranslator.DEFAULT_SPIKE_PORT; }
    public boolean isQuiet()       { return quiet != null && quiet; }
    public String getOutputDir()   { return outputDir; }
}
