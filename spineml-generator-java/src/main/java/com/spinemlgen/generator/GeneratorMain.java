package com.spinemlgen.generator;

import com.spinemlgen.core.StderrTranslationListener;
import com.spinemlgen.core.TranslationListener;
import com.spinemlgen.core.models.ModelTranslator;
import com.spinemlgen.generator.config.GeneratorConfig;
import com.spinemlgen.generator.config.GeneratorConfigReader;
import com.spinemlgen.generator.ir.NetworkIr;
import com.spinemlgen.generator.ir.NetworkIrSerializer;
import com.spinemlgen.generator.network.NetworkDescription;
import com.spinemlgen.generator.network.NetworkReader;
import com.spinemlgen.generator.translate.ModelCache;
import com.spinemlgen.generator.translate.NetworkTranslator;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the network generator.
 *
 * Usage:
 *   java -jar spineml-generator-java.jar generate \
 *     --network <path-to-network.xml> \
 *     --output  <output-dir> \
 *     [--config <path-to-config.json>] \
 *     [--dt     <time-step-ms>]
 */
public class GeneratorMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[spineml-gen] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar spineml-generator-java.jar generate " +
                               "--network <path> --output <dir> [--config <path>] [--dt <ms>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[spineml-gen] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @return the path of the written IR file
     */
    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("generate")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String networkPath = null;
        String outputDir = null;
        String configPath = null;
        String dtFlag = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--network" -> networkPath = requireNext(args, i++, "--network");
                case "--output"  -> outputDir   = requireNext(args, i++, "--output");
                case "--config"  -> configPath  = requireNext(args, i++, "--config");
                case "--dt"      -> dtFlag      = requireNext(args, i++, "--dt");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (networkPath == null) throw new UsageException("--network is required");

        // 1. Read config; flags win over the file
        GeneratorConfig config = configPath != null
                ? new GeneratorConfigReader().read(Paths.get(configPath))
                : new GeneratorConfig();
        if (outputDir == null) outputDir = config.getOutputDir();
        if (outputDir == null) throw new UsageException("--output is required");
        double dt = dtFlag != null ? parseDt(dtFlag) : config.getDt();

        TranslationListener listener = config.isQuiet()
                ? TranslationListener.NONE
                : new StderrTranslationListener();

        // 2. Read the network
        Path network = Paths.get(networkPath);
        listener.onInfo("Reading network: " + network);
        NetworkDescription description = new NetworkReader().read(network, config.getNetworkName());

        // 3. Translate every population and projection
        ModelCache cache = new ModelCache(new ModelTranslator(listener, config.getSpikePort()), listener);
        NetworkIr.IrRoot root = new NetworkTranslator(cache, listener, dt).translate(description);
        listener.onInfo("Translation complete: " + root.populations.size() + " populations, "
                + root.projections.size() + " projections, " + root.models.size() + " models");

        // 4. Serialize
        Path irPath = new NetworkIrSerializer(listener).write(root, Paths.get(outputDir));
        listener.onInfo("Done.");
        return irPath;
    }

    private static double parseDt(String value) {
        double dt;
        try {
            dt = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--dt must be a number, got: " + value);
        }
        if (!(dt > 0)) {
            throw new UsageException("--dt must be positive, got: " + value);
        }
        return dt;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
