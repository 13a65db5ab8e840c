package com.spinemlgen.generator.ir;

import com.google.gson.GsonBuilder;
import com.spinemlgen.core.TranslationListener;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Serializes the network IR to {@code <network>_model.json}.
 * Models are sorted by ID before writing; populations and projections keep document order.
 */
public class NetworkIrSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final TranslationListener listener;

    public NetworkIrSerializer() {
        this(TranslationListener.NONE);
    }

    public NetworkIrSerializer(TranslationListener listener) {
        this.listener = listener;
    }

    /**
     * Writes {@code root} to {@code outputDir/<network>_model.json} and
     * {@code outputDir/metadata.json} with the network name, generator version and a timestamp.
     *
     * @param root      IR root to write
     * @param outputDir directory to write into (created if absent)
     * @return the path of the IR file
     */
    public Path write(NetworkIr.IrRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        if (root.models != null) {
            root.models = new ArrayList<>(root.models);
            root.models.sort(Comparator.comparing(m -> m.id));
        }

        var gson = new GsonBuilder().setPrettyPrinting().create();

        Path irPath = outputDir.resolve(irFileName(root.networkName));
        try (Writer w = Files.newBufferedWriter(irPath, StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + irPath.getFileName() + ": " + e.getMessage(), e);
        }
        listener.onInfo(irPath.getFileName() + " written: " + irPath);

        var meta = new Metadata(root.networkName, root.generatorVersion, root.dt, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        listener.onInfo("metadata.json written: " + metaPath);
        return irPath;
    }

    public static String irFileName(String networkName) {
        return networkName + "_model.json";
    }

    private record Metadata(
            String networkName,
            String generatorVersion,
            double dt,
            String timestamp
    ) {}
}
