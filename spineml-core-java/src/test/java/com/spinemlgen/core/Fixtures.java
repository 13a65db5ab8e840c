package com.spinemlgen.core;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/** Locates the component documents under src/test/resources/models. */
final class Fixtures {

    private Fixtures() {}

    static Path model(String fileName) {
        URL url = Fixtures.class.getResource("/models/" + fileName);
        if (url == null) throw new IllegalArgumentException("No fixture: " + fileName);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Writes a component document wrapping {@code componentClass} into {@code dir}. */
    static Path component(Path dir, String componentClass) throws IOException {
        Path file = dir.resolve("component.xml");
        Files.writeString(file, "<SpineML xmlns=\"http://www.shef.ac.uk/SpineMLComponentLayer\">\n"
                + componentClass + "\n</SpineML>\n");
        return file;
    }
}
