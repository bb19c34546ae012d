package com.erbformat.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    /** Text of a template under {@code src/test/resources/fixtures}. */
    public static String fixture(String name) throws IOException {
        try (InputStream in = open(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** Copies a fixture into {@code directory}, keeping its file name. */
    public static Path copyFixture(String name, Path directory) throws IOException {
        Path target = directory.resolve(name);
        Files.createDirectories(target.getParent());
        try (InputStream in = open(name)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    private static InputStream open(String name) throws IOException {
        String resourceName = "fixtures/" + name;
        InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IOException("Missing classpath resource: " + resourceName);
        }
        return in;
    }
}
