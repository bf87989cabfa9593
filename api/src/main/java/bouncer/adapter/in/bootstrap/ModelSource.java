package bouncer.adapter.in.bootstrap;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import bouncer.core.model.ModelCompileException;

/**
 * Reads model text from the classpath or, failing that, the file system.
 */
final class ModelSource {

    private ModelSource() {}

    static String read(String location) {
        final var resource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ModelCompileException(null, "Cannot read model resource " + location, e);
        }

        final var path = Path.of(location);
        if (!Files.isReadable(path)) {
            throw new ModelCompileException(null, "Model not found on classpath or file system: " + location);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelCompileException(null, "Cannot read model file " + location, e);
        }
    }
}
