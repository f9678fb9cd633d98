package strokeseg.orchestrator.template;

import strokeseg.orchestrator.exception.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads {@code <directory>/<name>.sbatch} from the classpath and caches the text.
 */
public class ClasspathTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTemplateSource.class);

    static final String EXTENSION = ".sbatch";

    private final String directory;
    private final ClassLoader classLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public ClasspathTemplateSource(String directory) {
        this(directory, ClasspathTemplateSource.class.getClassLoader());
    }

    public ClasspathTemplateSource(String directory, ClassLoader classLoader) {
        this.directory = directory.endsWith("/") ? directory.substring(0, directory.length() - 1) : directory;
        this.classLoader = classLoader;
    }

    @Override
    public Optional<String> load(String templateName) {
        String cached = cache.get(templateName);
        if (cached != null) {
            return Optional.of(cached);
        }

        String resource = directory + "/" + templateName + EXTENSION;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            cache.putIfAbsent(templateName, text);
            log.debug("Loaded template {} from {}", templateName, resource);
            return Optional.of(text);
        } catch (IOException e) {
            throw new TemplateNotFoundException(templateName, e);
        }
    }
}
