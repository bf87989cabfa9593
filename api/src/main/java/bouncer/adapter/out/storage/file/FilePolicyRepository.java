package bouncer.adapter.out.storage.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bouncer.core.model.PolicyMutationException;
import bouncer.core.model.policy.PolicyLineFormat;
import bouncer.core.model.policy.PolicyRule;
import bouncer.core.port.out.PolicyRepository;

/**
 * Stores rules in a text file, one rule per line.
 *
 * <p>Full saves and removals write a sibling temporary file and move it over
 * the original, so readers never see a truncated file. Additions append.
 * A missing file reads as an empty policy.
 *
 * <p>Thread-safety: writes are serialized on the repository instance.
 */
public class FilePolicyRepository implements PolicyRepository {

    private static final Logger LOG = Logger.getLogger(FilePolicyRepository.class);

    private final Path path;

    public FilePolicyRepository(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public Uni<List<PolicyRule>> loadPolicy() {
        return Uni.createFrom().item(this::read);
    }

    @Override
    public Uni<Void> savePolicy(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                write(rules);
            }
            LOG.debugf("Wrote %d rule(s) to %s", rules.size(), path);
            return null;
        });
    }

    @Override
    public Uni<Void> addPolicies(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                append(rules);
            }
            return null;
        });
    }

    @Override
    public Uni<Void> removePolicies(List<PolicyRule> rules) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var removed = new HashSet<>(rules);
                final List<PolicyRule> remaining = new ArrayList<>();
                for (var rule : read()) {
                    if (!removed.contains(rule)) {
                        remaining.add(rule);
                    }
                }
                write(remaining);
            }
            return null;
        });
    }

    private synchronized List<PolicyRule> read() {
        if (!Files.exists(path)) {
            LOG.debugf("Policy file %s does not exist, treating as empty", path);
            return List.of();
        }
        try {
            return PolicyLineFormat.parseAll(Files.readAllLines(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new PolicyMutationException("Cannot read policy file " + path + ": " + e.getMessage(), e);
        }
    }

    private void write(List<PolicyRule> rules) {
        try {
            final var parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            final var temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            Files.write(temp, lines(rules), StandardCharsets.UTF_8);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PolicyMutationException("Cannot write policy file " + path + ": " + e.getMessage(), e);
        }
    }

    private void append(List<PolicyRule> rules) {
        try {
            Files.write(
                    path,
                    lines(rules),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PolicyMutationException("Cannot append to policy file " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<String> lines(List<PolicyRule> rules) {
        return rules.stream().map(PolicyLineFormat::format).toList();
    }
}
