package fr.lapetina.domainreview.infrastructure.inventory;

import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.HealthStatus;
import fr.lapetina.domainreview.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Inventory read from a text file with one {@code name[,status]} entry per line.
 *
 * Blank lines and lines starting with {@code #} are ignored. A missing status means
 * {@link HealthStatus#UNKNOWN}.
 */
public final class FileDomainInventory implements DomainInventory {

    private static final Logger log = LoggerFactory.getLogger(FileDomainInventory.class);

    private final Path path;

    public FileDomainInventory(Path path) {
        this.path = path;
    }

    @Override
    public List<Domain> domains() {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read domain inventory: " + path, e);
        }

        List<Domain> domains = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split(",", 2);
            HealthStatus status = parts.length > 1 ? HealthStatus.parse(parts[1]) : HealthStatus.UNKNOWN;
            domains.add(new Domain(parts[0], status));
        }
        log.info("Domain inventory loaded: path={}, domains={}", path, domains.size());
        return domains;
    }
}
