package fr.lapetina.domainreview;

import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.DomainReport;
import fr.lapetina.domainreview.infrastructure.inventory.DomainInventory;
import fr.lapetina.domainreview.infrastructure.inventory.FileDomainInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Main entry point: reviews every domain of an inventory file once.
 *
 * <pre>
 * java -jar domain-review.jar [config.yaml] [domains.txt]
 * </pre>
 */
public class DomainReviewApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DomainReviewApplication.class);

    private final ReviewEngineFactory factory;

    public DomainReviewApplication(String configPath) {
        log.info("Starting domain review...");
        this.factory = ReviewEngineFactory.create(configPath);
    }

    DomainReviewApplication(ReviewEngineFactory factory) {
        this.factory = factory;
    }

    /**
     * Runs one pass over the inventory and exports metrics when configured.
     */
    public Map<Domain, DomainReport> run(DomainInventory inventory) {
        List<Domain> domains = inventory.domains();
        Map<Domain, DomainReport> reports = factory.getOrchestrator().review(domains);

        for (DomainReport report : reports.values()) {
            log.info("Result: domain={}, status={}, categories={}, explanation={}",
                    report.domain().name(), report.resultingStatus(), report.categories(),
                    report.verdict().explanation());
            report.failedSources().values().forEach(failed ->
                    log.warn("Source failed: domain={}, source={}, reason={}",
                            report.domain().name(), failed.source(), failed.describe()));
        }

        exportMetrics();
        return reports;
    }

    /**
     * Stops a running pass at the next domain boundary.
     */
    public void requestShutdown() {
        factory.getOrchestrator().cancel();
    }

    public ReviewEngineFactory getFactory() {
        return factory;
    }

    private void exportMetrics() {
        String textfile = factory.getConfig().getMetrics().getTextfilePath();
        if (textfile == null || textfile.isBlank()) {
            return;
        }
        try {
            factory.getMetricsRegistry().writeTextfile(Path.of(textfile));
        } catch (IOException e) {
            log.warn("Failed to write metrics text file: path={}, error={}", textfile, e.getMessage());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down domain review...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Domain review shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        String inventoryPath = args.length > 1 ? args[1] : "domains.txt";

        try (DomainReviewApplication app = new DomainReviewApplication(configPath)) {
            Runtime.getRuntime().addShutdownHook(new Thread(app::requestShutdown));
            app.run(new FileDomainInventory(Path.of(inventoryPath)));
        } catch (Exception e) {
            log.error("Domain review failed", e);
            System.exit(1);
        }
    }
}
