package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.source.browser.SiteReviewBrowserAdapter;
import fr.lapetina.domainreview.source.captcha.SiteReviewApiAdapter;
import fr.lapetina.domainreview.source.form.MxToolboxAdapter;
import fr.lapetina.domainreview.source.form.TrendMicroAdapter;
import fr.lapetina.domainreview.source.form.WebsenseAdapter;
import fr.lapetina.domainreview.source.html.FortiguardAdapter;
import fr.lapetina.domainreview.source.html.OpenDnsAdapter;
import fr.lapetina.domainreview.source.rest.CymonIpReputationChecker;
import fr.lapetina.domainreview.source.rest.TalosAdapter;
import fr.lapetina.domainreview.source.rest.VirusTotalAdapter;
import fr.lapetina.domainreview.source.rest.XForceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factory for creating category adapters by name.
 *
 * The registry is ordered: when no explicit list is configured, adapters are created
 * in registration order.
 */
public final class SourceAdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceAdapterFactory.class);

    private static final Map<String, Function<SourceContext, SourceAdapter>> REGISTRY = new LinkedHashMap<>();

    static {
        // Register built-in sources
        register(XForceAdapter.NAME, XForceAdapter::new);
        register(TalosAdapter.NAME, TalosAdapter::new);
        register(SiteReviewBrowserAdapter.NAME, SiteReviewBrowserAdapter::new);
        register(SiteReviewApiAdapter.NAME, SiteReviewApiAdapter::new);
        register(FortiguardAdapter.NAME, FortiguardAdapter::new);
        register(OpenDnsAdapter.NAME, OpenDnsAdapter::new);
        register(TrendMicroAdapter.NAME, TrendMicroAdapter::new);
        register(MxToolboxAdapter.NAME, MxToolboxAdapter::new);
        register(WebsenseAdapter.NAME, WebsenseAdapter::new);
    }

    private SourceAdapterFactory() {
        // Utility class
    }

    /**
     * Registers a custom source.
     *
     * @param name    source name (used in configuration)
     * @param creator builds the adapter from the shared context
     */
    public static synchronized void register(String name, Function<SourceContext, SourceAdapter> creator) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates a source by name.
     *
     * @return the adapter, or empty if no source has that name
     */
    public static synchronized Optional<SourceAdapter> create(String name, SourceContext context) {
        Function<SourceContext, SourceAdapter> creator = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (creator == null) {
            return Optional.empty();
        }
        return Optional.of(creator.apply(context));
    }

    /**
     * Creates the sources listed in configuration, or every registered source when the list is empty.
     * Unknown names are logged and skipped.
     */
    public static List<SourceAdapter> createEnabled(List<String> names, SourceContext context) {
        List<String> selected = names == null || names.isEmpty() ? getRegisteredNames() : names;
        List<SourceAdapter> adapters = new ArrayList<>();
        for (String name : selected) {
            Optional<SourceAdapter> adapter = create(name, context);
            if (adapter.isPresent()) {
                adapters.add(adapter.get());
            } else {
                log.warn("Unknown source in configuration, ignoring: name={}", name);
            }
        }
        return adapters;
    }

    public static PrimarySourceAdapter createPrimary(SourceContext context) {
        return new VirusTotalAdapter(context);
    }

    public static IpReputationChecker createIpReputationChecker(SourceContext context) {
        return new CymonIpReputationChecker(context);
    }

    /**
     * Returns all registered source names in registration order.
     */
    public static synchronized List<String> getRegisteredNames() {
        return List.copyOf(REGISTRY.keySet());
    }
}
