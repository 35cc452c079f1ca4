package fr.lapetina.domainreview.infrastructure.http;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cookie jar and form-token store for one multi-step lookup (GET a form, POST it back).
 *
 * Create one per adapter invocation and drop it when the lookup returns; server-side
 * session state must never carry over to the next domain. Not thread-safe.
 */
public final class SessionContext {

    private final String owner;
    private final CookieManager cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
    private final Map<String, String> tokens = new LinkedHashMap<>();

    public SessionContext(String owner) {
        this.owner = owner;
    }

    /**
     * Adds the {@code Cookie} header for {@code uri} to the request being built.
     */
    void applyCookies(HttpRequest.Builder builder, URI uri) throws IOException {
        Map<String, List<String>> headers = cookies.get(uri, Map.of());
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                builder.header(entry.getKey(), String.join("; ", entry.getValue()));
            }
        }
    }

    /**
     * Stores the {@code Set-Cookie} headers of a response.
     */
    void storeCookies(URI uri, HttpHeaders headers) throws IOException {
        cookies.put(uri, headers.map());
    }

    public void putToken(String name, String value) {
        tokens.put(name, value);
    }

    public Optional<String> token(String name) {
        return Optional.ofNullable(tokens.get(name));
    }

    public Map<String, String> tokens() {
        return Map.copyOf(tokens);
    }

    public int cookieCount() {
        return cookies.getCookieStore().getCookies().size();
    }

    public String getOwner() {
        return owner;
    }

    @Override
    public String toString() {
        return "SessionContext{" +
                "owner='" + owner + '\'' +
                ", cookies=" + cookieCount() +
                ", tokens=" + tokens.keySet() +
                '}';
    }
}
