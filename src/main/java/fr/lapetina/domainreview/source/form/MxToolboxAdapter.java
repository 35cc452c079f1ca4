package fr.lapetina.domainreview.source.form;

import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.http.SessionContext;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MXToolbox brand reputation, which reports Google Safe Browsing and PhishTank hits.
 *
 * The tool is an ASP.NET WebForms page: the first GET yields the view-state tokens and
 * session cookie that the postback must echo.
 */
public final class MxToolboxAdapter extends AbstractSourceAdapter {

    public static final String NAME = "mxtoolbox";
    static final String DEFAULT_ENDPOINT = "https://mxtoolbox.com";
    static final String TOOL_PATH = "/Public/Tools/BrandReputation.aspx";

    static final List<String> FORM_TOKENS = List.of("__VIEWSTATE", "__VIEWSTATEGENERATOR", "__EVENTVALIDATION");

    static final String NO_ISSUES = "No issues found";
    static final String SAFE_BROWSING_ISSUES = "Google SafeBrowsing Issues Found";
    static final String PHISHTANK_ISSUES = "PhishTank Issues Found";

    private static final String RESULT_PREFIX = "div#ctl00_ContentPlaceHolder1_";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public MxToolboxAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public MxToolboxAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        URI toolUri = URI.create(baseUri + TOOL_PATH);
        Map<String, String> headers = Map.of(
                "Origin", toolUri.toString(),
                "Referer", toolUri.toString()
        );
        SessionContext session = new SessionContext(NAME + ":" + domainName);

        HttpResponse<String> formPage = httpClient.get(toolUri, headers, session);
        requireSuccess(formPage);
        Document form = Jsoup.parse(formPage.body());
        for (String token : FORM_TOKENS) {
            Element input = form.selectFirst("input[name=" + token + "]");
            if (input == null) {
                throw SourceLookupException.unexpectedPage();
            }
            session.putToken(token, input.attr("value"));
        }

        HttpResponse<String> response = httpClient.postForm(toolUri, headers, postback(session, domainName), session);
        requireSuccess(response);
        Document result = Jsoup.parse(response.body());

        if (result.selectFirst(RESULT_PREFIX + "noIssuesFound") != null) {
            return SourceQueryResult.success(NAME, List.of(), NO_ISSUES);
        }
        List<String> issues = new ArrayList<>();
        if (result.selectFirst(RESULT_PREFIX + "googleSafeBrowsingIssuesFound") != null) {
            issues.add(SAFE_BROWSING_ISSUES);
        }
        if (result.selectFirst(RESULT_PREFIX + "phishTankIssuesFound") != null) {
            issues.add(PHISHTANK_ISSUES);
        }
        if (issues.isEmpty()) {
            throw SourceLookupException.unexpectedPage();
        }
        return success(issues);
    }

    private static Map<String, String> postback(SessionContext session, String domainName) {
        Map<String, String> form = new LinkedHashMap<>(session.tokens());
        form.put("ctl00$ContentPlaceHolder1$brandReputationUrl", domainName);
        form.put("ctl00$ContentPlaceHolder1$brandReputationDoLookup", "Brand Reputation Lookup");
        form.put("ctl00$ucSignIn$hfRegCode", "missing");
        form.put("ctl00$ucSignIn$hfRedirectSignUp", TOOL_PATH);
        form.put("ctl00$ucSignIn$hfRedirectLogin", "");
        form.put("ctl00$ucSignIn$txtEmailAddress", "");
        form.put("ctl00$ucSignIn$cbNewAccount", "cbNewAccount");
        form.put("ctl00$ucSignIn$txtFullName", "");
        form.put("ctl00$ucSignIn$txtModalNewPassword", "");
        form.put("ctl00$ucSignIn$txtPhone", "");
        form.put("ctl00$ucSignIn$txtCompanyName", "");
        form.put("ctl00$ucSignIn$drpTitle", "");
        form.put("ctl00$ucSignIn$txtTitleName", "");
        form.put("ctl00$ucSignIn$txtModalPassword", "");
        return form;
    }
}
