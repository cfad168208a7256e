package ai.statute.converter.api;

import ai.statute.converter.text.TextFragments;
import ai.statute.converter.xml.StatuteConversionException;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Client for the e-Gov law API (version 2) returning XML payloads.
 */
public class EgovLawApiClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(EgovLawApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://laws.e-gov.go.jp/api/2";

    private final HttpClient httpClient;
    private final URI baseUrl;
    private final Duration timeout;

    public EgovLawApiClient(URI baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout);
    }

    public EgovLawApiClient(HttpClient httpClient, URI baseUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Searches laws whose title matches the given text.
     */
    public List<LawSummary> searchByTitle(String lawTitle) {
        if (lawTitle == null || lawTitle.isBlank()) {
            throw new IllegalArgumentException("lawTitle must not be blank");
        }
        String query = "response_format=xml&law_title=" + URLEncoder.encode(lawTitle, StandardCharsets.UTF_8);
        String body = get(endpoint("laws", query));
        List<LawSummary> laws = parseSearchResponse(body);
        LOGGER.info("Found {} law(s) for title '{}'", laws.size(), lawTitle);
        return laws;
    }

    /**
     * Fetches the full law data XML for a law id.
     */
    public String fetchLawXml(String lawId) {
        if (lawId == null || lawId.isBlank()) {
            throw new IllegalArgumentException("lawId must not be blank");
        }
        String path = "law_data/" + URLEncoder.encode(lawId.strip(), StandardCharsets.UTF_8);
        return get(endpoint(path, "response_format=xml"));
    }

    /**
     * Every non-blank element text of the law data, stripped, in document order.
     */
    public List<String> fetchTextFragments(String lawId) {
        return textFragments(fetchLawXml(lawId));
    }

    static List<LawSummary> parseSearchResponse(String xml) {
        Element root = parseResponse(xml);
        Optional<Element> laws = XmlElements.firstChild(root, "laws");
        if (laws.isEmpty()) {
            LOGGER.warn("'laws' element not found in search response");
            return List.of();
        }
        List<LawSummary> result = new ArrayList<>();
        for (Element law : XmlElements.children(laws.get(), "law")) {
            Optional<Element> lawInfo = XmlElements.firstChild(law, "law_info");
            Optional<Element> revisionInfo = XmlElements.firstChild(law, "revision_info");
            if (lawInfo.isEmpty() || revisionInfo.isEmpty()) {
                LOGGER.debug("Skipping incomplete law entry in search response");
                continue;
            }
            LawSummary summary = new LawSummary(
                    childText(lawInfo.get(), "law_id", "(no id)"),
                    childText(lawInfo.get(), "law_num", "(no number)"),
                    childText(revisionInfo.get(), "law_title", "(no title)"));
            LOGGER.debug("Law {} ({}): {}", summary.lawId(), summary.lawNum(), summary.title());
            result.add(summary);
        }
        return result;
    }

    static List<String> textFragments(String xml) {
        return TextFragments.of(parseResponse(xml));
    }

    private static Element parseResponse(String xml) {
        try {
            return XmlDocuments.parse(xml);
        } catch (StatuteConversionException ex) {
            throw new LawApiException("Law API returned an unreadable response", ex);
        }
    }

    private static String childText(Element parent, String tagName, String fallback) {
        return XmlElements.firstChild(parent, tagName)
                .map(Node::getTextContent)
                .orElse(fallback);
    }

    URI endpoint(String path, String query) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + path + "?" + query);
    }

    private String get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Accept", "application/xml")
                .timeout(timeout)
                .GET()
                .build();
        LOGGER.info("GET {}", uri);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new LawApiException("Law API returned status " + response.statusCode() + " for " + uri,
                        response.statusCode());
            }
            return response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LawApiException("Interrupted while calling " + uri, ex);
        } catch (IOException ex) {
            throw new LawApiException("Failed to invoke law API: " + uri, ex);
        }
    }
}
