package ai.statute.converter.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves law titles to law ids, remembering every search result for the lifetime of the resolver.
 *
 * <p>Entries are keyed by the exact title string and are never evicted.</p>
 */
public class LawIdResolver {

    private final EgovLawApiClient client;
    private final Map<String, Map<String, String>> cache = new ConcurrentHashMap<>();

    public LawIdResolver(EgovLawApiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Law id of the law whose title equals the given one exactly.
     *
     * @throws LawApiException when no search hit carries exactly this title
     */
    public String resolveExact(String lawTitle) {
        String lawId = resolveAll(lawTitle).get(lawTitle);
        if (lawId == null) {
            throw new LawApiException("No law found with the exact title: " + lawTitle);
        }
        return lawId;
    }

    /**
     * All search hits for the title as an ordered title to law id mapping.
     */
    public Map<String, String> resolveAll(String lawTitle) {
        Objects.requireNonNull(lawTitle, "lawTitle");
        return cache.computeIfAbsent(lawTitle, this::search);
    }

    private Map<String, String> search(String lawTitle) {
        List<LawSummary> laws = client.searchByTitle(lawTitle);
        Map<String, String> byTitle = new LinkedHashMap<>();
        for (LawSummary law : laws) {
            byTitle.put(law.title(), law.lawId());
        }
        return Collections.unmodifiableMap(byTitle);
    }
}
