package com.nomadtap.tap.service;

import com.nomadtap.tap.error.SourceRequestException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pull-based cursor over one paginated listing. Single use: each {@link NomadApiClient#fetchPages}
 * call returns a fresh cursor starting at the first page.
 */
public final class PageCursor {

    private final NomadApiClient client;
    private final String path;
    private final Map<String, String> params;
    private final Set<String> seenTokens = new HashSet<>();

    private String nextToken;
    private boolean exhausted;
    private int pagesRead;

    PageCursor(NomadApiClient client, String path, Map<String, String> params) {
        this.client = client;
        this.path = path;
        this.params = new LinkedHashMap<>(params);
    }

    /**
     * Fetch the next page, or empty once the previous page carried no continuation token.
     */
    public Optional<Page> nextPage() {
        if (exhausted) {
            return Optional.empty();
        }
        Page page = client.fetchPage(path, params, nextToken);
        pagesRead++;

        if (page.hasNext()) {
            if (!seenTokens.add(page.nextToken())) {
                exhausted = true;
                throw new SourceRequestException(path,
                        "pagination loop detected, token " + page.nextToken() + " was already returned");
            }
            nextToken = page.nextToken();
        } else {
            exhausted = true;
        }
        return Optional.of(page);
    }

    public int pagesRead() {
        return pagesRead;
    }
}
