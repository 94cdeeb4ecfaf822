package de.entwicklertraining.capi.pagination;

import org.json.JSONObject;

import java.net.URI;
import java.util.Optional;

/**
 * Hyperlink as it appears in v3 responses.
 */
public record Link(String href, String method) {

    public Link(String href) {
        this(href, null);
    }

    /**
     * @return the link, or {@code null} if {@code json} is {@code null} or carries no href
     */
    static Link fromJson(JSONObject json) {
        if (json == null || !json.has("href") || json.isNull("href")) {
            return null;
        }
        return new Link(json.getString("href"), json.optString("method", null));
    }

    /**
     * Reads an integer query parameter from the href, e.g. {@code page}.
     */
    public Optional<Integer> queryInt(String name) {
        if (href == null) {
            return Optional.empty();
        }
        String query;
        try {
            query = URI.create(href).getRawQuery();
        } catch (IllegalArgumentException e) {
            int idx = href.indexOf('?');
            query = idx >= 0 ? href.substring(idx + 1) : null;
        }
        if (query == null) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                try {
                    return Optional.of(Integer.parseInt(pair.substring(eq + 1)));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
