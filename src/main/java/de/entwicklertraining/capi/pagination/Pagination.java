package de.entwicklertraining.capi.pagination;

import org.json.JSONObject;

import java.util.Optional;

/**
 * The {@code pagination} block of a list response.
 */
public record Pagination(int totalResults, int totalPages, Link first, Link last, Link next, Link previous) {

    public static Pagination empty() {
        return new Pagination(0, 0, null, null, null, null);
    }

    public static Pagination fromJson(JSONObject json) {
        if (json == null) {
            return empty();
        }
        return new Pagination(
                json.optInt("total_results", 0),
                json.optInt("total_pages", 0),
                Link.fromJson(json.optJSONObject("first")),
                Link.fromJson(json.optJSONObject("last")),
                Link.fromJson(json.optJSONObject("next")),
                Link.fromJson(json.optJSONObject("previous")));
    }

    public boolean hasNext() {
        return next != null;
    }

    public Optional<Link> getNext() {
        return Optional.ofNullable(next);
    }

    public Optional<Link> getPrevious() {
        return Optional.ofNullable(previous);
    }
}
