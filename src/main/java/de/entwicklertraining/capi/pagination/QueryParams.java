package de.entwicklertraining.capi.pagination;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Query parameters of v3 list endpoints.
 * <p>
 * Multi-valued entries (include, fields, filters) are joined with commas. {@link #toMap()} is
 * sorted by key, so the same parameters always yield the same URL and cache key.
 */
public class QueryParams {

    private int page;
    private int perPage;
    private String orderBy = "";
    private String labelSelector = "";
    private List<String> include;
    private final Map<String, List<String>> fields = new LinkedHashMap<>();
    private final Map<String, List<String>> filters = new LinkedHashMap<>();

    public static QueryParams create() {
        return new QueryParams();
    }

    public QueryParams withPage(int page) {
        this.page = page;
        return this;
    }

    public QueryParams withPerPage(int perPage) {
        this.perPage = perPage;
        return this;
    }

    public QueryParams withOrderBy(String orderBy) {
        this.orderBy = orderBy == null ? "" : orderBy;
        return this;
    }

    public QueryParams withLabelSelector(String labelSelector) {
        this.labelSelector = labelSelector == null ? "" : labelSelector;
        return this;
    }

    /**
     * Appends to the included resources.
     */
    public QueryParams withInclude(String... resources) {
        if (include == null) {
            include = new ArrayList<>();
        }
        include.addAll(Arrays.asList(resources));
        return this;
    }

    /**
     * Replaces the selected fields of {@code resource}.
     */
    public QueryParams withFields(String resource, String... names) {
        fields.put(resource, new ArrayList<>(Arrays.asList(names)));
        return this;
    }

    /**
     * Appends values to the filter {@code name}.
     */
    public QueryParams withFilter(String name, String... values) {
        filters.computeIfAbsent(name, k -> new ArrayList<>()).addAll(Arrays.asList(values));
        return this;
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public String getLabelSelector() {
        return labelSelector;
    }

    public List<String> getInclude() {
        return include == null ? null : List.copyOf(include);
    }

    public Map<String, List<String>> getFields() {
        return fields;
    }

    public Map<String, List<String>> getFilters() {
        return filters;
    }

    /**
     * Copy with the page replaced, used when walking pages.
     */
    public QueryParams copyWithPage(int newPage) {
        QueryParams copy = new QueryParams();
        copy.page = newPage;
        copy.perPage = perPage;
        copy.orderBy = orderBy;
        copy.labelSelector = labelSelector;
        copy.include = include == null ? null : new ArrayList<>(include);
        fields.forEach((k, v) -> copy.fields.put(k, new ArrayList<>(v)));
        filters.forEach((k, v) -> copy.filters.put(k, new ArrayList<>(v)));
        return copy;
    }

    public Map<String, String> toMap() {
        Map<String, String> map = new TreeMap<>();
        if (page > 0) {
            map.put("page", Integer.toString(page));
        }
        if (perPage > 0) {
            map.put("per_page", Integer.toString(perPage));
        }
        if (!orderBy.isEmpty()) {
            map.put("order_by", orderBy);
        }
        if (!labelSelector.isEmpty()) {
            map.put("label_selector", labelSelector);
        }
        if (include != null && !include.isEmpty()) {
            map.put("include", String.join(",", include));
        }
        fields.forEach((resource, names) -> map.put("fields[" + resource + "]", String.join(",", names)));
        filters.forEach((name, values) -> map.put(name, String.join(",", values)));
        return map;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
