package com.example.resourceapi.scroll;

/**
 * Store-independent description of one page query.
 *
 * @param nameFilter case-insensitive substring to match against {@code name}, or null
 * @param sortField  allow-listed (possibly dotted) sort field
 * @param order      sort direction, applied to both the sort field and the {@code _id} tie-breaker
 * @param limit      page size; the store is asked for one more to detect {@code has_more}
 * @param after      continuation anchor, or null for the first page
 */
public record QueryPlan(
        String nameFilter,
        String sortField,
        SortOrder order,
        int limit,
        ScrollPosition after
) {
    public static QueryPlan of(ScrollParameters parameters, ScrollPosition after) {
        return new QueryPlan(
                parameters.name(),
                parameters.sortField(),
                parameters.order(),
                parameters.limit(),
                after);
    }

    public int fetchLimit() {
        return limit + 1;
    }

    public boolean hasNameFilter() {
        return nameFilter != null && !nameFilter.isEmpty();
    }
}
