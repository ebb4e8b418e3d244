package com.example.resourceapi.scroll;

import com.example.resourceapi.store.DocumentFields;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One batch of an infinite scroll listing.
 */
public record ScrollPage(
        @JsonProperty("items") List<Map<String, Object>> items,
        @JsonProperty("limit") int limit,
        @JsonProperty("has_more") boolean hasMore,
        @JsonProperty("next_cursor") String nextCursor
) {
    /**
     * Builds the page from a fetch of up to {@code limit + 1} documents.
     */
    public static ScrollPage fromFetched(List<Map<String, Object>> fetched, int limit) {
        boolean hasMore = fetched.size() > limit;
        List<Map<String, Object>> items = hasMore ? List.copyOf(fetched.subList(0, limit)) : List.copyOf(fetched);
        String nextCursor = hasMore && !items.isEmpty()
                ? CursorCodec.encode(DocumentFields.idOf(items.get(items.size() - 1)))
                : null;
        return new ScrollPage(items, limit, hasMore, nextCursor);
    }
}
