package com.example.resourceapi.scroll;

import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.common.util.StringSanitizer;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Validates raw list parameters into {@link ScrollParameters}.
 */
@Component
public class ScrollQueryBuilder {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;
    public static final String DEFAULT_SORT_FIELD = "name";

    /**
     * @param name              optional substring filter on {@code name}
     * @param afterId           optional cursor from a previous page
     * @param limit             page size as received; clamped to [{@value #MIN_LIMIT}, {@value #MAX_LIMIT}]
     * @param sortBy            sort field, must be one of {@code allowedSortFields}
     * @param order             {@code asc} or {@code desc}
     * @param allowedSortFields the resource's sort allow-list
     * @throws ValidationException on a non-numeric limit, unknown sort field, bad order or malformed cursor
     */
    public ScrollParameters build(
            String name,
            String afterId,
            String limit,
            String sortBy,
            String order,
            List<String> allowedSortFields) {

        int pageSize = parseLimit(limit);

        String sortField = sortBy == null || sortBy.isBlank() ? DEFAULT_SORT_FIELD : sortBy.trim();
        if (!allowedSortFields.contains(sortField)) {
            throw new ValidationException("Invalid sort_by field '" + StringSanitizer.forLog(sortField, 64)
                    + "'. Allowed: " + allowedSortFields);
        }

        SortOrder sortOrder = order == null || order.isBlank() ? SortOrder.ASC : SortOrder.parse(order);

        String cursorId = afterId == null || afterId.isBlank() ? null : CursorCodec.decode(afterId);

        String nameFilter = name == null || name.isEmpty() ? null : name;

        return new ScrollParameters(nameFilter, cursorId, pageSize, sortField, sortOrder);
    }

    static int parseLimit(String limit) {
        if (limit == null || limit.isBlank()) {
            return DEFAULT_LIMIT;
        }
        BigInteger parsed;
        try {
            parsed = new BigInteger(limit.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid limit '" + StringSanitizer.forLog(limit, 32) + "'. Must be a number");
        }
        // any magnitude clamps, including values past the long range
        return parsed.max(BigInteger.valueOf(MIN_LIMIT)).min(BigInteger.valueOf(MAX_LIMIT)).intValue();
    }
}
