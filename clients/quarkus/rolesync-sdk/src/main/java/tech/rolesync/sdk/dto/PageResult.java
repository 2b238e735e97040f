package tech.rolesync.sdk.dto;

import java.util.List;

/**
 * One page of a paginated list. {@code total} is null when the server did not report it.
 */
public record PageResult<T>(
    List<T> items,
    int page,
    int pageSize,
    Long total
) {

    /**
     * True when another page may hold more items.
     */
    public boolean hasNext() {
        if (items.isEmpty()) {
            return false;
        }
        if (total != null) {
            return (long) page * pageSize < total;
        }
        return items.size() >= pageSize;
    }

    public static <T> PageResult<T> empty(int page, int pageSize) {
        return new PageResult<>(List.of(), page, pageSize, 0L);
    }
}
