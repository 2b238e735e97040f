package tech.rolesync.engine.provider;

import java.util.List;

/**
 * One page of a provider list call.
 *
 * @param hasMore whether another page should be requested
 */
public record Page<T>(
    List<T> items,
    int page,
    boolean hasMore
) {

    public static <T> Page<T> last(List<T> items, int page) {
        return new Page<>(items, page, false);
    }
}
