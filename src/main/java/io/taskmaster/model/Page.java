package io.taskmaster.model;

import java.util.List;

/**
 * One page of a filtered listing; {@code count} is the total number of matches.
 */
public record Page<T>(List<T> items, long count, boolean hasMore) {
}
