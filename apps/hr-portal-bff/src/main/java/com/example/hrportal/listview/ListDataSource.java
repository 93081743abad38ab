package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Paginated endpoint the fetch coordinator reads from.
 */
@FunctionalInterface
public interface ListDataSource<T> {

    @NonNull
    Mono<PagedResult<T>> fetch(@NonNull ListQuery query);
}
