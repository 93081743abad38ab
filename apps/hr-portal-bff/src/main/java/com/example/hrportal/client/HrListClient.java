package com.example.hrportal.client;

import com.example.hrportal.listview.ListDataSource;
import com.example.hrportal.listview.ListQuery;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.PagedResult;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Typed wrapper around one paginated HR API list endpoint.
 */
public interface HrListClient<T> {

    @NonNull
    ListViewType viewType();

    /**
     * @param authorization the caller's {@code Authorization} header to relay, if any
     */
    @NonNull
    Mono<PagedResult<T>> fetchPage(@NonNull ListQuery query, @Nullable String authorization);

    @NonNull
    default ListDataSource<T> asDataSource(@Nullable String authorization) {
        return query -> fetchPage(query, authorization);
    }
}
