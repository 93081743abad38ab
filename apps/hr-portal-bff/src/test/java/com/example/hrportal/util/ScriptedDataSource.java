package com.example.hrportal.util;

import com.example.hrportal.listview.ListDataSource;
import com.example.hrportal.listview.ListQuery;
import com.example.hrportal.listview.PagedResult;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

/**
 * Data source whose responses are released by the test, in any order.
 * Request {@code n} (0-based) is answered with {@link #succeed(int, PagedResult)}
 * or {@link #fail(int, Throwable)}.
 */
public class ScriptedDataSource implements ListDataSource<String> {

    private final List<ListQuery> queries = new ArrayList<>();
    private final List<Sinks.One<PagedResult<String>>> responses = new ArrayList<>();

    @Override
    public Mono<PagedResult<String>> fetch(ListQuery query) {
        queries.add(query);
        Sinks.One<PagedResult<String>> response = Sinks.one();
        responses.add(response);
        return response.asMono();
    }

    public void succeed(int request, PagedResult<String> result) {
        responses.get(request).tryEmitValue(result);
    }

    public void fail(int request, Throwable error) {
        responses.get(request).tryEmitError(error);
    }

    public void succeedLatest(PagedResult<String> result) {
        succeed(responses.size() - 1, result);
    }

    public ListQuery lastQuery() {
        return queries.get(queries.size() - 1);
    }

    public int requestCount() {
        return queries.size();
    }
}
