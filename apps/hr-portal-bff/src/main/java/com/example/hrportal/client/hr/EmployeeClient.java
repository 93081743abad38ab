package com.example.hrportal.client.hr;

import com.example.hrportal.client.HrListClient;
import com.example.hrportal.client.PagedListClient;
import com.example.hrportal.client.WebClientFactory;
import com.example.hrportal.listview.ListQuery;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.PagedResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Client for the employee directory.
 */
@Component
public class EmployeeClient implements HrListClient<EmployeeSummary> {

    private final PagedListClient<EmployeeSummary> pagedClient;

    public EmployeeClient(WebClientFactory webClientFactory, ObjectMapper objectMapper) {
        this.pagedClient = new PagedListClient<>(
                webClientFactory.hrApiClient(), objectMapper, ListViewType.EMPLOYEES, EmployeeSummary.class);
    }

    @Override
    @NonNull
    public ListViewType viewType() {
        return ListViewType.EMPLOYEES;
    }

    @Override
    @NonNull
    public Mono<PagedResult<EmployeeSummary>> fetchPage(@NonNull ListQuery query, @Nullable String authorization) {
        return pagedClient.fetchPage(query, authorization);
    }
}
