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
 * Client for job listings.
 */
@Component
public class JobListingClient implements HrListClient<JobListing> {

    private final PagedListClient<JobListing> pagedClient;

    public JobListingClient(WebClientFactory webClientFactory, ObjectMapper objectMapper) {
        this.pagedClient = new PagedListClient<>(
                webClientFactory.hrApiClient(), objectMapper, ListViewType.JOBS, JobListing.class);
    }

    @Override
    @NonNull
    public ListViewType viewType() {
        return ListViewType.JOBS;
    }

    @Override
    @NonNull
    public Mono<PagedResult<JobListing>> fetchPage(@NonNull ListQuery query, @Nullable String authorization) {
        return pagedClient.fetchPage(query, authorization);
    }
}
