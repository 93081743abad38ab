package com.example.hrportal.listview.session;

import com.example.hrportal.client.HrListClient;
import com.example.hrportal.common.exception.ListViewSessionNotFoundException;
import com.example.hrportal.config.HrPortalProperties;
import com.example.hrportal.listview.ListEvent;
import com.example.hrportal.listview.ListQuery;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.LoadStatus;
import com.example.hrportal.listview.PageSize;
import com.example.hrportal.listview.PagedResult;
import com.example.hrportal.observability.metrics.ListViewMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static com.example.hrportal.util.PagedResultTestBuilder.aPageOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ListViewSessionRegistry")
class ListViewSessionRegistryTest {

    private final AtomicLong nanos = new AtomicLong();
    private SimpleMeterRegistry meterRegistry;
    private StubJobsClient jobsClient;
    private ListViewSessionRegistry registry;

    /** Answers every request with three jobs and records what it was asked. */
    static class StubJobsClient implements HrListClient<String> {

        final List<ListQuery> queries = new ArrayList<>();
        final List<String> authorizations = new ArrayList<>();

        @Override
        public ListViewType viewType() {
            return ListViewType.JOBS;
        }

        @Override
        public Mono<PagedResult<String>> fetchPage(ListQuery query, String authorization) {
            queries.add(query);
            authorizations.add(authorization);
            return Mono.just(aPageOf(3, "a", "b", "c"));
        }
    }

    @BeforeEach
    void setUp() {
        HrPortalProperties properties = new HrPortalProperties();
        properties.getListView().setSessionIdleTimeout(Duration.ofMinutes(30));
        properties.getListView().setMaxSessions(100);

        meterRegistry = new SimpleMeterRegistry();
        jobsClient = new StubJobsClient();
        registry = new ListViewSessionRegistry(
                List.of(jobsClient), properties, new ListViewMetrics(meterRegistry), nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    private double sessionEvents(String event) {
        return meterRegistry.counter("list_view.session", "event", event).count();
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("Starts the first fetch with the default page size")
        void startsFirstFetch() {
            ListViewSession session = registry.open(ListViewType.JOBS, null, "Bearer t0k3n");

            assertThat(session.current().status()).isEqualTo(LoadStatus.READY);
            assertThat(session.current().viewModel().items()).hasSize(3);
            assertThat(jobsClient.queries).singleElement()
                    .satisfies(query -> assertThat(query.pageSize()).isEqualTo(10));
            assertThat(jobsClient.authorizations).containsExactly("Bearer t0k3n");
            assertThat(registry.activeSessions()).isEqualTo(1);
            assertThat(sessionEvents("opened")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Zero page size opens an unbounded view")
        void unbounded() {
            ListViewSession session = registry.open(ListViewType.JOBS, 0, null);

            assertThat(session.current().filters().pageSize()).isEqualTo(PageSize.UNBOUNDED);
            assertThat(jobsClient.queries.get(0).pageSize()).isEqualTo(100);
        }

        @Test
        @DisplayName("Rejects page sizes the portal does not offer")
        void rejectsUnknownPageSize() {
            assertThatThrownBy(() -> registry.open(ListViewType.JOBS, 7, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("7");
            assertThat(registry.activeSessions()).isZero();
        }

        @Test
        @DisplayName("Rejects views with no client")
        void rejectsViewWithoutClient() {
            assertThatThrownBy(() -> registry.open(ListViewType.EMPLOYEES, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Two clients for the same view fail fast")
        void duplicateClients() {
            assertThatThrownBy(() -> new ListViewSessionRegistry(
                    List.of(new StubJobsClient(), new StubJobsClient()),
                    new HrPortalProperties(), new ListViewMetrics(meterRegistry)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("lookup and close")
    class LookupAndClose {

        @Test
        @DisplayName("Unknown and malformed IDs are not found")
        void notFound() {
            assertThatThrownBy(() -> registry.get(UUID.randomUUID().toString()))
                    .isInstanceOf(ListViewSessionNotFoundException.class);
            assertThatThrownBy(() -> registry.get("../../etc/passwd"))
                    .isInstanceOf(ListViewSessionNotFoundException.class);
        }

        @Test
        @DisplayName("Close unmounts the view and forgets the session")
        void closeUnmounts() {
            ListViewSession session = registry.open(ListViewType.JOBS, 25, null);

            registry.close(session.id());

            assertThat(session.isClosed()).isTrue();
            assertThat(sessionEvents("closed")).isEqualTo(1.0);
            assertThatThrownBy(() -> registry.get(session.id()))
                    .isInstanceOf(ListViewSessionNotFoundException.class);
        }

        @Test
        @DisplayName("Events on a closed session are ignored")
        void eventsAfterClose() {
            ListViewSession session = registry.open(ListViewType.JOBS, null, null);
            registry.close(session.id());

            session.dispatch(new ListEvent.Refreshed());

            assertThat(jobsClient.queries).hasSize(1);
        }
    }

    @Nested
    @DisplayName("idle eviction")
    class IdleEviction {

        @Test
        @DisplayName("Idle sessions are closed after the timeout")
        void evictsIdle() {
            ListViewSession session = registry.open(ListViewType.JOBS, null, null);

            advance(Duration.ofMinutes(31));
            registry.evictIdleSessions();

            assertThat(session.isClosed()).isTrue();
            assertThat(registry.activeSessions()).isZero();
            assertThat(sessionEvents("closed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Access keeps a session alive")
        void accessKeepsAlive() {
            ListViewSession session = registry.open(ListViewType.JOBS, null, null);

            advance(Duration.ofMinutes(20));
            registry.get(session.id());
            advance(Duration.ofMinutes(20));
            registry.evictIdleSessions();

            assertThat(session.isClosed()).isFalse();
            assertThat(registry.get(session.id())).isSameAs(session);
        }

        @Test
        @DisplayName("Sessions beyond the cap are evicted and closed")
        void capEvicts() {
            HrPortalProperties properties = new HrPortalProperties();
            properties.getListView().setMaxSessions(1);
            ListViewSessionRegistry capped = new ListViewSessionRegistry(
                    List.of(jobsClient), properties, new ListViewMetrics(meterRegistry), nanos::get);

            ListViewSession first = capped.open(ListViewType.JOBS, null, null);
            ListViewSession second = capped.open(ListViewType.JOBS, null, null);

            assertThat(capped.activeSessions()).isEqualTo(1);
            assertThat(List.of(first, second)).filteredOn(ListViewSession::isClosed).hasSize(1);
        }

        @Test
        @DisplayName("Shutdown closes every session")
        void closeAll() {
            ListViewSession first = registry.open(ListViewType.JOBS, null, null);
            ListViewSession second = registry.open(ListViewType.JOBS, 50, null);

            registry.closeAll();

            assertThat(first.isClosed()).isTrue();
            assertThat(second.isClosed()).isTrue();
        }
    }
}
