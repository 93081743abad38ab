package com.example.hrportal.listview.session;

import com.example.hrportal.client.HrListClient;
import com.example.hrportal.common.exception.ListViewSessionNotFoundException;
import com.example.hrportal.common.util.StringSanitizer;
import com.example.hrportal.config.HrPortalProperties;
import com.example.hrportal.listview.FetchCoordinator;
import com.example.hrportal.listview.FilterState;
import com.example.hrportal.listview.ListEvent;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.PageSize;
import com.example.hrportal.observability.metrics.ListViewMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Keeps the open list views, keyed by a random session ID.
 *
 * <p>Sessions idle longer than {@code hr-portal.list-view.session-idle-timeout}
 * are evicted. Eviction and explicit close both unmount the session's
 * coordinator, so responses still in flight are dropped.</p>
 */
@Slf4j
@Service
public class ListViewSessionRegistry {

    private final Map<ListViewType, HrListClient<?>> clients = new EnumMap<>(ListViewType.class);
    private final HrPortalProperties.ListView settings;
    private final ListViewMetrics metrics;
    private final Cache<String, ListViewSession> sessions;

    @Autowired
    public ListViewSessionRegistry(
            List<HrListClient<?>> listClients,
            HrPortalProperties properties,
            ListViewMetrics metrics) {
        this(listClients, properties, metrics, Ticker.systemTicker());
    }

    ListViewSessionRegistry(
            List<HrListClient<?>> listClients,
            HrPortalProperties properties,
            ListViewMetrics metrics,
            Ticker ticker) {
        this.settings = properties.getListView();
        this.metrics = metrics;
        for (HrListClient<?> client : listClients) {
            HrListClient<?> previous = clients.put(client.viewType(), client);
            if (previous != null) {
                throw new IllegalStateException("Two clients registered for " + client.viewType());
            }
        }

        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(settings.getSessionIdleTimeout())
                .maximumSize(settings.getMaxSessions())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String id, ListViewSession session, RemovalCause cause) -> {
                    if (session != null) {
                        session.close();
                        metrics.recordSessionClosed();
                        log.debug("List view session {} ({}) removed: {}", id, session.view().noun(), cause);
                    }
                })
                .build();

        log.info("List view sessions enabled for {} (idle-timeout={}, max={})",
                clients.keySet(), settings.getSessionIdleTimeout(), settings.getMaxSessions());
    }

    /**
     * Opens a view and starts its first fetch.
     *
     * @param pageSize      rows per page, {@code 0} for unbounded, or null for the default
     * @param authorization caller's {@code Authorization} header, relayed to the HR API
     * @throws IllegalArgumentException if the page size is not offered or no client serves the view
     */
    @NonNull
    public ListViewSession open(@NonNull ListViewType view, @Nullable Integer pageSize, @Nullable String authorization) {
        HrListClient<?> client = clients.get(view);
        if (client == null) {
            throw new IllegalArgumentException("No client configured for " + view.noun());
        }

        PageSize initialPageSize = resolvePageSize(pageSize == null ? settings.getDefaultPageSize() : pageSize);
        FetchCoordinator<?> coordinator = newCoordinator(client, FilterState.initial(view, initialPageSize), authorization);
        ListViewSession session = new ListViewSession(UUID.randomUUID().toString(), coordinator, Instant.now());

        sessions.put(session.id(), session);
        metrics.recordSessionOpened();
        log.debug("Opened {} list view session {}", view.noun(), session.id());

        session.dispatch(new ListEvent.Mounted());
        return session;
    }

    @NonNull
    public ListViewSession get(@NonNull String sessionId) {
        if (!StringSanitizer.isValidSessionId(sessionId)) {
            throw new ListViewSessionNotFoundException(sessionId);
        }
        ListViewSession session = sessions.getIfPresent(sessionId);
        if (session == null) {
            throw new ListViewSessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Unmounts a view. Unknown IDs are reported so the caller can tell a typo
     * from an already-expired session.
     */
    public void close(@NonNull String sessionId) {
        get(sessionId);
        sessions.invalidate(sessionId);
    }

    /**
     * Validates a page size against the sizes the portal offers.
     */
    @NonNull
    public PageSize resolvePageSize(int rows) {
        if (rows == 0) {
            return PageSize.UNBOUNDED;
        }
        if (!settings.getAllowedPageSizes().contains(rows)) {
            throw new IllegalArgumentException("Page size " + rows + " is not one of " + settings.getAllowedPageSizes());
        }
        return PageSize.of(rows);
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }

    @Scheduled(fixedRate = 60000)
    public void evictIdleSessions() {
        sessions.cleanUp();
    }

    @PreDestroy
    public void closeAll() {
        sessions.invalidateAll();
    }

    private <T> FetchCoordinator<T> newCoordinator(HrListClient<T> client, FilterState filters, String authorization) {
        return new FetchCoordinator<>(filters, client.asDataSource(authorization), settings.getUnboundedPageSize(), metrics);
    }
}
