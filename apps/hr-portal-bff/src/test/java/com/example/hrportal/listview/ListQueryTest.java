package com.example.hrportal.listview;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.util.MultiValueMap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ListQuery")
class ListQueryTest {

    @Test
    @DisplayName("Unset filters and empty search are omitted from the query string")
    void omitsUnsetInputs() {
        FilterState state = new FilterState(ListViewType.APPLICATIONS, "  ",
                Map.of(FilterKey.STATUS, FilterSelection.of("pending")), 2, PageSize.of(25));

        MultiValueMap<String, String> params = ListQuery.from(state, 100).toQueryParams();

        assertThat(params.keySet()).containsExactly("status", "page", "page_size");
        assertThat(params.getFirst("status")).isEqualTo("pending");
        assertThat(params.getFirst("page")).isEqualTo("2");
        assertThat(params.getFirst("page_size")).isEqualTo("25");
    }

    @Test
    @DisplayName("Search is trimmed and sent first")
    void searchTrimmed() {
        FilterState state = FilterState.initial(ListViewType.EMPLOYEES, PageSize.of(10)).withSearch(" ann ");

        MultiValueMap<String, String> params = ListQuery.from(state, 100).toQueryParams();

        assertThat(params.keySet()).first().isEqualTo("search");
        assertThat(params.getFirst("search")).isEqualTo("ann");
    }

    @Test
    @DisplayName("Unbounded page size is sent as the configured finite size")
    void unboundedPageSize() {
        FilterState state = FilterState.initial(ListViewType.JOBS, PageSize.UNBOUNDED);

        assertThat(ListQuery.from(state, 100).pageSize()).isEqualTo(100);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"all", "ALL", "   "})
    @DisplayName("Widget values meaning 'no selection' become unset")
    void widgetSentinels(String raw) {
        assertThat(FilterSelection.fromWidget(raw).isSet()).isFalse();
    }

    @Test
    @DisplayName("Filter state rejects keys the view does not offer")
    void filterStateRejectsForeignKey() {
        assertThatThrownBy(() -> new FilterState(ListViewType.JOBS, "",
                Map.of(FilterKey.ROLE, FilterSelection.of("manager")), 1, PageSize.of(10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Filter keys resolve by query parameter or enum name")
    void filterKeyLookup() {
        assertThat(FilterKey.fromName("department_id")).isEqualTo(FilterKey.DEPARTMENT_ID);
        assertThat(FilterKey.fromName("EMPLOYMENT_TYPE")).isEqualTo(FilterKey.EMPLOYMENT_TYPE);
        assertThatThrownBy(() -> FilterKey.fromName("salary")).isInstanceOf(IllegalArgumentException.class);
    }
}
