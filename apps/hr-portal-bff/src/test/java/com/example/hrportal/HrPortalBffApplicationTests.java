package com.example.hrportal;

import com.example.hrportal.client.HrListClient;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.PageSize;
import com.example.hrportal.listview.session.ListViewSessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class HrPortalBffApplicationTests {

    @Autowired
    private ListViewSessionRegistry registry;

    @Autowired
    private List<HrListClient<?>> listClients;

    @Test
    void contextLoads() {
        assertThat(listClients)
                .extracting(HrListClient::viewType)
                .containsExactlyInAnyOrder(ListViewType.values());
        assertThat(registry.activeSessions()).isZero();
        assertThat(registry.resolvePageSize(25)).isEqualTo(PageSize.of(25));
    }
}
