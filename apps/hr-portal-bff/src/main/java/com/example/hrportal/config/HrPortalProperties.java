package com.example.hrportal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "hr-portal")
public class HrPortalProperties {

    private Client client = new Client();
    private ListView listView = new ListView();

    @Data
    public static class Client {
        private ServiceConfig hrApi = new ServiceConfig();
    }

    @Data
    public static class ServiceConfig {
        private String baseUrl = "http://localhost:8000/api/v1";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(30);
        private int maxInMemorySizeKb = 2048;
    }

    @Data
    public static class ListView {
        private int defaultPageSize = 10;
        private List<Integer> allowedPageSizes = List.of(5, 10, 25, 50);
        private int unboundedPageSize = 100;  // the HR API caps page_size at 100
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
        private long maxSessions = 10_000;
    }
}
