package com.example.hrportal;

import com.example.hrportal.config.HrPortalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(HrPortalProperties.class)
public class HrPortalBffApplication {

    public static void main(String[] args) {
        SpringApplication.run(HrPortalBffApplication.class, args);
    }

}
