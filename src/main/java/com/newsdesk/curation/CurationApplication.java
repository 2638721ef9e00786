package com.newsdesk.curation;

import com.newsdesk.curation.config.AppProperties;
import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.config.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProperties.class, LlmProperties.class, CurationProperties.class})
public class CurationApplication {
    public static void main(String[] args) {
        SpringApplication.run(CurationApplication.class, args);
    }
}
