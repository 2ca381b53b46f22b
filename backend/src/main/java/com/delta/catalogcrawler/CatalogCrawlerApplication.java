package com.delta.catalogcrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CatalogCrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogCrawlerApplication.class, args);
    }
}
