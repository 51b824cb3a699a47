package com.glossarymetrics.vacfetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VacancyFetcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(VacancyFetcherApplication.class, args);
    }
}
