package com.urlguardian.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * URL Guardian Scan Engine.
 *
 * <p>
 * Spring Boot application that inspects a submitted URL through independent
 * signal collectors (URL structure, redirects, page content, forms, TLS,
 * reputation, WHOIS, IP risk, credential breaches), merges their outputs into
 * one risk verdict and persists the outcome as an incident record.
 * </p>
 *
 * @author URL Guardian Team
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class ScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScannerApplication.class, args);
    }
}
