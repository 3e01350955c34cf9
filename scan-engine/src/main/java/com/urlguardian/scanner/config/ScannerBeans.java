package com.urlguardian.scanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.policy.PolicyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Data tables and shared infrastructure beans.
 *
 * @author URL Guardian Team
 */
@Configuration
public class ScannerBeans {

    private static final Logger log = LoggerFactory.getLogger(ScannerBeans.class);

    @Bean
    public HeuristicDictionary heuristicDictionary(ObjectMapper objectMapper) {
        HeuristicDictionary dictionary = HeuristicDictionary.load(objectMapper, HeuristicDictionary.DEFAULT_RESOURCE);
        log.info("Loaded heuristic dictionary version {} ({} keywords, {} brands)",
                dictionary.version(), dictionary.sensitiveKeywords().size(), dictionary.brands().size());
        return dictionary;
    }

    @Bean
    public PolicyTable policyTable(ObjectMapper objectMapper) {
        PolicyTable table = PolicyTable.load(objectMapper, PolicyTable.DEFAULT_RESOURCE);
        log.info("Loaded policy table version {} ({} profiles)", table.version(), table.profiles().size());
        return table;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
