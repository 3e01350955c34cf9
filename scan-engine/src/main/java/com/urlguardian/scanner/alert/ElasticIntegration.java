package com.urlguardian.scanner.alert;

import com.urlguardian.scanner.incident.IncidentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Elasticsearch integration for incident indexing.
 *
 * <p>
 * Incidents go to a date-based index ({@code <index>-yyyy.MM.dd}) for search
 * and visualization in Kibana.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
@ConditionalOnProperty(prefix = "guardian.siem.elastic", name = "enabled", havingValue = "true")
public class ElasticIntegration implements SiemIntegration {

    private static final Logger log = LoggerFactory.getLogger(ElasticIntegration.class);

    private static final DateTimeFormatter INDEX_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private final WebClient webClient;

    @Value("${guardian.siem.elastic.index:url-guardian-incidents}")
    private String indexName;

    public ElasticIntegration(
            @Value("${guardian.siem.elastic.url}") String elasticUrl,
            @Value("${guardian.siem.elastic.api-key:}") String apiKey,
            WebClient.Builder webClientBuilder) {
        WebClient.Builder builder = webClientBuilder
                .baseUrl(elasticUrl)
                .defaultHeader("Content-Type", "application/json");

        if (apiKey != null && !apiKey.isEmpty()) {
            builder.defaultHeader("Authorization", "ApiKey " + apiKey);
        }

        this.webClient = builder.build();
    }

    @Override
    public Mono<Void> send(IncidentReport report) {
        Map<String, Object> document = new HashMap<>();
        document.put("@timestamp", report.timestamp().toString());
        document.put("incident_id", report.id());
        document.put("url", report.url());
        document.put("severity", report.severity().wireName());
        document.put("verdict", report.riskAssessment().verdict().wireName());
        document.put("score", report.riskAssessment().overallScore());
        document.put("red_flags", report.riskAssessment().redFlags());
        document.put("category", report.classification() == null
                ? "unknown"
                : report.classification().riskCategory().wireName());
        document.put("metadata", report.metadata());

        String dateIndex = indexName + "-" + INDEX_DATE.format(report.timestamp().atZone(ZoneOffset.UTC));

        return webClient.post()
                .uri("/{index}/_doc", dateIndex)
                .bodyValue(document)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(5))
                .doOnSuccess(resp -> log.debug("Elasticsearch accepted incident {}", report.id()))
                .then();
    }
}
