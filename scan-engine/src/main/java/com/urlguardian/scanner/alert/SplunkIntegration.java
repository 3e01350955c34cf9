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
import java.util.Map;

/**
 * Splunk HTTP Event Collector (HEC) integration.
 *
 * @see <a href=
 *      "https://docs.splunk.com/Documentation/Splunk/latest/Data/UsetheHTTPEventCollector">Splunk
 *      HEC</a>
 * @author URL Guardian Team
 */
@Component
@ConditionalOnProperty(prefix = "guardian.siem.splunk", name = "enabled", havingValue = "true")
public class SplunkIntegration implements SiemIntegration {

    private static final Logger log = LoggerFactory.getLogger(SplunkIntegration.class);

    private final WebClient webClient;

    @Value("${guardian.siem.splunk.index:main}")
    private String index;

    @Value("${guardian.siem.splunk.source-type:url_guardian}")
    private String sourceType;

    public SplunkIntegration(
            @Value("${guardian.siem.splunk.hec-url}") String hecUrl,
            @Value("${guardian.siem.splunk.hec-token}") String hecToken,
            WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder
                .baseUrl(hecUrl)
                .defaultHeader("Authorization", "Splunk " + hecToken)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public Mono<Void> send(IncidentReport report) {
        Map<String, Object> hecEvent = Map.of(
                "time", report.timestamp().getEpochSecond(),
                "host", "url-guardian",
                "source", "scan-engine",
                "sourcetype", sourceType,
                "index", index,
                "event", report);

        return webClient.post()
                .uri("/services/collector/event")
                .bodyValue(hecEvent)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(5))
                .doOnSuccess(resp -> log.debug("Splunk HEC accepted incident {}", report.id()))
                .then();
    }
}
