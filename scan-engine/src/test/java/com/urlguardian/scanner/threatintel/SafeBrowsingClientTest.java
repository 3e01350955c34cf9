package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.*;

class SafeBrowsingClientTest {

    private SafeBrowsingClient client;

    @BeforeEach
    void setUp() {
        client = new SafeBrowsingClient(new ThreatIntelConfig(), new ObjectMapper(),
                WebClient.builder());
    }

    @Test
    void shouldVoteMaliciousOnMatch() {
        SourceVote vote = client.parseResponse("""
                {"matches": [
                  {"threatType": "SOCIAL_ENGINEERING", "platformType": "ANY_PLATFORM",
                   "threat": {"url": "http://evil.example/"}},
                  {"threatType": "MALWARE", "platformType": "ANY_PLATFORM",
                   "threat": {"url": "http://evil.example/"}}
                ]}
                """);

        assertEquals(SourceVote.Status.MALICIOUS, vote.status());
        assertEquals(80, vote.score());
        assertEquals("SOCIAL_ENGINEERING", vote.details().get("threat_type"));
        assertEquals(2, vote.details().get("match_count"));
    }

    @Test
    void shouldVoteCleanOnEmptyBody() {
        assertEquals(SourceVote.Status.CLEAN, client.parseResponse("{}").status());
    }

    @Test
    void shouldVoteUnknownOnGarbage() {
        assertEquals(SourceVote.Status.UNKNOWN, client.parseResponse("not json").status());
    }
}
