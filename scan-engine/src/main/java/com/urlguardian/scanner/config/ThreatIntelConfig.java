package com.urlguardian.scanner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external intelligence providers.
 *
 * <p>
 * API keys are sourced from environment variables. A provider whose key is
 * blank is treated as disabled and reports {@code unknown} rather than
 * failing the lookup. Keyless providers (OpenPhish, ip-api, RDAP, DNS over
 * HTTPS) are always enabled.
 * </p>
 *
 * @author URL Guardian Team
 */
@Validated
@ConfigurationProperties(prefix = "guardian.threat-intel")
public class ThreatIntelConfig {

    @Valid
    private Provider virusTotal = new Provider("https://www.virustotal.com/api/v3");
    @Valid
    private Provider safeBrowsing = new Provider("https://safebrowsing.googleapis.com/v4");
    @Valid
    private OpenPhish openPhish = new OpenPhish();
    @Valid
    private Provider abuseIpDb = new Provider("https://api.abuseipdb.com/api/v2");
    @Valid
    private Provider ipApi = new Provider("http://ip-api.com");
    @Valid
    private Provider rdap = new Provider("https://rdap.org");
    @Valid
    private Provider dns = new Provider("https://dns.google");
    @Valid
    private Provider hibp = new Provider("https://haveibeenpwned.com/api/v3");

    public Provider getVirusTotal() {
        return virusTotal;
    }

    public void setVirusTotal(Provider virusTotal) {
        this.virusTotal = virusTotal;
    }

    public Provider getSafeBrowsing() {
        return safeBrowsing;
    }

    public void setSafeBrowsing(Provider safeBrowsing) {
        this.safeBrowsing = safeBrowsing;
    }

    public OpenPhish getOpenPhish() {
        return openPhish;
    }

    public void setOpenPhish(OpenPhish openPhish) {
        this.openPhish = openPhish;
    }

    public Provider getAbuseIpDb() {
        return abuseIpDb;
    }

    public void setAbuseIpDb(Provider abuseIpDb) {
        this.abuseIpDb = abuseIpDb;
    }

    public Provider getIpApi() {
        return ipApi;
    }

    public void setIpApi(Provider ipApi) {
        this.ipApi = ipApi;
    }

    public Provider getRdap() {
        return rdap;
    }

    public void setRdap(Provider rdap) {
        this.rdap = rdap;
    }

    public Provider getDns() {
        return dns;
    }

    public void setDns(Provider dns) {
        this.dns = dns;
    }

    public Provider getHibp() {
        return hibp;
    }

    public void setHibp(Provider hibp) {
        this.hibp = hibp;
    }

    public static class Provider {
        private String apiKey = "";
        @NotBlank
        private String baseUrl;
        @Min(100)
        private int timeoutMs = 5000;

        public Provider() {
        }

        public Provider(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        /** A provider is usable only when its API key has been configured. */
        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class OpenPhish extends Provider {
        @Min(60_000)
        private long refreshIntervalMs = 3_600_000;

        public OpenPhish() {
            super("https://openphish.com");
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }
    }
}
