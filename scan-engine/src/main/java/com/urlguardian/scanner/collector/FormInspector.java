package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Inspects the forms of a page for credential-harvesting patterns.
 *
 * @author URL Guardian Team
 */
@Component
public class FormInspector {

    private static final Pattern SEED_FIELD = Pattern.compile("seed|phrase|private.*key|mnemonic|recovery",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CARD_FIELD = Pattern.compile("card|cvv|ccv|credit", Pattern.CASE_INSENSITIVE);

    private final PageFetcher pageFetcher;
    private final ScannerConfig config;

    public FormInspector(PageFetcher pageFetcher, ScannerConfig config) {
        this.pageFetcher = pageFetcher;
        this.config = config;
    }

    public Mono<SignalResult<FormInspection>> collect(UrlFeatures features) {
        return collect(features, pageFetcher.fetch(features.fullUrl()));
    }

    public Mono<SignalResult<FormInspection>> collect(UrlFeatures features, Mono<PageSnapshot> page) {
        Mono<SignalResult<FormInspection>> call = page.map(snapshot -> SignalResult.available(
                SignalSource.FORMS, inspect(snapshot), snapshot.truncated() ? 0.8 : 1.0));
        return CollectorGuard.guard(SignalSource.FORMS, call, config.collectorTimeout());
    }

    public FormInspection inspect(PageSnapshot snapshot) {
        Document doc = Jsoup.parse(snapshot.html(), snapshot.url());
        String pageHost = RedirectAnalyzer.hostOf(snapshot.url());

        List<FormInspection.FormRisk> forms = new ArrayList<>();
        int index = 0;
        for (Element form : doc.select("form")) {
            forms.add(inspectForm(index++, form, snapshot.url(), pageHost));
        }

        int pageScore = forms.stream().mapToInt(FormInspection.FormRisk::riskScore).max().orElse(0);
        return new FormInspection(forms, pageScore);
    }

    private FormInspection.FormRisk inspectForm(int index, Element form, String pageUrl, String pageHost) {
        Map<String, Integer> flags = new LinkedHashMap<>();
        String action = form.attr("action");
        String method = form.hasAttr("method") ? form.attr("method").toUpperCase(Locale.ROOT) : "GET";

        boolean crossOrigin = false;
        if (!action.isBlank() && pageHost != null) {
            String actionHost = actionHost(pageUrl, action);
            if (actionHost != null && !actionHost.equals(pageHost)) {
                crossOrigin = true;
                flags.put("cross_domain_form_submission", 40);
            }
        }

        List<FormInspection.Field> fields = new ArrayList<>();
        boolean hasPassword = false;
        for (Element input : form.select("input")) {
            String name = input.attr("name");
            String type = input.hasAttr("type") ? input.attr("type").toLowerCase(Locale.ROOT) : "text";
            boolean suspicious = false;

            if ("password".equals(type)) {
                hasPassword = true;
                flags.putIfAbsent("password_field", 15);
                suspicious = true;
            }
            if (SEED_FIELD.matcher(name).find()) {
                flags.putIfAbsent("seed_phrase_collection", 50);
                suspicious = true;
            }
            if (CARD_FIELD.matcher(name).find()) {
                flags.putIfAbsent("credit_card_collection", 40);
                suspicious = true;
            }
            fields.add(new FormInspection.Field(name, type, suspicious));
        }

        if (hasPassword && crossOrigin) {
            flags.put("credential_harvesting_form", 30);
        }

        int score = flags.values().stream().mapToInt(Integer::intValue).sum();
        return new FormInspection.FormRisk(index, action, method, fields, new ArrayList<>(flags.keySet()),
                Math.min(score, 100));
    }

    private static String actionHost(String pageUrl, String action) {
        try {
            String host = URI.create(pageUrl).resolve(action.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
