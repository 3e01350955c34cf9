package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scans fetched page markup for phishing patterns.
 *
 * <p>
 * Detection heuristics:
 * </p>
 * <ul>
 * <li>Password inputs on a page that talks about signing in</li>
 * <li>Brand names in visible text that the host does not carry</li>
 * <li>Excessive hidden inputs and iframes</li>
 * <li>Clipboard or keystroke capturing script</li>
 * <li>Obfuscated script ({@code eval}, {@code atob}, {@code fromCharCode})</li>
 * </ul>
 *
 * @author URL Guardian Team
 */
@Component
public class PageContentScanner {

    private static final Pattern LOGIN_TEXT = Pattern.compile("login|signin|sign in|log in", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYLOG_SCRIPT = Pattern.compile("clipboard|keylog|keypress|keydown",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OBFUSCATED_SCRIPT = Pattern.compile("eval\\(|atob\\(|fromCharCode",
            Pattern.CASE_INSENSITIVE);

    private final PageFetcher pageFetcher;
    private final HeuristicDictionary dictionary;
    private final ScannerConfig config;

    public PageContentScanner(PageFetcher pageFetcher, HeuristicDictionary dictionary, ScannerConfig config) {
        this.pageFetcher = pageFetcher;
        this.dictionary = dictionary;
        this.config = config;
    }

    /** Fetch the page and scan it. */
    public Mono<SignalResult<PageContentAnalysis>> collect(UrlFeatures features) {
        return collect(features, pageFetcher.fetch(features.fullUrl()));
    }

    /** Scan a page fetched by the caller, possibly shared with other collectors. */
    public Mono<SignalResult<PageContentAnalysis>> collect(UrlFeatures features, Mono<PageSnapshot> page) {
        Mono<SignalResult<PageContentAnalysis>> call = page.map(snapshot -> {
            PageContentAnalysis analysis = analyze(snapshot, features);
            return SignalResult.available(SignalSource.PAGE_CONTENT, analysis, analysis.truncated() ? 0.8 : 1.0);
        });
        return CollectorGuard.guard(SignalSource.PAGE_CONTENT, call, config.collectorTimeout());
    }

    public PageContentAnalysis analyze(PageSnapshot snapshot, UrlFeatures features) {
        Document doc = Jsoup.parse(snapshot.html(), snapshot.url());
        HeuristicDictionary.Page limits = dictionary.page();
        List<String> flags = new ArrayList<>();
        int score = 0;

        int forms = doc.select("form").size();
        int scripts = doc.select("script").size();
        int iframes = doc.select("iframe").size();
        int externalLinks = doc.select("[href^=http]").size();

        String visibleText = (doc.title() + " " + doc.text()).toLowerCase(Locale.ROOT);

        if (!doc.select("input[type=password]").isEmpty() && LOGIN_TEXT.matcher(visibleText).find()) {
            flags.add("login_form_detected");
            score += 20;
        }

        String url = features.fullUrl().toLowerCase(Locale.ROOT);
        for (String brand : limits.brands()) {
            if (visibleText.contains(brand) && !url.contains(brand)) {
                flags.add("brand_impersonation_" + brand);
                score += 30;
            }
        }

        if (doc.select("input[type=hidden]").size() > limits.maxHiddenInputs()) {
            flags.add("excessive_hidden_inputs");
            score += 15;
        }

        String scriptText = doc.select("script").stream()
                .map(Element::data)
                .collect(Collectors.joining("\n"));
        boolean keyHandlers = !doc.select("[onkeydown], [onkeypress], [oncopy], [onpaste]").isEmpty();
        if (keyHandlers || KEYLOG_SCRIPT.matcher(scriptText).find()) {
            flags.add("suspicious_javascript_clipboard_keylog");
            score += 35;
        }

        if (OBFUSCATED_SCRIPT.matcher(scriptText).find()) {
            flags.add("obfuscated_javascript");
            score += 25;
        }

        if (iframes > limits.maxIframes()) {
            flags.add("excessive_iframes");
            score += 20;
        }

        return new PageContentAnalysis(
                new PageContentAnalysis.Dom(forms, scripts, iframes, externalLinks),
                flags, Math.min(score, 100), snapshot.truncated());
    }
}
