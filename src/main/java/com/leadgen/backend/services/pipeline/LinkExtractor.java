package com.leadgen.backend.services.pipeline;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the internal pages of a site worth reading for research.
 */
public final class LinkExtractor {

    private static final List<String> SKIP_PATTERNS = List.of(
            "/wp-admin", "/admin", "/login", "/register", "/cart", "/checkout",
            "/account", "/profile", "/search", "/contact", "/privacy", "/terms",
            ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".zip",
            "#", "?", "javascript:", "mailto:", "tel:");

    private LinkExtractor() {
    }

    /**
     * Same-host links of {@code document}, without skipped paths or the page itself,
     * trailing slash removed, de-duplicated, in document order, at most {@code max}.
     */
    public static List<String> extract(Document document, String pageUrl, int max) {
        if (max <= 0) {
            return List.of();
        }
        String host = hostOf(pageUrl);
        if (host == null) {
            return List.of();
        }
        String self = normalize(pageUrl);

        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || isSkipped(href)) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (absolute.isEmpty() || isSkipped(absolute)) {
                continue;
            }
            if (!host.equals(hostOf(absolute))) {
                continue;
            }
            String normalized = normalize(absolute);
            if (!normalized.equals(self)) {
                links.add(normalized);
            }
            if (links.size() >= max) {
                break;
            }
        }
        return new ArrayList<>(links);
    }

    static boolean isSkipped(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        for (String pattern : SKIP_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/") && !trimmed.endsWith("://")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Lower-cased host without a leading "www.", or null when the URL has none.
     */
    public static String hostOf(String url) {
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
