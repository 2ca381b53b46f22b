package com.delta.catalogcrawler.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "gclid",
        "fbclid",
        "msclkid",
        "mc_cid",
        "mc_eid",
        "_ga",
        "ref"
    );

    private UrlNormalizer() {
    }

    /**
     * Canonical form used for dedup: lowercase scheme and host, no fragment, no default port,
     * no tracking parameters, no trailing slash except for the root path.
     * Returns null for anything that is not an absolute http(s) URL with a host.
     */
    public static String normalize(String candidate) {
        URI uri = safeUri(candidate == null ? null : candidate.trim());
        if (uri == null || uri.getHost() == null || !isHttpScheme(uri.getScheme())) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = stripTrackingParams(uri.getRawQuery());

        StringBuilder out = new StringBuilder(scheme).append("://").append(host);
        if (port > 0) {
            out.append(':').append(port);
        }
        out.append(path);
        if (query != null && !query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:") || trimmed.startsWith("#")) {
            return null;
        }
        URI base = safeUri(baseUrl);
        if (base != null && trimmed.startsWith("?")) {
            // URI.resolve drops the last path segment for query-only references
            String path = base.getRawPath() == null || base.getRawPath().isEmpty() ? "/" : base.getRawPath();
            String authority = base.getRawAuthority() == null ? "" : "//" + base.getRawAuthority();
            return normalize(base.getScheme() + ":" + authority + path + trimmed);
        }
        try {
            URI resolved = base == null ? new URI(trimmed) : base.resolve(trimmed);
            return normalize(resolved.toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * True when {@code host} is {@code domain} or one of its subdomains.
     */
    public static boolean isWithinDomain(String host, String domain) {
        if (host == null || domain == null || domain.isBlank()) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        String d = domain.trim().toLowerCase(Locale.ROOT);
        if (d.startsWith("www.")) {
            d = d.substring(4);
        }
        return h.equals(d) || h.endsWith("." + d);
    }

    public static boolean isHttpScheme(String scheme) {
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static String pathAndQuery(String url) {
        URI uri = safeUri(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = (eq >= 0 ? pair.substring(0, eq) : pair).toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMS.contains(name)) {
                continue;
            }
            kept.add(pair);
        }
        return String.join("&", kept);
    }
}
