package com.grantradar.catalog.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UrlUtils {
    private static final Pattern AUTHORITY = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*://([^/?#]*)");

    private UrlUtils() {
    }

    /**
     * Lower-cased network location of the URL (host plus any explicit port), or empty when the
     * URL is missing or cannot be parsed.
     */
    public static String netloc(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String authority = authorityOf(url.trim());
        if (authority == null) {
            return "";
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        return authority.toLowerCase(Locale.ROOT);
    }

    private static String authorityOf(String url) {
        URI uri = safeUri(url);
        if (uri != null) {
            return uri.getRawAuthority();
        }
        // URLs scraped with stray spaces or brackets fail strict parsing
        Matcher matcher = AUTHORITY.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
