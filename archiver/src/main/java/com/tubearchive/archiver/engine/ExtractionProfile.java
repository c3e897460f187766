package com.tubearchive.archiver.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A simulated client identity presented to the source: a player-client hint
 * plus a matching header set. Different identities get different throttling
 * treatment, so the engine rotates through {@link #CHAIN}.
 */
public record ExtractionProfile(
        String name,
        String playerClient,
        Map<String, String> headers
) {

    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    public static final ExtractionProfile ANDROID = new ExtractionProfile("android", "android",
            headers("com.google.android.youtube/19.42.37 (Linux; Android 14)"));

    public static final ExtractionProfile TV_EMBEDDED = new ExtractionProfile("tv_embedded", "tv_embedded",
            headers("Mozilla/5.0 (SmartTV; Linux; Tizen 6.5) AppleWebKit/537.36"));

    public static final ExtractionProfile WEB = new ExtractionProfile("web", "web",
            headers("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7)"
                    + " AppleWebKit/605.1.15 (KHTML, like Gecko) Safari/605.1.15"));

    /**
     * Fixed preference order: most resilient first, most easily blocked last.
     */
    public static final List<ExtractionProfile> CHAIN = List.of(ANDROID, TV_EMBEDDED, WEB);

    public ExtractionProfile {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    private static Map<String, String> headers(String userAgent) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept-Language", ACCEPT_LANGUAGE);
        return headers;
    }
}
