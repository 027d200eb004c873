package com.splitttr.gateway.websocket;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Minimal query string parser. The first occurrence of a parameter wins.
 */
final class QueryParams {

    private QueryParams() {}

    static Map<String, String> parse(String query) {
        if (query == null || query.isEmpty()) return Map.of();
        Map<String, String> out = new HashMap<>();
        for (String part : query.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.putIfAbsent(decode(part), "");
            } else {
                out.putIfAbsent(decode(part.substring(0, eq)), decode(part.substring(eq + 1)));
            }
        }
        return out;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
