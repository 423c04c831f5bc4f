package com.tidewatch.data;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.data.http.HttpClientEx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned bodies keyed by URL path, recording every requested URL.
 */
final class ScriptedHttpClient extends HttpClientEx {
    private final Map<String, String> bodies = new LinkedHashMap<>();
    final List<String> requested = new ArrayList<>();

    ScriptedHttpClient() {
        super(1, 1);
    }

    ScriptedHttpClient on(String path, String body) {
        bodies.put(path, body);
        return this;
    }

    @Override
    public synchronized String getText(String url) throws FetchException {
        requested.add(url);
        int q = url.indexOf('?');
        String withoutQuery = q < 0 ? url : url.substring(0, q);
        for (Map.Entry<String, String> entry : bodies.entrySet()) {
            if (withoutQuery.endsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        throw new FetchException("HTTP 404 for " + withoutQuery);
    }
}
