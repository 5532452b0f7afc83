package com.cors.handler.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * In-memory {@link CorsResponse} that records headers and status so they can be
 * inspected or replayed onto another response later.
 *
 * <p>Header names are matched case-insensitively; the first spelling used is kept.</p>
 */
public class BufferedCorsResponse implements CorsResponse {

    /** Status value reported before {@link #setStatus(int)} is called. */
    public static final int NO_STATUS = 0;

    private final Map<String, Entry> headers = new LinkedHashMap<>();
    private int status = NO_STATUS;

    @Override
    public void addHeader(String name, String value) {
        headers.computeIfAbsent(key(name), k -> new Entry(name)).values.add(value);
    }

    @Override
    public void setHeader(String name, String value) {
        Entry entry = headers.computeIfAbsent(key(name), k -> new Entry(name));
        entry.values.clear();
        entry.values.add(value);
    }

    @Override
    public void setStatus(int status) {
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Returns all values of the named header in insertion order, or an empty list.
     */
    public List<String> getHeaders(String name) {
        Entry entry = headers.get(key(name));
        return entry == null ? Collections.emptyList() : Collections.unmodifiableList(entry.values);
    }

    /**
     * Returns the values of the named header joined with {@code ", "}, or an empty string.
     */
    public String getHeader(String name) {
        return String.join(", ", getHeaders(name));
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    /**
     * Returns the recorded header names in insertion order.
     */
    public List<String> getHeaderNames() {
        List<String> names = new ArrayList<>(headers.size());
        for (Entry entry : headers.values()) {
            names.add(entry.name);
        }
        return names;
    }

    /**
     * Passes every recorded (name, value) pair to the consumer, in insertion order.
     */
    public void forEachHeader(BiConsumer<String, String> consumer) {
        for (Entry entry : headers.values()) {
            for (String value : entry.values) {
                consumer.accept(entry.name, value);
            }
        }
    }

    /**
     * Copies the recorded headers onto another response: {@code Vary} values are appended,
     * every other header is set.
     */
    public void replayTo(CorsResponse target) {
        for (Entry entry : headers.values()) {
            if (CorsHeaders.VARY.equalsIgnoreCase(entry.name)) {
                for (String value : entry.values) {
                    target.addHeader(entry.name, value);
                }
            } else if (!entry.values.isEmpty()) {
                target.setHeader(entry.name, entry.values.get(entry.values.size() - 1));
            }
        }
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final class Entry {
        private final String name;
        private final List<String> values = new ArrayList<>();

        private Entry(String name) {
            this.name = name;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BufferedCorsResponse{status=").append(status);
        for (Entry entry : headers.values()) {
            sb.append(", ").append(entry.name).append('=').append(entry.values);
        }
        return sb.append('}').toString();
    }
}
