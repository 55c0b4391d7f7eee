package io.shuttle.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered header multimap.
 *
 * <p>Names are compared case-insensitively while the declared casing is kept for output. A name may
 * carry several values; both names and values keep insertion order. Every mutator returns a new
 * instance.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(List.of());

    private final List<Entry> entries;

    private HttpHeaders(List<Entry> entries) {
        this.entries = entries;
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    /**
     * Creates headers from a single-valued map, keeping the map's iteration order.
     */
    public static HttpHeaders of(Map<String, String> headers) {
        HttpHeaders out = EMPTY;
        if (headers == null) return out;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            out = out.withAdded(e.getKey(), e.getValue());
        }
        return out;
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    /**
     * @return all values for {@code name}, empty if absent
     */
    public List<String> values(String name) {
        int i = indexOf(name);
        return i < 0 ? List.of() : entries.get(i).values;
    }

    public Optional<String> firstValue(String name) {
        List<String> values = values(name);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * @return the values for {@code name} joined by {@code ", "}, or an empty string if absent
     */
    public String line(String name) {
        return String.join(", ", values(name));
    }

    /**
     * Replaces every value of {@code name}. An existing entry keeps its position and takes the new casing.
     */
    public HttpHeaders with(String name, List<String> values) {
        String validName = validateName(name);
        List<String> copy = copyValues(values);
        List<Entry> next = new ArrayList<>(entries);
        int i = indexOf(validName);
        if (i >= 0) {
            next.set(i, new Entry(validName, copy));
        } else {
            next.add(new Entry(validName, copy));
        }
        return new HttpHeaders(Collections.unmodifiableList(next));
    }

    public HttpHeaders with(String name, String value) {
        return with(name, List.of(Objects.requireNonNull(value, "value")));
    }

    /**
     * Appends {@code value} to {@code name}, keeping the casing it was first declared with.
     */
    public HttpHeaders withAdded(String name, String value) {
        String validName = validateName(name);
        Objects.requireNonNull(value, "value");
        List<Entry> next = new ArrayList<>(entries);
        int i = indexOf(validName);
        if (i >= 0) {
            Entry existing = next.get(i);
            List<String> values = new ArrayList<>(existing.values);
            values.add(value);
            next.set(i, new Entry(existing.name, Collections.unmodifiableList(values)));
        } else {
            next.add(new Entry(validName, List.of(value)));
        }
        return new HttpHeaders(Collections.unmodifiableList(next));
    }

    public HttpHeaders without(String name) {
        int i = indexOf(name);
        if (i < 0) return this;
        List<Entry> next = new ArrayList<>(entries);
        next.remove(i);
        return new HttpHeaders(Collections.unmodifiableList(next));
    }

    /**
     * @return header names in declaration order with their declared casing
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(entries.size());
        for (Entry e : entries) names.add(e.name);
        return Collections.unmodifiableList(names);
    }

    /**
     * @return one {@code "Name: value"} line per value, in declaration order
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        for (Entry e : entries) {
            for (String v : e.values) {
                lines.add(e.name + ": " + v);
            }
        }
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return an ordered snapshot keyed by declared name
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Entry e : entries) out.put(e.name, e.values);
        return Collections.unmodifiableMap(out);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    private int indexOf(String name) {
        if (name == null) return -1;
        String target = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).key.equals(target)) return i;
        }
        return -1;
    }

    private static String validateName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        if (name.indexOf(':') >= 0 || name.indexOf('\r') >= 0 || name.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("header name contains forbidden characters: " + name);
        }
        return name;
    }

    private static List<String> copyValues(List<String> values) {
        Objects.requireNonNull(values, "values");
        for (String v : values) {
            Objects.requireNonNull(v, "header value");
            if (v.indexOf('\r') >= 0 || v.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("header value contains a line break");
            }
        }
        return List.copyOf(values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof HttpHeaders)) return false;
        return entries.equals(((HttpHeaders) other).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static final class Entry {
        private final String name;
        private final String key;
        private final List<String> values;

        Entry(String name, List<String> values) {
            this.name = name;
            this.key = name.toLowerCase(Locale.ROOT);
            this.values = values;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof Entry)) return false;
            Entry e = (Entry) other;
            return name.equals(e.name) && values.equals(e.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, values);
        }
    }
}
