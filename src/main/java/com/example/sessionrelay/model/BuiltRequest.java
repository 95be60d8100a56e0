package com.example.sessionrelay.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fully formed outbound request. Header order and casing are part of the value: two requests are equal
 * only if they would go on the wire identically.
 */
public final class BuiltRequest {

    public static final class Header {
        private final String name;
        private final String value;

        public Header(String name, String value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getName() { return name; }
        public String getValue() { return value; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Header)) return false;
            Header h = (Header) o;
            return name.equals(h.name) && value.equals(h.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, value);
        }

        @Override
        public String toString() {
            return name + ": " + value;
        }
    }

    private final String method;
    private final String url;
    private final List<Header> headers;
    private final String body; // nullable

    public BuiltRequest(String method, String url, List<Header> headers, String body) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.body = body;
    }

    public String getMethod() { return method; }
    public String getUrl() { return url; }
    public List<Header> getHeaders() { return headers; }
    public String getBody() { return body; }

    public String header(String name) {
        for (Header h : headers) {
            if (h.getName().equals(name)) return h.getValue();
        }
        return null;
    }

    public List<String> headerNames() {
        List<String> names = new ArrayList<>(headers.size());
        for (Header h : headers) names.add(h.getName());
        return names;
    }

    /**
     * Copy without the named header, order of the rest untouched.
     */
    public BuiltRequest withoutHeader(String name) {
        List<Header> kept = new ArrayList<>(headers.size());
        for (Header h : headers) {
            if (!h.getName().equals(name)) kept.add(h);
        }
        return new BuiltRequest(method, url, kept, body);
    }

    /**
     * HTTP/1.1-style rendering of the request line, headers and body.
     */
    public byte[] toWireBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(url).append("\r\n");
        for (Header h : headers) {
            sb.append(h.getName()).append(": ").append(h.getValue()).append("\r\n");
        }
        sb.append("\r\n");
        if (body != null) sb.append(body);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BuiltRequest)) return false;
        BuiltRequest that = (BuiltRequest) o;
        return method.equals(that.method) && url.equals(that.url)
                && headers.equals(that.headers) && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, url, headers, body);
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
