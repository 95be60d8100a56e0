package com.example.sessionrelay.request;

import com.example.sessionrelay.exception.InvalidParametersException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller parameters checked against an endpoint's declared parameter list and coerced to their types.
 */
final class RequestParams {

    enum Type { INT, STRING }

    static final class Param {
        final String name;
        final Type type;
        final boolean required;
        final Object defaultValue;

        private Param(String name, Type type, boolean required, Object defaultValue) {
            this.name = name;
            this.type = type;
            this.required = required;
            this.defaultValue = defaultValue;
        }

        static Param requiredString(String name) {
            return new Param(name, Type.STRING, true, null);
        }

        static Param optionalString(String name) {
            return new Param(name, Type.STRING, false, null);
        }

        static Param intWithDefault(String name, int defaultValue) {
            return new Param(name, Type.INT, false, defaultValue);
        }
    }

    private final Map<String, Object> values;

    private RequestParams(Map<String, Object> values) {
        this.values = values;
    }

    static RequestParams resolve(String endpoint, List<Param> specs, Map<String, Object> raw) {
        Map<String, Object> input = raw == null ? Collections.emptyMap() : raw;
        for (String key : input.keySet()) {
            if (specs.stream().noneMatch(s -> s.name.equals(key))) {
                throw new InvalidParametersException("Unknown parameter '" + key + "' for endpoint " + endpoint);
            }
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (Param spec : specs) {
            Object v = input.get(spec.name);
            if (v == null) {
                if (spec.required) {
                    throw new InvalidParametersException("Missing parameter '" + spec.name + "' for endpoint " + endpoint);
                }
                if (spec.defaultValue != null) out.put(spec.name, spec.defaultValue);
                continue;
            }
            out.put(spec.name, coerce(endpoint, spec, v));
        }
        return new RequestParams(out);
    }

    private static Object coerce(String endpoint, Param spec, Object v) {
        switch (spec.type) {
            case INT: {
                long n;
                if (v instanceof Number) {
                    double d = ((Number) v).doubleValue();
                    if (d != Math.rint(d)) throw badType(endpoint, spec, v);
                    n = ((Number) v).longValue();
                } else if (v instanceof String) {
                    try {
                        n = Long.parseLong(((String) v).trim());
                    } catch (NumberFormatException e) {
                        throw badType(endpoint, spec, v);
                    }
                } else {
                    throw badType(endpoint, spec, v);
                }
                if (n < 0 || n > Integer.MAX_VALUE) {
                    throw new InvalidParametersException("Parameter '" + spec.name + "' out of range: " + n);
                }
                return (int) n;
            }
            case STRING: {
                if (!(v instanceof String) && !(v instanceof Number)) throw badType(endpoint, spec, v);
                String s = String.valueOf(v).trim();
                if (s.isEmpty()) {
                    if (spec.required) {
                        throw new InvalidParametersException("Parameter '" + spec.name + "' must not be blank");
                    }
                    return null;
                }
                return s;
            }
            default:
                throw new IllegalStateException("unhandled type " + spec.type);
        }
    }

    private static InvalidParametersException badType(String endpoint, Param spec, Object v) {
        return new InvalidParametersException("Parameter '" + spec.name + "' of endpoint " + endpoint
                + " expects " + spec.type.name().toLowerCase() + ", got " + v.getClass().getSimpleName());
    }

    int getInt(String name) {
        return (Integer) values.get(name);
    }

    String getString(String name) {
        return (String) values.get(name);
    }

    /** Null when absent. */
    String optString(String name) {
        return (String) values.get(name);
    }
}
