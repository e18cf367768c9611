package com.mimecast.labeller.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Type safe, read-only access to a configuration map.
 * <p>Keys may address nested maps using dots, e.g. <i>session.maxSessions</i>.
 * <p>The backing map is deep copied on construction and never exposed mutably.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Configuration map.
     */
    private final Map<String, Object> map;

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        this.map = Collections.emptyMap();
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map == null ? Collections.emptyMap() : (Map<String, Object>) freeze(map);
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(Path path) throws IOException {
        this(parse(Files.readString(path, StandardCharsets.UTF_8)));
    }

    /**
     * Parses JSON5 text into a map.
     * <p>Gson lenient mode accepts comments, unquoted keys and single quoted strings.
     *
     * @param json5 JSON5 text.
     * @return Map instance.
     */
    public static Map<String, Object> parse(String json5) {
        try (Reader reader = new StringReader(json5)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return lookup(name) != null;
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = lookup(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets Long property with default.
     * <p>Gson reads every number as a double so values are narrowed here.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = lookup(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
            }
        }
        return defaultValue;
    }

    /**
     * Gets Double property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = lookup(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
            }
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean or null.
     */
    public Boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, null);
    }

    /**
     * Gets Boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public Boolean getBooleanProperty(String name, Boolean defaultValue) {
        Object value = lookup(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return Unmodifiable list, empty if missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = lookup(name);
        return value instanceof List ? (List<Object>) value : Collections.emptyList();
    }

    /**
     * Gets list property as strings.
     *
     * @param name Property name.
     * @return List of String, empty if missing.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        for (Object item : getListProperty(name)) {
            list.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Unmodifiable map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = lookup(name);
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    /**
     * Gets the whole configuration map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    private Object lookup(String name) {
        if (name == null) {
            return null;
        }
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            ((List<Object>) value).forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
