/*
 *  This file is part of geomesh.
 *
 *  Geomesh is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geomesh is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geomesh. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geomesh.service.loader;

import com.dedicatedcode.geomesh.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view on one block of a pipeline file. Every accessor names the offending field in its error.
 */
public class ConfigSection {

    private final String name;
    private final Map<String, Object> values;

    public ConfigSection(String name, Map<String, Object> values) {
        this.name = name;
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public String getName() {
        return name;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public String requireString(String key) {
        String value = optionalString(key);
        if (value == null || value.isBlank()) {
            throw missing(key);
        }
        return value;
    }

    public String optionalString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public int requireInt(String key) {
        Integer value = optionalInt(key);
        if (value == null) {
            throw missing(key);
        }
        return value;
    }

    public Integer optionalInt(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "an integer");
        }
    }

    public double requireDouble(String key) {
        Double value = optionalDouble(key);
        if (value == null) {
            throw missing(key);
        }
        return value;
    }

    public Double optionalDouble(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "a number");
        }
    }

    public boolean optionalBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw invalid(key, value, "true or false");
    }

    public List<String> stringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw invalid(key, value, "a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    public Map<String, String> stringMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw invalid(key, value, "a mapping");
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }

    public ConfigSection section(String key) {
        Object value = values.get(key);
        if (value == null) {
            return new ConfigSection(key, Collections.emptyMap());
        }
        return new ConfigSection(key, asMap(key, value));
    }

    public List<ConfigSection> sectionList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw invalid(key, value, "a list");
        }
        List<ConfigSection> result = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String itemName = key + "[" + i + "]";
            result.add(new ConfigSection(itemName, asMap(itemName, list.get(i))));
        }
        return result;
    }

    public ConfigurationException missing(String key) {
        return new ConfigurationException("Mandatory parameter " + qualified(key) + " is missing or empty");
    }

    public ConfigurationException invalid(String key, Object value, String expected) {
        return new ConfigurationException("Parameter " + qualified(key) + " must be " + expected + " but was: " + value);
    }

    private String qualified(String key) {
        return name == null || name.isEmpty() ? key : name + "." + key;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(String key, Object value) {
        if (!(value instanceof Map<?, ?>)) {
            throw invalid(key, value, "a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
