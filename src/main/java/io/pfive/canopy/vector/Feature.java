// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.vector;

import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;

/// One geometry with its attribute values. Attribute names are those of the layer's fields, and a
/// field with no value for this feature maps to null.
public class Feature {

    public Geometry geometry;
    public final Map<String, Object> properties = new LinkedHashMap<>();

    public Feature (Geometry geometry) {
        this.geometry = geometry;
    }

    public Object get (String field) {
        return properties.get(field);
    }

    public void set (String field, Object value) {
        properties.put(field, value);
    }

    public String getString (String field) {
        Object value = properties.get(field);
        return value == null ? null : value.toString();
    }

    /// Numeric attribute value, accepting numbers stored as text. Null if absent or empty.
    public Number getNumber (String field) {
        Object value = properties.get(field);
        if (value == null) return null;
        if (value instanceof Number number) return number;
        String text = value.toString().strip();
        if (text.isEmpty()) return null;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Value '%s' of field '%s' is not a number.", text, field), e);
        }
    }

}
