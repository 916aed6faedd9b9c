// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.vector;

import io.pfive.canopy.geo.Crs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// A named set of features sharing one coordinate system and one ordered list of attribute fields.
/// Feature order is significant: it is the order in which stages visit tiles and regions.
public class FeatureLayer {

    public final String name;
    public final String crs;
    private final List<String> fields;
    private final List<Feature> features;

    public FeatureLayer (String name, String crs, List<String> fields, List<Feature> features) {
        this.name = name;
        this.crs = Crs.normalize(crs);
        this.fields = new ArrayList<>(fields);
        this.features = new ArrayList<>(features);
    }

    public FeatureLayer (String name, String crs, List<String> fields) {
        this(name, crs, fields, List.of());
    }

    public List<String> fields () {
        return Collections.unmodifiableList(fields);
    }

    public List<Feature> features () {
        return Collections.unmodifiableList(features);
    }

    public int size () {
        return features.size();
    }

    public void add (Feature feature) {
        for (String field : fields) {
            feature.properties.putIfAbsent(field, null);
        }
        features.add(feature);
    }

    public boolean hasField (String field) {
        return fields.contains(field);
    }

    /// @throws SchemaException if the layer has no such field.
    public void requireField (String field) {
        if (!hasField(field)) throw new SchemaException(name, field);
    }

    /// Add a field with no value on any feature. No effect if the field already exists.
    public void addField (String field) {
        if (hasField(field)) return;
        fields.add(field);
        for (Feature feature : features) feature.properties.put(field, null);
    }

    /// Remove a field and its values from every feature. No effect if the field does not exist.
    public void deleteField (String field) {
        if (!fields.remove(field)) return;
        for (Feature feature : features) feature.properties.remove(field);
    }

}
