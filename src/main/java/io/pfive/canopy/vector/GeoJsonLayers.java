// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pfive.canopy.store.FileStore;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Reads and writes feature layers as GeoJSON FeatureCollections. The collection document is handled
/// as a Jackson tree, and each geometry is handed to the JTS GeoJSON reader or writer.
///
/// Two members beyond the core format are used, as several GIS tools do: a named "crs", since the
/// layers are in projected systems rather than WGS84, and a "fields" array listing the attribute
/// fields in order. The fields list preserves a layer's schema even when it has no features, or
/// when no feature has a value for some field. If it is absent, fields are collected from the
/// features' properties in order of first appearance.
public abstract class GeoJsonLayers {

    /// Assumed when a file does not say. This is what GeoJSON itself specifies.
    public static final String DEFAULT_CRS = "EPSG:4326";

    public static FeatureLayer read (Path path) {
        JsonNode root = FileStore.readJsonTree(path);
        String name = root.path("name").asText(baseName(path));
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new IllegalArgumentException("Not a GeoJSON FeatureCollection: " + path);
        }
        String crs = readCrs(root);
        Set<String> fields = new LinkedHashSet<>();
        for (JsonNode field : root.path("fields")) {
            fields.add(field.asText());
        }
        GeoJsonReader geoJsonReader = new GeoJsonReader();
        List<Feature> features = new ArrayList<>();
        for (JsonNode featureNode : root.path("features")) {
            JsonNode geometryNode = featureNode.path("geometry");
            Geometry geometry = null;
            if (geometryNode.isObject()) {
                try {
                    geometry = geoJsonReader.read(geometryNode.toString());
                } catch (ParseException e) {
                    throw new RuntimeException("Invalid geometry in " + path, e);
                }
            }
            Feature feature = new Feature(geometry);
            Iterator<Map.Entry<String, JsonNode>> properties = featureNode.path("properties").fields();
            while (properties.hasNext()) {
                Map.Entry<String, JsonNode> entry = properties.next();
                fields.add(entry.getKey());
                feature.set(entry.getKey(), toValue(entry.getValue()));
            }
            features.add(feature);
        }
        FeatureLayer layer = new FeatureLayer(name, crs, new ArrayList<>(fields));
        features.forEach(layer::add);
        return layer;
    }

    public static void write (FeatureLayer layer, Path path) {
        ObjectNode root = FileStore.objectMapper.createObjectNode();
        root.put("type", "FeatureCollection");
        root.put("name", layer.name);
        ObjectNode crs = root.putObject("crs");
        crs.put("type", "name");
        crs.putObject("properties").put("name", layer.crs);
        ArrayNode fields = root.putArray("fields");
        layer.fields().forEach(fields::add);
        GeoJsonWriter geoJsonWriter = new GeoJsonWriter();
        geoJsonWriter.setEncodeCRS(false);
        ArrayNode features = root.putArray("features");
        for (Feature feature : layer.features()) {
            ObjectNode featureNode = features.addObject();
            featureNode.put("type", "Feature");
            ObjectNode properties = featureNode.putObject("properties");
            for (String field : layer.fields()) {
                Object value = feature.get(field);
                if (value == null) {
                    properties.putNull(field);
                } else {
                    properties.set(field, FileStore.objectMapper.valueToTree(value));
                }
            }
            if (feature.geometry == null) {
                featureNode.putNull("geometry");
            } else {
                try {
                    featureNode.set("geometry", FileStore.objectMapper.readTree(geoJsonWriter.write(feature.geometry)));
                } catch (JsonProcessingException e) {
                    throw new RuntimeException(e);
                }
            }
        }
        FileStore.writeJsonTree(root, path);
    }

    private static String readCrs (JsonNode root) {
        JsonNode crs = root.path("crs");
        if (crs.isTextual()) return crs.asText();
        JsonNode name = crs.path("properties").path("name");
        if (name.isTextual()) return fromOgcUrn(name.asText());
        return DEFAULT_CRS;
    }

    /// Accept names like "urn:ogc:def:crs:EPSG::5070" as written by GDAL, as well as "EPSG:5070".
    static String fromOgcUrn (String name) {
        String prefix = "urn:ogc:def:crs:";
        if (!name.toLowerCase(Locale.ROOT).startsWith(prefix)) return name;
        String[] parts = name.substring(prefix.length()).split(":");
        String authority = parts[0];
        String code = parts[parts.length - 1];
        if (authority.equalsIgnoreCase("OGC") && code.equalsIgnoreCase("CRS84")) return DEFAULT_CRS;
        return authority + ":" + code;
    }

    private static Object toValue (JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) return node.doubleValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isTextual()) return node.textValue();
        return node.toString();
    }

    private static String baseName (Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

}
