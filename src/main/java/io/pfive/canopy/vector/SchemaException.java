// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.vector;

/// A layer lacks an attribute field that the running stage cannot do without. Unlike a missing
/// tile or artifact, this affects every feature, so the stage stops.
public class SchemaException extends RuntimeException {

    public final String layer;
    public final String field;

    public SchemaException (String layer, String field) {
        super(String.format("Layer '%s' has no field named '%s'.", layer, field));
        this.layer = layer;
        this.field = field;
    }

}
