package com.geico.poc.streamcatalog.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.ObjectKind;

import java.util.Objects;

/**
 * One change to one catalog object.
 *
 * Created and Altered carry the full object as committed. Dropped carries only the id
 * and kind. Applying a delta is idempotent: re-applying a Created or Altered replaces the
 * object with an equal one, and a Dropped for an absent id does nothing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogDelta {

    public enum Type {
        CREATED,
        ALTERED,
        DROPPED
    }

    private final Type type;
    private final ObjectKind kind;
    private final long objectId;
    private final CatalogObject object;

    @JsonCreator
    public CatalogDelta(
            @JsonProperty("type") Type type,
            @JsonProperty("kind") ObjectKind kind,
            @JsonProperty("objectId") long objectId,
            @JsonProperty("object") CatalogObject object) {
        this.type = type;
        this.kind = kind;
        this.objectId = objectId;
        this.object = object;
    }

    public static CatalogDelta created(CatalogObject object) {
        return new CatalogDelta(Type.CREATED, object.kind(), object.getId(), object);
    }

    public static CatalogDelta altered(CatalogObject object) {
        return new CatalogDelta(Type.ALTERED, object.kind(), object.getId(), object);
    }

    public static CatalogDelta dropped(ObjectKind kind, long objectId) {
        return new CatalogDelta(Type.DROPPED, kind, objectId, null);
    }

    public Type getType() {
        return type;
    }

    public ObjectKind getKind() {
        return kind;
    }

    public long getObjectId() {
        return objectId;
    }

    /**
     * The object after the change; null for {@link Type#DROPPED}.
     */
    public CatalogObject getObject() {
        return object;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogDelta that = (CatalogDelta) o;
        return objectId == that.objectId && type == that.type && kind == that.kind
                && Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, kind, objectId);
    }

    @Override
    public String toString() {
        return type + " " + kind + " " + objectId;
    }
}
