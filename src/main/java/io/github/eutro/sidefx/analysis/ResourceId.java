package io.github.eutro.sidefx.analysis;

import java.util.Collections;
import java.util.Set;

/**
 * Identifies a logical resource within one function, or is the {@link #UNKNOWN} resource,
 * which may alias any resource at all.
 */
public final class ResourceId {
    /**
     * The unknown resource.
     */
    public static final ResourceId UNKNOWN = new ResourceId(-1);
    /**
     * The set of just {@link #UNKNOWN}, the conservative answer to "what does this access?".
     */
    public static final Set<ResourceId> UNKNOWN_SET = Collections.singleton(UNKNOWN);

    private final long id;

    private ResourceId(long id) {
        this.id = id;
    }

    /**
     * Get the id of a known resource.
     *
     * @param id The id, which must not be negative.
     * @return The resource id.
     */
    public static ResourceId known(long id) {
        if (id < 0) throw new IllegalArgumentException("negative resource id: " + id);
        return new ResourceId(id);
    }

    public boolean isUnknown() {
        return id < 0;
    }

    /**
     * Get the numeric id of this resource.
     *
     * @return The id.
     * @throws IllegalStateException If this is the unknown resource.
     */
    public long getId() {
        if (isUnknown()) throw new IllegalStateException("the unknown resource has no id");
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceId)) return false;
        return id == ((ResourceId) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return isUnknown() ? "#unknown" : "#" + id;
    }
}
