package io.github.eutro.sidefx.analysis;

/**
 * How an operation accesses the resources it is given.
 */
public enum ResourceAccessKind {
    /**
     * The operation only reads its resources.
     */
    READ,
    /**
     * The operation writes (and possibly reads) its resources.
     */
    WRITE,
    /**
     * The operation accesses its resources, in some unspecified way. Treated as {@link #WRITE}.
     */
    UNKNOWN,
    /**
     * There is no resource access info for the operation. Unless it is known to be free of side effects,
     * it is assumed to access the unknown resource.
     */
    NOT_APPLICABLE;

    /**
     * Whether this kind says anything about which resources are accessed.
     *
     * @return Whether this is not {@link #NOT_APPLICABLE}.
     */
    public boolean hasAccessInfo() {
        return this != NOT_APPLICABLE;
    }
}
