package kr.crownrpg.realtime.api.event;

/**
 * Row-change operation carried by a {@link ChangeEvent}.
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses the upper or lower case wire name ({@code "INSERT"}, {@code "update"}).
     *
     * @throws IllegalArgumentException for unknown or blank names
     */
    public static ChangeOperation fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("operation must not be blank");
        }
        for (ChangeOperation operation : values()) {
            if (operation.name().equalsIgnoreCase(name.trim())) {
                return operation;
            }
        }
        throw new IllegalArgumentException("unknown change operation: " + name);
    }
}
