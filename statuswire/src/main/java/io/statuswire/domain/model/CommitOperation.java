package io.statuswire.domain.model;

/**
 * Record mutation kind carried by a firehose commit.
 */
public enum CommitOperation {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String wireName;

    CommitOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return matching operation, or null for an unknown name
     */
    public static CommitOperation fromWire(String name) {
        for (CommitOperation op : values()) {
            if (op.wireName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
