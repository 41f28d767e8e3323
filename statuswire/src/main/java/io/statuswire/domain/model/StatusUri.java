package io.statuswire.domain.model;

/**
 * Record address of the form {@code at://<author-did>/<collection>/<record-key>}.
 */
public record StatusUri(String authorDid, String collection, String recordKey) {

    private static final String SCHEME = "at://";

    public StatusUri {
        requirePart(authorDid, "authorDid");
        requirePart(collection, "collection");
        requirePart(recordKey, "recordKey");
    }

    public static StatusUri of(String authorDid, String collection, String recordKey) {
        return new StatusUri(authorDid, collection, recordKey);
    }

    public static StatusUri parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not an at:// URI: " + uri);
        }
        String[] parts = uri.substring(SCHEME.length()).split("/");
        if (parts.length < 3) {
            throw new IllegalArgumentException("URI needs author, collection and record key: " + uri);
        }
        return new StatusUri(parts[0], parts[1], parts[2]);
    }

    public String value() {
        return SCHEME + authorDid + "/" + collection + "/" + recordKey;
    }

    @Override
    public String toString() {
        return value();
    }

    private static void requirePart(String part, String name) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
