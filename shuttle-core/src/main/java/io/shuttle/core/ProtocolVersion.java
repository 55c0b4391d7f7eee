package io.shuttle.core;

/**
 * HTTP protocol versions a request may ask for.
 */
public enum ProtocolVersion {
    HTTP_1_0("1.0"),
    HTTP_1_1("1.1"),
    HTTP_2("2");

    private final String value;

    ProtocolVersion(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a version token. {@code "1"} and {@code "2.0"} are accepted as aliases of 1.0 and 2.
     *
     * @throws ShuttleException.UnknownProtocolVersion for anything else
     */
    public static ProtocolVersion parse(String version) {
        if (version == null) {
            throw new ShuttleException.UnknownProtocolVersion(null);
        }
        switch (version.trim()) {
            case "1":
            case "1.0":
                return HTTP_1_0;
            case "1.1":
                return HTTP_1_1;
            case "2":
            case "2.0":
                return HTTP_2;
            default:
                throw new ShuttleException.UnknownProtocolVersion(version);
        }
    }

    /**
     * Maps a major/minor pair reported by a server, falling back to 1.1 for anything unexpected.
     */
    public static ProtocolVersion of(int major, int minor) {
        if (major >= 2) return HTTP_2;
        if (major == 1 && minor == 0) return HTTP_1_0;
        return HTTP_1_1;
    }

    @Override
    public String toString() {
        return value;
    }
}
