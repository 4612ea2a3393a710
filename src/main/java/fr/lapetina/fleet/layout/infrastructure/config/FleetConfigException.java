package fr.lapetina.fleet.layout.infrastructure.config;

/**
 * Thrown when a fleet description cannot be loaded. A failed load always
 * reports exactly one problem: the first one found.
 */
public final class FleetConfigException extends RuntimeException {

    private final Kind kind;

    public FleetConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FleetConfigException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        IO("Fleet description could not be read"),
        PARSE("Fleet description is not well-formed"),
        SCHEMA("Fleet description does not match the schema"),
        STRUCTURE("Fleet description is inconsistent");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
