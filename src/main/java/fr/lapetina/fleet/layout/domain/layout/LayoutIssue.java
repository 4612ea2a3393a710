package fr.lapetina.fleet.layout.domain.layout;

import java.util.Objects;

/**
 * A problem found while generating a layout.
 *
 * @param severity whether the layout is still usable
 * @param message  human-readable description
 */
public record LayoutIssue(Severity severity, String message) {
    public LayoutIssue {
        Objects.requireNonNull(severity, "Severity is required");
        Objects.requireNonNull(message, "Message is required");
    }

    public static LayoutIssue error(String message) {
        return new LayoutIssue(Severity.ERROR, message);
    }

    public static LayoutIssue warning(String message) {
        return new LayoutIssue(Severity.WARNING, message);
    }

    @Override
    public String toString() {
        return severity.getLabel() + ": " + message;
    }

    public enum Severity {
        /** The layout cannot be used; generation stopped. */
        ERROR("error"),

        /** The layout is usable but the fleet shape carries a risk. */
        WARNING("warning");

        private final String label;

        Severity(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
