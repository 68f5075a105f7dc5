package adcp.workflow.adapter;

import java.util.Locale;
import java.util.Objects;

/**
 * Failure reported by an ad server adapter. The engine never retries either kind;
 * the kind only tells the caller whether resubmitting may help.
 */
public class AdapterException extends Exception {

    public enum Kind {
        TRANSIENT,
        PERMANENT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;

    public AdapterException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public AdapterException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public static AdapterException transientFailure(String message) {
        return new AdapterException(Kind.TRANSIENT, message);
    }

    public static AdapterException permanentFailure(String message) {
        return new AdapterException(Kind.PERMANENT, message);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    /** Human-visible form stored in resolution_detail. */
    public String detail() {
        return "adapter error (" + kind.wireName() + "): " + getMessage();
    }
}
