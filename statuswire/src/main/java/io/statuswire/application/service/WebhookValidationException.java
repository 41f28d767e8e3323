package io.statuswire.application.service;

/**
 * Rejected webhook configuration. {@link #reason()} is a stable code clients can branch on.
 */
public class WebhookValidationException extends RuntimeException {

    public enum Reason {
        INVALID_URL("invalid_url"),
        UNSUPPORTED_SCHEME("unsupported_scheme"),
        HTTPS_REQUIRED("https_required"),
        PRIVATE_HOST("private_host"),
        UNSUPPORTED_EVENT("unsupported_event"),
        SECRET_TOO_SHORT("secret_too_short");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Reason reason;

    public WebhookValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
