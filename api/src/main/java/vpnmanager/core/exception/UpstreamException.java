package vpnmanager.core.exception;

/**
 * The identity provider or certificate authority failed or did not answer in time.
 */
public class UpstreamException extends VpnManagerException {

    public enum Reason {
        TIMEOUT,
        PROVIDER_REJECTED
    }

    private final Reason reason;
    private final String upstream;

    public UpstreamException(Reason reason, String upstream, String message) {
        super(message);
        this.reason = reason;
        this.upstream = upstream;
    }

    public UpstreamException(Reason reason, String upstream, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.upstream = upstream;
    }

    public Reason reason() {
        return reason;
    }

    public String upstream() {
        return upstream;
    }

    /**
     * Whether the caller may re-request the operation.
     */
    public boolean retryable() {
        return reason == Reason.TIMEOUT;
    }

    public static UpstreamException timeout(String upstream) {
        return new UpstreamException(Reason.TIMEOUT, upstream, "%s did not respond in time".formatted(upstream));
    }

    public static UpstreamException rejected(String upstream, String message) {
        return new UpstreamException(Reason.PROVIDER_REJECTED, upstream, message);
    }
}
