package vpnmanager.core.exception;

/**
 * A resource could not be found, or its identifier was malformed.
 *
 * <p>Both cases produce the same response so callers cannot enumerate identifiers.
 */
public class ResourceNotFoundException extends VpnManagerException {

    public enum Reason {
        INVALID_IDENTIFIER,
        NO_SUCH_RESOURCE
    }

    private final Reason reason;
    private final String resourceType;

    public ResourceNotFoundException(Reason reason, String resourceType) {
        super("%s not found".formatted(resourceType));
        this.reason = reason;
        this.resourceType = resourceType;
    }

    public Reason reason() {
        return reason;
    }

    public String resourceType() {
        return resourceType;
    }

    public static ResourceNotFoundException certificate() {
        return new ResourceNotFoundException(Reason.NO_SUCH_RESOURCE, "Certificate");
    }

    public static ResourceNotFoundException malformedCertificateId() {
        return new ResourceNotFoundException(Reason.INVALID_IDENTIFIER, "Certificate");
    }
}
