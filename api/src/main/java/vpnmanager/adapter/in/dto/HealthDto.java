package vpnmanager.adapter.in.dto;

/**
 * @param status always {@code healthy} while the process serves requests
 * @param service configured service name
 * @param mode deployment mode, e.g. {@code user-only}
 */
public record HealthDto(String status, String service, String mode) {}
