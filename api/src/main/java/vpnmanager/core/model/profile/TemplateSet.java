package vpnmanager.core.model.profile;

/**
 * Connection parameters baked into generated OpenVPN profiles.
 *
 * @param name template set name, e.g. {@code Default}
 * @param remoteHost VPN server hostname clients connect to
 * @param port default UDP/TCP port
 * @param protocol default protocol, {@code udp} or {@code tcp}
 * @param cipher data channel cipher
 */
public record TemplateSet(String name, String remoteHost, int port, String protocol, String cipher) {}
