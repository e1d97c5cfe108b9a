package vpnmanager.core.service.profile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import vpnmanager.core.model.certificate.IssuedCertificate;
import vpnmanager.core.model.profile.TemplateSet;

/**
 * Renders OpenVPN configuration files.
 */
public final class OvpnRenderer {

    private OvpnRenderer() {}

    /**
     * Client profile with inline CA, certificate and key.
     *
     * @param protocol {@code udp} or {@code tcp}
     */
    public static String clientProfile(TemplateSet template, IssuedCertificate issued, String protocol, int port) {
        final var sb = new StringBuilder();
        sb.append("# OpenVPN profile for ").append(issued.certificate().commonName()).append('\n');
        sb.append("# Certificate fingerprint ").append(issued.certificate().fingerprint()).append('\n');
        sb.append("client\n");
        sb.append("dev tun\n");
        sb.append("proto ").append(clientProto(protocol)).append('\n');
        sb.append("remote ").append(template.remoteHost()).append(' ').append(port).append('\n');
        sb.append("resolv-retry infinite\n");
        sb.append("nobind\n");
        sb.append("persist-key\n");
        sb.append("persist-tun\n");
        sb.append("remote-cert-tls server\n");
        sb.append("cipher ").append(template.cipher()).append('\n');
        sb.append("verb 3\n");
        inline(sb, "ca", issued.caPem());
        inline(sb, "cert", issued.certificatePem());
        inline(sb, "key", issued.privateKeyPem());
        return sb.toString();
    }

    /**
     * Server configuration referencing the files shipped alongside it in the bundle.
     */
    public static String serverConfig(TemplateSet template, IssuedCertificate issued) {
        final var sb = new StringBuilder();
        sb.append("# OpenVPN server configuration for ").append(issued.certificate().commonName()).append('\n');
        sb.append("port ").append(template.port()).append('\n');
        sb.append("proto ").append(template.protocol()).append('\n');
        sb.append("dev tun\n");
        sb.append("ca ca.crt\n");
        sb.append("cert server.crt\n");
        sb.append("key server.key\n");
        sb.append("dh none\n");
        sb.append("topology subnet\n");
        sb.append("server 10.8.0.0 255.255.255.0\n");
        sb.append("keepalive 10 120\n");
        sb.append("cipher ").append(template.cipher()).append('\n');
        sb.append("persist-key\n");
        sb.append("persist-tun\n");
        sb.append("verb 3\n");
        return sb.toString();
    }

    /**
     * Zip archive holding {@code ca.crt}, {@code server.crt}, {@code server.key} and {@code server.conf}.
     */
    public static byte[] serverBundle(TemplateSet template, IssuedCertificate issued) {
        final Map<String, String> entries = new LinkedHashMap<>();
        entries.put("ca.crt", issued.caPem());
        entries.put("server.crt", issued.certificatePem());
        entries.put("server.key", issued.privateKeyPem());
        entries.put("server.conf", serverConfig(template, issued));

        final var out = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(out)) {
            for (var entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build server bundle", e);
        }
        return out.toByteArray();
    }

    private static String clientProto(String protocol) {
        return "tcp".equalsIgnoreCase(protocol) ? "tcp-client" : "udp";
    }

    private static void inline(StringBuilder sb, String tag, String pem) {
        sb.append('<').append(tag).append(">\n");
        sb.append(pem.strip()).append('\n');
        sb.append("</").append(tag).append(">\n");
    }
}
