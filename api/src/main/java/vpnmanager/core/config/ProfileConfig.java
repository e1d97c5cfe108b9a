package vpnmanager.core.config;

import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for OpenVPN profile templates.
 *
 * <p>Configuration prefix: {@code vpn.profile}
 *
 * <pre>
 * vpn.profile.templates.Default.remote-host=vpn.example.org
 * vpn.profile.group-templates.admins=Admin
 * </pre>
 */
@ConfigMapping(prefix = "vpn.profile")
public interface ProfileConfig {

    /**
     * Template set used when no group mapping matches.
     *
     * @return template name (default: Default)
     */
    @WithDefault("Default")
    String defaultTemplate();

    /**
     * Template sets by name.
     */
    Map<String, Template> templates();

    /**
     * Group name to template set name. The first matching group wins, in the
     * order the identity provider reported the groups.
     */
    Map<String, String> groupTemplates();

    interface Template {

        String remoteHost();

        @WithDefault("1194")
        int port();

        @WithDefault("udp")
        String protocol();

        @WithDefault("AES-256-GCM")
        String cipher();
    }
}
