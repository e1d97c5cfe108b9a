package vpnmanager.core.service.profile;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import vpnmanager.core.config.ProfileConfig;
import vpnmanager.core.model.profile.TemplateSet;

/**
 * Picks the template set for a profile.
 */
@ApplicationScoped
public class TemplateResolver {

    private final Map<String, TemplateSet> templates;
    private final Map<String, String> groupTemplates;
    private final String defaultTemplate;

    @Inject
    public TemplateResolver(ProfileConfig config) {
        this(toTemplateSets(config.templates()), config.groupTemplates(), config.defaultTemplate());
    }

    TemplateResolver(Map<String, TemplateSet> templates, Map<String, String> groupTemplates, String defaultTemplate) {
        this.templates = Map.copyOf(templates);
        this.groupTemplates = Map.copyOf(groupTemplates);
        this.defaultTemplate = defaultTemplate;
        if (!this.templates.containsKey(defaultTemplate)) {
            throw new IllegalStateException("Default template set '%s' is not configured".formatted(defaultTemplate));
        }
    }

    /**
     * Template set by name, falling back to the default set for unknown names.
     */
    public TemplateSet byName(String name) {
        return Optional.ofNullable(name).map(templates::get).orElseGet(() -> templates.get(defaultTemplate));
    }

    /**
     * Template set for the first group that has a mapping, or the default set.
     */
    public TemplateSet forGroups(Collection<String> groups) {
        if (groups != null) {
            for (String group : groups) {
                final var mapped = groupTemplates.get(group);
                if (mapped != null && templates.containsKey(mapped)) {
                    return templates.get(mapped);
                }
            }
        }
        return templates.get(defaultTemplate);
    }

    private static Map<String, TemplateSet> toTemplateSets(Map<String, ProfileConfig.Template> configured) {
        final Map<String, TemplateSet> result = new LinkedHashMap<>();
        configured.forEach((name, t) ->
                result.put(name, new TemplateSet(name, t.remoteHost(), t.port(), t.protocol(), t.cipher())));
        return result;
    }
}
