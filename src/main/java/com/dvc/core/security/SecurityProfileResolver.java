package com.dvc.core.security;

import com.dvc.core.model.ResourceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the {@code dvc.security.profiles.*} configuration into validated
 * {@link SecurityProfile}s and resolves them by name.
 *
 * <p>Profiles are checked once at construction. A privileged profile, a
 * capability outside {@link #ALLOWED_CAPABILITIES}, more than
 * {@link #MAX_ADDED_CAPABILITIES} added capabilities or a malformed user
 * fails start-up with {@link SecurityProfileException}. A {@code default}
 * profile always exists; configuration may tighten it but not remove it.
 */
@Service
public class SecurityProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(SecurityProfileResolver.class);

    public static final String DEFAULT_PROFILE = "default";
    public static final Set<String> ALLOWED_CAPABILITIES = Set.of("NET_ADMIN", "NET_RAW", "SYS_TIME");
    public static final int MAX_ADDED_CAPABILITIES = 3;

    private final Map<String, SecurityProfile> profiles;

    public SecurityProfileResolver(SecurityProperties properties) {
        Map<String, SecurityProfile> resolved = new LinkedHashMap<>();
        resolved.put(DEFAULT_PROFILE, validate(DEFAULT_PROFILE, new SecurityProperties.Profile()));
        properties.getProfiles().forEach((name, config) -> resolved.put(name, validate(name, config)));
        this.profiles = Collections.unmodifiableMap(resolved);
        log.info("Loaded {} security profile(s): {}", profiles.size(), profiles.keySet());
    }

    /**
     * Returns the named profile, falling back to {@code default} when the
     * name is unknown.
     */
    public SecurityProfile resolve(String name) {
        if (name == null || name.isBlank()) {
            return profiles.get(DEFAULT_PROFILE);
        }
        SecurityProfile profile = profiles.get(name);
        if (profile == null) {
            log.warn("Unknown security profile '{}', applying '{}'", name, DEFAULT_PROFILE);
            return profiles.get(DEFAULT_PROFILE);
        }
        return profile;
    }

    public boolean exists(String name) {
        return profiles.containsKey(name);
    }

    public Set<String> names() {
        return profiles.keySet();
    }

    static SecurityProfile validate(String name, SecurityProperties.Profile config) {
        if (config.isPrivileged()) {
            throw new SecurityProfileException("Security profile '" + name + "' requests privileged mode");
        }
        List<String> capAdd = normalise(config.getCapAdd());
        if (capAdd.size() > MAX_ADDED_CAPABILITIES) {
            throw new SecurityProfileException("Security profile '" + name + "' adds " + capAdd.size()
                    + " capabilities, at most " + MAX_ADDED_CAPABILITIES + " are allowed");
        }
        for (String cap : capAdd) {
            if (!ALLOWED_CAPABILITIES.contains(cap)) {
                throw new SecurityProfileException("Security profile '" + name + "' adds capability " + cap
                        + " which is not in " + ALLOWED_CAPABILITIES);
            }
        }
        List<String> capDrop = normalise(config.getCapDrop());
        if (capDrop.isEmpty()) {
            capDrop = List.of("ALL");
        }
        String user = config.getUser();
        if (user == null || !user.matches("\\d+(:\\d+)?")) {
            throw new SecurityProfileException("Security profile '" + name + "' has invalid user '" + user
                    + "', expected uid:gid");
        }
        if (user.startsWith("0:") || user.equals("0")) {
            throw new SecurityProfileException("Security profile '" + name + "' runs as root");
        }
        if (config.getMemoryMb() <= 0 || config.getCpus() <= 0 || config.getPidsLimit() <= 0) {
            throw new SecurityProfileException("Security profile '" + name + "' has non-positive resource ceilings");
        }
        Map<String, String> tmpfs = config.getTmpfs() != null ? config.getTmpfs() : Map.of();
        return new SecurityProfile(
                name,
                capDrop,
                capAdd,
                config.isReadOnlyRootfs(),
                tmpfs,
                user,
                config.isNoNewPrivileges(),
                new ResourceLimits(config.getMemoryMb(), config.getCpus(), config.getPidsLimit()));
    }

    private static List<String> normalise(List<String> caps) {
        if (caps == null) {
            return List.of();
        }
        return caps.stream()
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .map(c -> c.startsWith("CAP_") ? c.substring(4) : c)
                .distinct()
                .toList();
    }
}
