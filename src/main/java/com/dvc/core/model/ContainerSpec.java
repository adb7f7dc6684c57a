package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * How to run a challenge: image, exposed ports, environment template,
 * resource request and the name of the security profile to apply.
 *
 * @param image           image reference, e.g. {@code dvc/xss-01:latest}
 * @param ports           container port ({@code "80/tcp"}) to requested host port; 0 picks an ephemeral port
 * @param environment     environment template; values may reference {@code ${SESSION_ID}}, {@code ${USER_ID}},
 *                        {@code ${CHALLENGE_ID}} and {@code ${FLAG}}
 * @param resourceLimits  resource request
 * @param securityProfile profile name resolved by the security profile resolver
 */
public record ContainerSpec(
    String image,
    Map<String, Integer> ports,
    Map<String, String> environment,
    @JsonProperty("resource_limits") ResourceLimits resourceLimits,
    @JsonProperty("security_profile") String securityProfile
) {

    public ContainerSpec {
        ports = ports != null ? Map.copyOf(ports) : Map.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        resourceLimits = resourceLimits != null ? resourceLimits : ResourceLimits.DEFAULT;
        securityProfile = securityProfile != null && !securityProfile.isBlank() ? securityProfile : "default";
    }
}
