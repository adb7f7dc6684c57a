package com.dvc.core.security;

import com.dvc.core.model.ResourceLimits;

import java.util.List;
import java.util.Map;

/**
 * Validated, immutable isolation settings applied to a challenge container.
 *
 * @param tmpfs    writable scratch mounts (path to mount options) on top of a read-only root
 * @param user     {@code uid:gid} the container process runs as
 * @param ceiling  upper bound for the challenge's own resource request
 */
public record SecurityProfile(
    String name,
    List<String> capDrop,
    List<String> capAdd,
    boolean readOnlyRootfs,
    Map<String, String> tmpfs,
    String user,
    boolean noNewPrivileges,
    ResourceLimits ceiling
) {

    public SecurityProfile {
        capDrop = List.copyOf(capDrop);
        capAdd = List.copyOf(capAdd);
        tmpfs = Map.copyOf(tmpfs);
    }
}
