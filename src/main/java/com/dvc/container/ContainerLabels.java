package com.dvc.container;

/**
 * Label keys stamped on every challenge container.
 */
public final class ContainerLabels {

    public static final String PREFIX = "dvc.challenge";
    public static final String ID = PREFIX + ".id";
    public static final String USER = PREFIX + ".user";
    public static final String SESSION = PREFIX + ".session";
    public static final String STARTED = PREFIX + ".started";
    public static final String TIMEOUT = PREFIX + ".timeout";
    public static final String NAME = PREFIX + ".name";
    public static final String CATEGORY = PREFIX + ".category";

    private ContainerLabels() {}

    public static String containerName(String challengeId, String sessionId) {
        return "dvc-" + challengeId + "-" + sessionId;
    }
}
