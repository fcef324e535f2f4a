package io.github.yok.flexconfigure.remote;

import lombok.Value;

/**
 * Runtime state of a deployed artifact, mapped from the raw version and status strings.
 *
 * <p>
 * The mapping happens once, in {@link #of(String, String)}; callers branch on {@link #getState()}
 * only.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RuntimeStatus {

    /** Version reported for an artifact that is not (yet) visible at runtime. */
    public static final String NOT_DEPLOYED = "NOT_DEPLOYED";

    /**
     * Deployment states relevant to status polling.
     */
    public enum State {
        // Not yet visible at runtime.
        NOT_YET_VISIBLE,
        // Deployment in progress.
        STARTING,
        // Deployed and running.
        STARTED,
        // Any other status; the raw value is kept in rawStatus.
        OTHER_FAILURE
    }

    String version;
    String rawStatus;
    State state;

    /**
     * Maps raw values reported by the runtime.
     *
     * @param version runtime version, {@value #NOT_DEPLOYED} when not deployed
     * @param status raw status string
     * @return mapped status
     */
    public static RuntimeStatus of(String version, String status) {
        State state;
        if (NOT_DEPLOYED.equals(version)) {
            state = State.NOT_YET_VISIBLE;
        } else if ("STARTED".equals(status)) {
            state = State.STARTED;
        } else if ("STARTING".equals(status)) {
            state = State.STARTING;
        } else {
            state = State.OTHER_FAILURE;
        }
        return new RuntimeStatus(version, status, state);
    }
}
