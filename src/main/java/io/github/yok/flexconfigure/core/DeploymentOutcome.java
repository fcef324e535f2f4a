package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.model.DeploymentTask;
import lombok.Value;

/**
 * Terminal outcome of deploying one {@link DeploymentTask}.
 */
@Value
public class DeploymentOutcome {

    /**
     * Terminal states of the deployment state machine.
     */
    public enum State {
        SUCCEEDED, FAILED, TIMED_OUT
    }

    DeploymentTask task;
    State state;
    // Failure reason, null on success
    String message;

    public static DeploymentOutcome succeeded(DeploymentTask task) {
        return new DeploymentOutcome(task, State.SUCCEEDED, null);
    }

    public static DeploymentOutcome failed(DeploymentTask task, String message) {
        return new DeploymentOutcome(task, State.FAILED, message);
    }

    public static DeploymentOutcome timedOut(DeploymentTask task, String message) {
        return new DeploymentOutcome(task, State.TIMED_OUT, message);
    }

    public boolean isSuccess() {
        return state == State.SUCCEEDED;
    }
}
