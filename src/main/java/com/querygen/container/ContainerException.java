package com.querygen.container;

/**
 * Failure while driving the database container. Unrelated to query validation errors.
 */
public class ContainerException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        SPAWN("Couldn't start database container. If you are using `docker`, please check that the daemon is up-and-running."),
        HEALTH_CHECK("Encountered error while probing database container health. If you are using `docker`, please check that the daemon is up-and-running."),
        MAX_RETRIES("Max number of retries reached while waiting for database container to start."),
        STOP("Couldn't stop database container. If you are using `docker`, please check that the daemon is up-and-running."),
        REMOVE("Couldn't clean up database container. If you are using `docker`, please check that the daemon is up-and-running.");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public ContainerException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    public ContainerException(Reason reason, String detail) {
        super(reason.message + " (" + detail + ")");
        this.reason = reason;
    }

    public ContainerException(Reason reason, Throwable cause) {
        super(reason.message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
