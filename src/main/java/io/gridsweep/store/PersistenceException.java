package io.gridsweep.store;

/** A remote job succeeded but its artifact could not be stored locally. */
public class PersistenceException extends Exception {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
