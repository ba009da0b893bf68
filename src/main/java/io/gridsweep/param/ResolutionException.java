package io.gridsweep.param;

public class ResolutionException extends RuntimeException {
    private final String parameterName;

    public ResolutionException(String parameterName, String message) {
        super("parameter '" + parameterName + "': " + message);
        this.parameterName = parameterName;
    }

    public ResolutionException(String parameterName, String message, Throwable cause) {
        super("parameter '" + parameterName + "': " + message, cause);
        this.parameterName = parameterName;
    }

    public String parameterName() {
        return parameterName;
    }
}
