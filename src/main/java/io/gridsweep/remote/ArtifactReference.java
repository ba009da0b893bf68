package io.gridsweep.remote;

import java.net.URI;
import java.util.Locale;

/** Location of a job's output artifact on the remote side. */
public record ArtifactReference(String location) {
    public static final String DEFAULT_EXTENSION = "png";

    public ArtifactReference {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("artifact location cannot be empty");
        }
        location = location.trim();
    }

    /** File extension taken from the URL path, {@code png} when there is none. */
    public String extension() {
        String path;
        try {
            path = URI.create(location).getPath();
        } catch (IllegalArgumentException e) {
            path = location;
        }
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        int slash = path.lastIndexOf('/');
        String file = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = file.lastIndexOf('.');
        if (dot < 0 || dot == file.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String ext = file.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (int i = 0; i < ext.length(); i++) {
            if (!Character.isLetterOrDigit(ext.charAt(i))) {
                return DEFAULT_EXTENSION;
            }
        }
        return ext.length() > 5 ? DEFAULT_EXTENSION : ext;
    }
}
