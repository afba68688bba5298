package mirror.email.app.service;

import java.util.Arrays;

/**
 * Local flag or folder change on a mirrored message, named as it appears in request paths.
 */
public enum FlagAction {
    ARCHIVE("archive"),
    DELETE("delete"),
    MARK_READ("mark-read"),
    MARK_UNREAD("mark-unread"),
    STAR("star"),
    UNSTAR("unstar"),
    SNOOZE("snooze");

    private final String pathName;

    FlagAction(String pathName) {
        this.pathName = pathName;
    }

    public String getPathName() {
        return pathName;
    }

    public static FlagAction fromPathName(String value) {
        return Arrays.stream(values())
            .filter(action -> action.pathName.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown message action: " + value));
    }
}
