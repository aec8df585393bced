package ai.pipestream.workspace.permission;

/**
 * Ordered access scale. Every level carries all capabilities of the levels below it.
 */
public enum PermissionLevel {

    NONE(0),
    READ(1),
    COMMENT(2),
    EDIT(3),
    OWNER(4);

    private final int level;

    PermissionLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean atLeast(PermissionLevel required) {
        return level >= required.level;
    }

    public static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
        return a.level >= b.level ? a : b;
    }

    public static PermissionLevel fromLevel(int level) {
        for (PermissionLevel value : values()) {
            if (value.level == level) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown permission level: " + level);
    }
}
