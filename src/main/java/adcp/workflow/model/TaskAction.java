package adcp.workflow.model;

import java.util.Locale;

/**
 * What the task does to its media buy once resumed.
 */
public enum TaskAction {
    CREATE,
    ACTIVATE,
    APPROVE,
    PAUSE,
    RESUME,
    UPDATE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Map an update_media_buy action string to a task action.
     */
    public static TaskAction forUpdateAction(String updateAction) {
        if (updateAction == null) {
            return UPDATE;
        }
        if (updateAction.equals("activate_order")) {
            return ACTIVATE;
        }
        if (updateAction.startsWith("pause_")) {
            return PAUSE;
        }
        if (updateAction.startsWith("resume_")) {
            return RESUME;
        }
        return UPDATE;
    }
}
