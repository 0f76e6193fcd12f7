package fleet.task;

import fleet.FleetException;

/**
 * Wraps a checked failure raised by a {@link TaskAction} so it can travel
 * through {@link BrowserTask#execute} unchecked.
 */
public class TaskExecutionException extends FleetException {

    private final String taskName;

    public TaskExecutionException(String taskName, Throwable cause) {
        super("Task '" + taskName + "' failed: " + cause.getMessage(), cause);
        this.taskName = taskName;
    }

    public String getTaskName() { return taskName; }
}
