package fleet.task;

import fleet.session.SessionHandle;

import java.util.List;
import java.util.Map;

/**
 * The executable body of a {@link BrowserTask}.
 */
@FunctionalInterface
public interface TaskAction {

    /**
     * Runs against {@code session} with the task's parameters.
     *
     * @return an optional result, stored on the task
     * @throws Exception any failure; the task records it and rethrows
     */
    Object run(SessionHandle session, List<Object> args, Map<String, Object> kwargs) throws Exception;
}
