package fleet.orchestrator;

import fleet.model.SessionRecord;
import fleet.session.SessionHandle;

/**
 * A live session as held by the orchestrator: its contiguous index, its
 * handle and the record that captures the tasks it completes. Handle and
 * record are created together and released together.
 */
public final class ManagedSession {

    private final int index;
    private final SessionHandle handle;
    private final SessionRecord record;

    ManagedSession(int index, SessionHandle handle, SessionRecord record) {
        this.index  = index;
        this.handle = handle;
        this.record = record;
    }

    public int           getIndex()  { return index; }
    public SessionHandle getHandle() { return handle; }
    public SessionRecord getRecord() { return record; }

    @Override
    public String toString() {
        return "ManagedSession{index=" + index + ", initial='" + record.getInitialLocation() + "'}";
    }
}
