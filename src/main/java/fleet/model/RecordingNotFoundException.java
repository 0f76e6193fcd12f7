package fleet.model;

import fleet.FleetException;

/**
 * Raised when a recording reference resolves to no readable file.
 */
public class RecordingNotFoundException extends FleetException {

    public RecordingNotFoundException(String msg) {
        super(msg);
    }
}
