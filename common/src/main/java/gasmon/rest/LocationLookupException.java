package gasmon.rest;

/**
 * A checked exception thrown when the list of known locations cannot be retrieved
 * or does not contain any usable location.
 */
public class LocationLookupException extends Exception {
    public LocationLookupException(String message) {
        super(message);
    }

    public LocationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
