package floc.utility;

public class OptException extends Exception {
    /**
     * Custom exception class for the entire application.
     *
     * @param message message that will be stored/printed with the exception.
     */
    public OptException(String message) {
        super(message);
    }

    public OptException(String message, Throwable cause) {
        super(message, cause);
    }
}
