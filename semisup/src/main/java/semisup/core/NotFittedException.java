package semisup.core;

/**
 * Thrown when a prediction is requested from a classifier or engine that has not been fitted.
 */
public class NotFittedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NotFittedException(String message) {
        super(message);
    }
}
