package ai.pyflow.io;

/**
 * The diagram could not be produced. Fatal for the run; no partial output is guaranteed.
 */
public final class RendererException extends Exception {

    public RendererException(String message) {
        super(message);
    }

    public RendererException(String message, Throwable cause) {
        super(message, cause);
    }
}
