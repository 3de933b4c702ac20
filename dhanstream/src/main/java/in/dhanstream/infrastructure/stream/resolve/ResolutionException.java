package in.dhanstream.infrastructure.stream.resolve;

/**
 * Thrown when a symbol reference matches no instrument in any candidate segment.
 */
public class ResolutionException extends RuntimeException {

    private final String label;

    public ResolutionException(String label, String message) {
        super(String.format("[RESOLVER:%s] %s", label, message));
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
