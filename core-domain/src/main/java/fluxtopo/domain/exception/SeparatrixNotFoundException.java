package fluxtopo.domain.exception;

/**
 * No existe X-point, por lo que no hay separatriz y el factor de seguridad no está definido.
 */
public class SeparatrixNotFoundException extends TopologyException {

    public SeparatrixNotFoundException(String message) {
        super(message);
    }
}
