package fluxtopo.domain.exception;

/**
 * Error de configuración: no hay valor de flujo de frontera (ni explícito ni de un X-point),
 * o coincide con el del eje y la normalización no está definida.
 */
public class BoundaryUndefinedException extends TopologyException {

    public BoundaryUndefinedException(String message) {
        super(message);
    }
}
