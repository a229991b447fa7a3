package fluxtopo.domain.exception;

/**
 * Excepción base del análisis topológico. Indica que falta un prerrequisito topológico
 * (eje magnético, separatriz, frontera) y que el cálculo no puede continuar.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
