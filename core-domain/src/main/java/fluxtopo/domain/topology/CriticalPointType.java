package fluxtopo.domain.topology;

/**
 * Clasificación de un punto crítico del flujo poloidal según el signo del determinante hessiano.
 */
public enum CriticalPointType {
    /**
     * Extremo local (eje magnético). Determinante hessiano >= 0.
     */
    O_POINT,

    /**
     * Punto de silla (separatriz). Determinante hessiano < 0.
     */
    X_POINT
}
