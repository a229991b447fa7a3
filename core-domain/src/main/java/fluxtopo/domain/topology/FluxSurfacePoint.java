package fluxtopo.domain.topology;

/**
 * Muestra de un contorno de flujo trazado. Lleva las coordenadas del X-point primario
 * como referencia geométrica para los consumidores aguas abajo.
 */
public record FluxSurfacePoint(double r, double z, double xpointR, double xpointZ) {
}
