package fluxtopo.physics.contour;

/**
 * Cruce de un rayo con una superficie de flujo normalizado.
 *
 * @param r       R del cruce.
 * @param z       Z del cruce.
 * @param crossed false si el rayo nunca superó el nivel: el punto devuelto es el origen del rayo
 *                y debe tratarse como sospechoso.
 */
public record RayCrossing(double r, double z, boolean crossed) {
}
