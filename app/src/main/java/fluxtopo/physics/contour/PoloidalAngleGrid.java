package fluxtopo.physics.contour;

import fluxtopo.domain.topology.CriticalPoint;
import lombok.extern.slf4j.Slf4j;

/**
 * Rejilla de ángulos poloidales equiespaciados en [0, 2π) alrededor del O-point.
 * <p>
 * El ángulo se mide desde el eje +Z hacia +R: un rayo de ángulo θ apunta a
 * {@code (R0 + L·sin θ, Z0 + L·cos θ)}. Si algún ángulo cae a menos de la tolerancia del
 * ángulo del X-point, toda la rejilla se desplaza media celda: trazar exactamente por la silla
 * no está definido.
 */
@Slf4j
public final class PoloidalAngleGrid {

    private static final double TWO_PI = 2.0 * Math.PI;

    private PoloidalAngleGrid() {}

    /**
     * @param nTheta    Número de ángulos.
     * @param opoint    Centro de los rayos.
     * @param xpoint    X-point a evitar.
     * @param tolerance Distancia angular mínima al X-point (rad).
     */
    public static double[] create(int nTheta, CriticalPoint opoint, CriticalPoint xpoint, double tolerance) {
        if (nTheta < 2) {
            throw new IllegalArgumentException("La rejilla poloidal necesita al menos 2 ángulos.");
        }
        final double dTheta = TWO_PI / nTheta;
        double[] theta = new double[nTheta];
        for (int k = 0; k < nTheta; k++) {
            theta[k] = k * dTheta;
        }

        double xpointTheta = xpointAngle(opoint, xpoint);
        boolean tooClose = false;
        for (double t : theta) {
            if (angularDistance(t, xpointTheta) < tolerance) {
                tooClose = true;
                break;
            }
        }

        if (tooClose) {
            log.warn("Rejilla poloidal demasiado cerca del X-point (θx = {} rad); se desplaza media celda.", xpointTheta);
            for (int k = 0; k < nTheta; k++) {
                theta[k] += dTheta / 2.0;
            }
        }
        return theta;
    }

    /**
     * Ángulo del X-point visto desde el O-point, normalizado en [0, 2π).
     */
    public static double xpointAngle(CriticalPoint opoint, CriticalPoint xpoint) {
        double angle = Math.atan2(xpoint.r() - opoint.r(), xpoint.z() - opoint.z());
        return angle >= 0 ? angle : angle + TWO_PI;
    }

    /**
     * Distancia circular entre dos ángulos de [0, 2π).
     */
    static double angularDistance(double a, double b) {
        double d = Math.abs(a - b) % TWO_PI;
        return Math.min(d, TWO_PI - d);
    }
}
