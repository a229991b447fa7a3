package fluxtopo.domain.topology;

import java.util.Objects;

/**
 * Punto crítico del flujo poloidal: coordenada (R, Z), valor de psi en ella y su clasificación.
 * Inmutable; se crea durante una única búsqueda y no se modifica después.
 *
 * @param r    Radio mayor.
 * @param z    Altura.
 * @param psi  Valor del flujo interpolado en (r, z).
 * @param type O-point o X-point.
 */
public record CriticalPoint(double r, double z, double psi, CriticalPointType type) {

    public CriticalPoint {
        Objects.requireNonNull(type, "El tipo de punto crítico no puede ser nulo.");
    }

    public static CriticalPoint opoint(double r, double z, double psi) {
        return new CriticalPoint(r, z, psi, CriticalPointType.O_POINT);
    }

    public static CriticalPoint xpoint(double r, double z, double psi) {
        return new CriticalPoint(r, z, psi, CriticalPointType.X_POINT);
    }

    public double distanceSquaredTo(double otherR, double otherZ) {
        double dr = r - otherR;
        double dz = z - otherZ;
        return dr * dr + dz * dz;
    }

    public double distanceSquaredTo(CriticalPoint other) {
        return distanceSquaredTo(other.r, other.z);
    }
}
