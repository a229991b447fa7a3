package fluxtopo.domain.topology;

import java.util.Arrays;
import java.util.Objects;

/**
 * Perfil del factor de seguridad: un valor de q por cada nivel de flujo normalizado pedido,
 * en el mismo orden.
 *
 * @param levels Niveles de flujo normalizado (0 = eje, 1 = separatriz).
 * @param q      Factor de seguridad en cada nivel.
 */
public record SafetyFactorProfile(double[] levels, double[] q) {

    public SafetyFactorProfile {
        Objects.requireNonNull(levels, "Los niveles no pueden ser nulos.");
        Objects.requireNonNull(q, "Los valores de q no pueden ser nulos.");
        if (levels.length != q.length) {
            throw new IllegalArgumentException("Niveles y valores de q deben tener la misma longitud.");
        }
        levels = levels.clone();
        q = q.clone();
    }

    @Override
    public double[] levels() {
        return levels.clone();
    }

    @Override
    public double[] q() {
        return q.clone();
    }

    public int size() {
        return levels.length;
    }

    public double levelAt(int k) {
        return levels[k];
    }

    public double qAt(int k) {
        return q[k];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SafetyFactorProfile other)) return false;
        return Arrays.equals(levels, other.levels) && Arrays.equals(q, other.q);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(levels) + Arrays.hashCode(q);
    }

    @Override
    public String toString() {
        return "SafetyFactorProfile[levels=" + Arrays.toString(levels) + ", q=" + Arrays.toString(q) + "]";
    }
}
