package fluxtopo.domain.topology;

import java.util.List;
import java.util.Optional;

/**
 * Resultado de la búsqueda de puntos críticos: O-points ordenados por cercanía al centro
 * del dominio y X-points ordenados por cercanía en psi al O-point primario.
 * Cualquiera de las dos listas puede estar vacía.
 */
public record CriticalPoints(List<CriticalPoint> opoints, List<CriticalPoint> xpoints) {

    public CriticalPoints {
        opoints = List.copyOf(opoints);
        xpoints = List.copyOf(xpoints);
    }

    public static CriticalPoints empty() {
        return new CriticalPoints(List.of(), List.of());
    }

    /**
     * El eje magnético: el O-point más cercano al punto medio del dominio.
     */
    public Optional<CriticalPoint> primaryOPoint() {
        return opoints.isEmpty() ? Optional.empty() : Optional.of(opoints.get(0));
    }

    /**
     * El X-point de la separatriz más interna (el más cercano en psi al eje).
     */
    public Optional<CriticalPoint> primaryXPoint() {
        return xpoints.isEmpty() ? Optional.empty() : Optional.of(xpoints.get(0));
    }

    public boolean hasSeparatrix() {
        return !opoints.isEmpty() && !xpoints.isEmpty();
    }
}
