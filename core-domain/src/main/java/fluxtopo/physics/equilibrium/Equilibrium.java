package fluxtopo.physics.equilibrium;

import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.physics.field.FluxField;

/**
 * Colaborador externo que posee la malla y el flujo poloidal y expone las magnitudes físicas
 * que el cálculo del factor de seguridad necesita.
 * <p>
 * Las componentes Br y Bz tienen una implementación por defecto derivada del flujo
 * ({@code Br = -∂F/∂Z / R}, {@code Bz = ∂F/∂R / R}); un modelo concreto puede sustituirlas.
 */
public interface Equilibrium {

    FluxGrid grid();

    /**
     * Interpolante continuo del flujo poloidal sobre {@link #grid()}.
     */
    FluxField flux();

    /**
     * Función poloidal f = R·Bt evaluada en un flujo normalizado.
     */
    double fpol(double psiNormalized);

    default double br(double r, double z) {
        return -flux().derivative(r, z, 0, 1) / r;
    }

    default double bz(double r, double z) {
        return flux().derivative(r, z, 1, 0) / r;
    }

    default double rMin() {
        return grid().getRMin();
    }

    default double rMax() {
        return grid().getRMax();
    }

    default double zMin() {
        return grid().getZMin();
    }

    default double zMax() {
        return grid().getZMax();
    }
}
