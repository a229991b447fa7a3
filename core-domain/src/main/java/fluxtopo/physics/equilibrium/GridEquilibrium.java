package fluxtopo.physics.equilibrium;

import fluxtopo.domain.grid.FluxGrid;
import fluxtopo.physics.field.BicubicFluxField;
import fluxtopo.physics.field.FluxField;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Equilibrio mínimo respaldado por una malla y una función poloidal dada.
 * El flujo continuo es el interpolante bicúbico de la malla.
 */
public final class GridEquilibrium implements Equilibrium {

    private final FluxGrid grid;
    private final FluxField flux;
    private final DoubleUnaryOperator fpolFunction;

    public GridEquilibrium(FluxGrid grid, DoubleUnaryOperator fpolFunction) {
        this(grid, new BicubicFluxField(grid), fpolFunction);
    }

    public GridEquilibrium(FluxGrid grid, FluxField flux, DoubleUnaryOperator fpolFunction) {
        this.grid = Objects.requireNonNull(grid, "La malla no puede ser nula.");
        this.flux = Objects.requireNonNull(flux, "El campo de flujo no puede ser nulo.");
        this.fpolFunction = Objects.requireNonNull(fpolFunction, "La función poloidal no puede ser nula.");
    }

    @Override
    public FluxGrid grid() {
        return grid;
    }

    @Override
    public FluxField flux() {
        return flux;
    }

    @Override
    public double fpol(double psiNormalized) {
        return fpolFunction.applyAsDouble(psiNormalized);
    }
}
