package com.github.micycle1.ikopt.optim;

import java.util.OptionalInt;

/**
 * Local minimizer of a scalar function subject to per-variable box
 * constraints.
 * <p>
 * Implementations always return a point that satisfies the bounds, even when
 * the iteration budget runs out before convergence. Problems that cannot be
 * run at all are reported with an {@link OptimizationException}.
 */
public interface BoundedOptimizer {

	/**
	 * @param objective     function to minimize
	 * @param initialGuess  starting point; not modified
	 * @param bounds        one bound per variable
	 * @param maxIterations iteration cap, or empty for the implementation
	 *                      default
	 */
	OptimizationResult minimize(ObjectiveFunction objective, double[] initialGuess, Bound[] bounds, OptionalInt maxIterations);
}
