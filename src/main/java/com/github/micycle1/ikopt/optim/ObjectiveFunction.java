package com.github.micycle1.ikopt.optim;

/**
 * Scalar function minimized by a {@link BoundedOptimizer}. Implementations
 * must not modify {@code x}.
 */
@FunctionalInterface
public interface ObjectiveFunction {
	double evaluate(double[] x);
}
