package com.github.micycle1.ikopt.optim;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

import org.apache.commons.math4.legacy.analysis.MultivariateFunction;
import org.apache.commons.math4.legacy.exception.MathIllegalArgumentException;
import org.apache.commons.math4.legacy.exception.MathIllegalStateException;
import org.apache.commons.math4.legacy.exception.TooManyEvaluationsException;
import org.apache.commons.math4.legacy.optim.InitialGuess;
import org.apache.commons.math4.legacy.optim.MaxEval;
import org.apache.commons.math4.legacy.optim.PointValuePair;
import org.apache.commons.math4.legacy.optim.SimpleBounds;
import org.apache.commons.math4.legacy.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math4.legacy.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Box-constrained minimizer backed by the commons-math BOBYQA implementation
 * (Powell's derivative-free trust-region method with quadratic interpolation
 * models). Only function values are required and every evaluated point lies
 * inside the box.
 * <p>
 * BOBYQA first evaluates {@code 2n + 1} interpolation points, then spends one
 * evaluation per trust-region step. An <i>iteration</i> here is one such step,
 * so an iteration cap of {@code k} allows {@code 2n + 1 + k} evaluations.
 * When the cap is hit the best point evaluated so far is returned with
 * {@code converged == false}; this is not an error.
 * <p>
 * Variables whose bound has zero width are held at that value. The library
 * needs at least two free variables; a one-variable problem is solved with an
 * extra coordinate on [-1, 1] that the objective never sees.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class BobyqaOptimizer implements BoundedOptimizer {

	private static final Logger LOGGER = LogManager.getLogger(BobyqaOptimizer.class);

	public static final int DEFAULT_MAX_ITERATIONS = 15000;
	public static final double DEFAULT_INITIAL_RADIUS = 0.5;
	public static final double DEFAULT_STOPPING_RADIUS = 1e-9;

	private static final Bound INERT = Bound.of(-1, 1);

	private final int maxIterations;
	private final double initialRadius;
	private final double stoppingRadius;

	public BobyqaOptimizer() {
		this(builder());
	}

	private BobyqaOptimizer(Builder builder) {
		this.maxIterations = builder.maxIterations;
		this.initialRadius = builder.initialRadius;
		this.stoppingRadius = builder.stoppingRadius;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public OptimizationResult minimize(ObjectiveFunction objective, double[] initialGuess, Bound[] bounds, OptionalInt maxIterations) {
		Objects.requireNonNull(objective, "objective must not be null");
		Objects.requireNonNull(initialGuess, "initialGuess must not be null");
		Objects.requireNonNull(bounds, "bounds must not be null");
		Objects.requireNonNull(maxIterations, "maxIterations must not be null");

		final int n = initialGuess.length;
		checkBounds(bounds, n);
		final int iterCap = maxIterations.orElse(this.maxIterations);
		if (iterCap < 0) {
			throw new OptimizationException("Iteration cap must not be negative: " + iterCap);
		}

		// variables whose bound has zero width stay at that value
		int[] free = new int[n];
		int m = 0;
		double[] base = new double[n];
		for (int i = 0; i < n; i++) {
			base[i] = bounds[i].clip(initialGuess[i]);
			if (bounds[i].getLower() < bounds[i].getUpper()) {
				free[m++] = i;
			}
		}
		free = Arrays.copyOf(free, m);
		final TrackedObjective tracked = new TrackedObjective(objective, base, free);

		if (m == 0) {
			double f = tracked.value(new double[0]);
			return new OptimizationResult(base, f, 0, tracked.evaluations, true, "no free variables");
		}

		final int dim = Math.max(m, 2);
		double[] start = new double[dim];
		double[] lower = new double[dim];
		double[] upper = new double[dim];
		for (int k = 0; k < dim; k++) {
			Bound b = k < m ? bounds[free[k]] : INERT;
			lower[k] = b.getLower();
			upper[k] = b.getUpper();
			start[k] = k < m ? base[free[k]] : 0;
		}

		final int interpolationPoints = 2 * dim + 1;
		// the library shrinks the initial radius itself when a box is narrower than twice of it
		BOBYQAOptimizer bobyqa = new BOBYQAOptimizer(interpolationPoints, initialRadius, Math.min(stoppingRadius, initialRadius));

		try {
			PointValuePair optimum = bobyqa.optimize(new MaxEval(safeAdd(interpolationPoints, iterCap)),
					new org.apache.commons.math4.legacy.optim.nonlinear.scalar.ObjectiveFunction(tracked), GoalType.MINIMIZE,
					new InitialGuess(start), new SimpleBounds(lower, upper));
			LOGGER.debug("BOBYQA converged after {} evaluations", tracked.evaluations);
			return new OptimizationResult(tracked.expand(optimum.getPointRef()), optimum.getValue(),
					iterations(tracked.evaluations, interpolationPoints), tracked.evaluations, true, "trust region radius below " + stoppingRadius);
		} catch (TooManyEvaluationsException e) {
			LOGGER.debug("BOBYQA stopped at the iteration cap of {}", iterCap);
			return new OptimizationResult(tracked.bestPoint(), tracked.bestValue, iterations(tracked.evaluations, interpolationPoints),
					tracked.evaluations, false, "iteration limit reached");
		} catch (MathIllegalStateException | MathIllegalArgumentException e) {
			throw new OptimizationException("BOBYQA failed: " + e.getMessage(), e);
		}
	}

	private static void checkBounds(Bound[] bounds, int n) {
		if (bounds.length != n) {
			throw new OptimizationException("Expected " + n + " bounds but got " + bounds.length);
		}
		for (int i = 0; i < n; i++) {
			Bound b = Objects.requireNonNull(bounds[i], "bound " + i + " is null");
			if (Double.isNaN(b.getLower()) || Double.isNaN(b.getUpper())) {
				throw new OptimizationException("Bound " + i + " is NaN: " + b);
			}
			if (b.getLower() > b.getUpper() || b.getLower() == Double.POSITIVE_INFINITY || b.getUpper() == Double.NEGATIVE_INFINITY) {
				throw new OptimizationException("Bound " + i + " is empty: " + b);
			}
		}
	}

	private static int iterations(int evaluations, int interpolationPoints) {
		return Math.max(0, evaluations - interpolationPoints);
	}

	private static int safeAdd(int a, int b) {
		long sum = (long) a + b;
		return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
	}

	/**
	 * Adapts an {@link ObjectiveFunction} to the library: scatters the free
	 * coordinates into a full point, drops the inert one, and remembers the
	 * best point seen so a capped run can still return it.
	 */
	private static final class TrackedObjective implements MultivariateFunction {

		private final ObjectiveFunction objective;
		private final double[] base;
		private final int[] free;
		private double[] best;
		double bestValue = Double.POSITIVE_INFINITY;
		int evaluations;

		TrackedObjective(ObjectiveFunction objective, double[] base, int[] free) {
			this.objective = objective;
			this.base = base;
			this.free = free;
		}

		double[] expand(double[] point) {
			double[] x = base.clone();
			for (int k = 0; k < free.length; k++) {
				x[free[k]] = point[k];
			}
			return x;
		}

		@Override
		public double value(double[] point) {
			double[] x = expand(point);
			double f = objective.evaluate(x);
			evaluations++;
			if (!Double.isFinite(f)) {
				throw new OptimizationException("Objective is not finite at " + Arrays.toString(x) + ": " + f);
			}
			if (f < bestValue) {
				bestValue = f;
				best = x;
			}
			return f;
		}

		double[] bestPoint() {
			return best.clone();
		}
	}

	public static final class Builder {

		private int maxIterations = DEFAULT_MAX_ITERATIONS;
		private double initialRadius = DEFAULT_INITIAL_RADIUS;
		private double stoppingRadius = DEFAULT_STOPPING_RADIUS;

		private Builder() {
		}

		/** Iteration cap used when a call does not supply one. */
		public Builder maxIterations(int maxIterations) {
			if (maxIterations < 1) {
				throw new IllegalArgumentException("maxIterations must be positive");
			}
			this.maxIterations = maxIterations;
			return this;
		}

		/** Starting trust region radius, in the units of the variables. */
		public Builder initialRadius(double initialRadius) {
			if (!(initialRadius > 0) || Double.isInfinite(initialRadius)) {
				throw new IllegalArgumentException("initialRadius must be positive and finite");
			}
			this.initialRadius = initialRadius;
			return this;
		}

		/** The run ends once the trust region has shrunk to this radius. */
		public Builder stoppingRadius(double stoppingRadius) {
			if (!(stoppingRadius > 0) || Double.isInfinite(stoppingRadius)) {
				throw new IllegalArgumentException("stoppingRadius must be positive and finite");
			}
			this.stoppingRadius = stoppingRadius;
			return this;
		}

		public BobyqaOptimizer build() {
			return new BobyqaOptimizer(this);
		}
	}
}
