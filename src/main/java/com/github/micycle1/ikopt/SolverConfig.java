package com.github.micycle1.ikopt;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Options for a single inverse kinematics solve. Immutable; the {@code with*}
 * methods return modified copies.
 * <p>
 * Defaults: no regularization, the optimizer's own iteration cap, orientation
 * ignored.
 */
public final class SolverConfig {

	private static final SolverConfig DEFAULTS = new SolverConfig(OptionalDouble.empty(), OptionalInt.empty(), OrientationMode.NONE);

	private final OptionalDouble regularizationWeight;
	private final OptionalInt maxIterations;
	private final OrientationMode orientationMode;

	private SolverConfig(OptionalDouble regularizationWeight, OptionalInt maxIterations, OrientationMode orientationMode) {
		this.regularizationWeight = regularizationWeight;
		this.maxIterations = maxIterations;
		this.orientationMode = orientationMode;
	}

	public static SolverConfig defaults() {
		return DEFAULTS;
	}

	/**
	 * Builds a config from nullable values; null means "use the default".
	 *
	 * @throws IllegalArgumentException if any value is invalid, including an
	 *                                  unknown orientation mode name
	 */
	public static SolverConfig of(Double regularizationWeight, Integer maxIterations, String orientationMode) {
		SolverConfig c = DEFAULTS.withOrientationMode(OrientationMode.fromName(orientationMode));
		if (regularizationWeight != null) {
			c = c.withRegularization(regularizationWeight);
		}
		if (maxIterations != null) {
			c = c.withMaxIterations(maxIterations);
		}
		return c;
	}

	/** Penalizes distance of the solution from the starting active joints. */
	public SolverConfig withRegularization(double weight) {
		if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
			throw new IllegalArgumentException("Regularization weight must be finite and non-negative: " + weight);
		}
		return new SolverConfig(OptionalDouble.of(weight), maxIterations, orientationMode);
	}

	public SolverConfig withMaxIterations(int maxIterations) {
		if (maxIterations <= 0) {
			throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
		}
		return new SolverConfig(regularizationWeight, OptionalInt.of(maxIterations), orientationMode);
	}

	public SolverConfig withOrientationMode(OrientationMode orientationMode) {
		return new SolverConfig(regularizationWeight, maxIterations, Objects.requireNonNull(orientationMode, "orientationMode must not be null"));
	}

	public OptionalDouble getRegularizationWeight() {
		return regularizationWeight;
	}

	public OptionalInt getMaxIterations() {
		return maxIterations;
	}

	public OrientationMode getOrientationMode() {
		return orientationMode;
	}

	@Override
	public String toString() {
		return "SolverConfig{regularizationWeight=" + regularizationWeight + ", maxIterations=" + maxIterations + ", orientationMode="
				+ orientationMode + "}";
	}
}
