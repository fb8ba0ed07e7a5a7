package com.github.micycle1.ikopt;

import java.util.Objects;
import java.util.OptionalDouble;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.chain.Chain;
import com.github.micycle1.ikopt.optim.ObjectiveFunction;

/**
 * Scalar error of an active joint vector with respect to a target pose:
 *
 * <pre>
 * f(x) = |p(x) - p*|^2 + ORIENTATION_WEIGHT * e_o(x)^2 [+ lambda * |x - x0|]
 * </pre>
 *
 * where {@code p} is the end-effector position from forward kinematics of
 * {@code x} merged into the starting full vector, {@code e_o} is the
 * orientation error of the configured {@link OrientationMode}, and the last
 * term is present only when a regularization weight {@code lambda} is set,
 * with {@code x0} the active part of the starting vector.
 * <p>
 * Each evaluation calls {@link Chain#forwardKinematics} exactly once and has
 * no other side effect.
 */
public final class IkObjective implements ObjectiveFunction {

	/**
	 * Weight of the squared orientation error relative to the squared position
	 * error. Kept at 1 so the position term is never dominated; a heavier
	 * orientation term lets the optimizer settle on poses with the right
	 * orientation far from the target position.
	 */
	public static final double ORIENTATION_WEIGHT = 1.0;

	private final Chain chain;
	private final DMatrixRMaj target;
	private final double[] startingFull;
	private final double[] startingActive;
	private final OrientationMode orientationMode;
	private final OptionalDouble regularizationWeight;

	public IkObjective(Chain chain, DMatrixRMaj target, double[] startingFull, OrientationMode orientationMode, OptionalDouble regularizationWeight) {
		this.chain = Objects.requireNonNull(chain, "chain must not be null");
		this.target = Objects.requireNonNull(target, "target must not be null").copy();
		this.startingFull = Objects.requireNonNull(startingFull, "startingFull must not be null").clone();
		this.orientationMode = Objects.requireNonNull(orientationMode, "orientationMode must not be null");
		this.regularizationWeight = Objects.requireNonNull(regularizationWeight, "regularizationWeight must not be null");
		this.startingActive = JointSpace.reduce(chain, this.startingFull);
	}

	@Override
	public double evaluate(double[] active) {
		double[] full = JointSpace.merge(chain, active, startingFull);
		DMatrixRMaj pose = chain.forwardKinematics(full);

		double position = MathUtil.translationDistance(pose, target);
		double orientation = orientationMode.error(pose, target);
		double value = position * position + ORIENTATION_WEIGHT * orientation * orientation;

		if (regularizationWeight.isPresent()) {
			value += regularizationWeight.getAsDouble() * MathUtil.distance(active, startingActive);
		}
		return value;
	}

	/** Distance from the end effector at {@code full} to the target position. */
	public double positionError(double[] full) {
		return MathUtil.translationDistance(chain.forwardKinematics(full), target);
	}

	/** Orientation error at {@code full} under this objective's mode. */
	public double orientationError(double[] full) {
		return orientationMode.error(chain.forwardKinematics(full), target);
	}

	public double[] getStartingActive() {
		return startingActive.clone();
	}
}
