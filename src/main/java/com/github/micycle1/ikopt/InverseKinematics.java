package com.github.micycle1.ikopt;

import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.chain.Chain;
import com.github.micycle1.ikopt.optim.Bound;
import com.github.micycle1.ikopt.optim.BoundedOptimizer;
import com.github.micycle1.ikopt.optim.BobyqaOptimizer;
import com.github.micycle1.ikopt.optim.OptimizationException;
import com.github.micycle1.ikopt.optim.OptimizationResult;

/**
 * <p>
 * Inverse kinematics by bound-constrained optimization: finds joint values of
 * a {@link Chain} whose end effector approaches a target pose.
 * </p>
 *
 * <p>
 * A solve reduces the starting configuration to the active joints, minimizes
 * an {@link IkObjective} over them within the links' bounds, and writes the
 * optimized values back into a copy of the starting configuration. Fixed and
 * masked-out joints keep their starting values.
 * </p>
 *
 * <p>
 * Notes:
 * </p>
 * <ul>
 * <li>One local optimization is performed per call. There is no multi-start;
 * a poor starting configuration can end in a local minimum.</li>
 * <li>Running out of iterations is not an error: the best iterate is
 * returned.</li>
 * <li>Invalid arguments are rejected before the optimizer or forward
 * kinematics is invoked. Failures of the optimizer itself surface as
 * {@link OptimizationException}.</li>
 * </ul>
 */
public final class InverseKinematics {

	private static final Logger LOGGER = LogManager.getLogger(InverseKinematics.class);

	private static final BoundedOptimizer DEFAULT_OPTIMIZER = new BobyqaOptimizer();

	private InverseKinematics() {
	}

	/** Solve with the default {@link BobyqaOptimizer}. */
	public static double[] solve(Chain chain, DMatrixRMaj target, double[] startingFull, SolverConfig config) {
		return solve(chain, target, startingFull, config, DEFAULT_OPTIMIZER);
	}

	/**
	 * @param chain        chain to solve for
	 * @param target       4x4 homogeneous target pose
	 * @param startingFull starting joint values, one per link
	 * @param config       regularization, iteration cap and orientation mode
	 * @param optimizer    bounded optimizer to run
	 * @return full joint vector; only active entries differ from
	 *         {@code startingFull}
	 */
	public static double[] solve(Chain chain, DMatrixRMaj target, double[] startingFull, SolverConfig config, BoundedOptimizer optimizer) {
		Objects.requireNonNull(chain, "chain must not be null");
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(optimizer, "optimizer must not be null");
		if (startingFull == null) {
			throw new IllegalArgumentException("Starting joint configuration must be specified");
		}
		if (startingFull.length != chain.size()) {
			throw new IllegalArgumentException("Starting configuration has " + startingFull.length + " values but chain " + chain.getName() + " has "
					+ chain.size() + " links");
		}
		if (target == null) {
			throw new IllegalArgumentException("Target pose must be specified");
		}
		if (target.numRows != 4 || target.numCols != 4) {
			throw new IllegalArgumentException("Target pose must be 4x4 but was " + target.numRows + "x" + target.numCols);
		}

		IkObjective objective = new IkObjective(chain, target, startingFull, config.getOrientationMode(), config.getRegularizationWeight());
		Bound[] bounds = JointSpace.reduceBounds(chain);
		double[] initialGuess = objective.getStartingActive();

		OptimizationResult result = optimizer.minimize(objective, initialGuess, bounds, config.getMaxIterations());

		LOGGER.info("Inverse kinematics optimization finished in {} iterations", result.getIterations());
		LOGGER.debug("Chain {}: {}", chain.getName(), result);

		return JointSpace.merge(chain, result.getSolution(), startingFull);
	}

	/**
	 * Flat form of {@link #solve(Chain, DMatrixRMaj, double[], SolverConfig)}
	 * taking nullable options.
	 *
	 * @param regularizationWeight weight of the distance-to-start penalty, or null
	 * @param maxIterations        iteration cap, or null for the optimizer default
	 * @param orientationMode      "X", "Y", "Z", "all", or null for none
	 * @throws IllegalArgumentException for a missing starting configuration or an
	 *                                  unknown orientation mode
	 */
	public static double[] solveInverseKinematics(Chain chain, DMatrixRMaj target, double[] startingFull, Double regularizationWeight,
			Integer maxIterations, String orientationMode) {
		SolverConfig config = SolverConfig.of(regularizationWeight, maxIterations, orientationMode);
		return solve(chain, target, startingFull, config);
	}
}
