package com.github.micycle1.ikopt;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalDouble;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import com.github.micycle1.ikopt.chain.Chain;
import com.github.micycle1.ikopt.chain.Transforms;
import com.github.micycle1.ikopt.optim.Bound;

public class IkObjectiveTest {

	private static final Bound PI = Bound.of(-Math.PI, Math.PI);

	@Test
	void zeroAtTarget() {
		Chain chain = PlanarArms.planar(2);
		double[] start = PlanarArms.full(0.3, 0.9);
		DMatrixRMaj target = chain.forwardKinematics(start);

		for (OrientationMode mode : OrientationMode.values()) {
			IkObjective objective = new IkObjective(chain, target, start, mode, OptionalDouble.of(2.0));
			assertEquals(0.0, objective.evaluate(new double[] { 0.3, 0.9 }), 1e-24, mode.name());
		}
	}

	@Test
	void squaredPositionErrorWithoutOrientation() {
		Chain chain = PlanarArms.planar(2);
		// arm straight along x reaches (2, 0, 0); target is 0.5 further
		DMatrixRMaj target = Transforms.translation(2.5, 0, 0);
		IkObjective objective = new IkObjective(chain, target, PlanarArms.full(0, 0), OrientationMode.NONE, OptionalDouble.empty());

		assertEquals(0.25, objective.evaluate(new double[] { 0, 0 }), 1e-12);
		assertEquals(0.5, objective.positionError(PlanarArms.full(0, 0)), 1e-12);
	}

	@Test
	void orientationTermIsWeighted() {
		Chain chain = PlanarArms.planar(2);
		double[] start = PlanarArms.full(0, 0);
		// same position as the straight arm, end effector x axis turned 90 degrees
		DMatrixRMaj target = Transforms.compose(Transforms.translation(2, 0, 0), Transforms.rotation(new double[] { 0, 0, 1 }, Math.PI / 2));

		IkObjective x = new IkObjective(chain, target, start, OrientationMode.X, OptionalDouble.empty());
		double axisError = Math.sqrt(2);
		assertEquals(axisError, x.orientationError(start), 1e-12);
		assertEquals(IkObjective.ORIENTATION_WEIGHT * axisError * axisError, x.evaluate(new double[] { 0, 0 }), 1e-12);

		IkObjective z = new IkObjective(chain, target, start, OrientationMode.Z, OptionalDouble.empty());
		assertEquals(0.0, z.evaluate(new double[] { 0, 0 }), 1e-12);

		IkObjective all = new IkObjective(chain, target, start, OrientationMode.ALL, OptionalDouble.empty());
		assertEquals(IkObjective.ORIENTATION_WEIGHT * 4.0, all.evaluate(new double[] { 0, 0 }), 1e-12);
	}

	@Test
	void regularizationPenalizesDistanceFromStart() {
		Chain chain = PlanarArms.planar(2);
		double[] start = PlanarArms.full(0.1, 0.2);
		double[] moved = { 0.4, -0.2 };
		DMatrixRMaj target = chain.forwardKinematics(PlanarArms.full(moved));

		IkObjective plain = new IkObjective(chain, target, start, OrientationMode.NONE, OptionalDouble.empty());
		IkObjective regularized = new IkObjective(chain, target, start, OrientationMode.NONE, OptionalDouble.of(0.5));

		double distance = Math.hypot(0.4 - 0.1, -0.2 - 0.2);
		assertEquals(0.0, plain.evaluate(moved), 1e-24);
		assertEquals(0.5 * distance, regularized.evaluate(moved), 1e-12);
		assertEquals(0.0, regularized.evaluate(new double[] { 0.1, 0.2 }) - plain.evaluate(new double[] { 0.1, 0.2 }), 1e-12);
	}

	@Test
	void fixedEntriesComeFromStart() {
		Chain chain = new Chain("masked", PlanarArms.links(PI, PI), new boolean[] { false, true, false, false });
		double[] start = PlanarArms.full(0, Math.PI / 2);
		// joint 2 stays at 90 degrees: with joint 1 at 0 the effector is at (1, 1, 0)
		IkObjective objective = new IkObjective(chain, Transforms.translation(1, 1, 0), start, OrientationMode.NONE, OptionalDouble.empty());
		assertEquals(0.0, objective.evaluate(new double[] { 0 }), 1e-24);
		assertArrayEquals(new double[] { 0 }, objective.getStartingActive());
	}

	@Test
	void oneForwardKinematicsCallPerEvaluation() {
		CountingChain chain = new CountingChain(PlanarArms.links(PI, PI));
		IkObjective objective = new IkObjective(chain, Transforms.translation(1, 1, 0), PlanarArms.full(0, 0), OrientationMode.ALL,
				OptionalDouble.of(1.0));
		assertEquals(0, chain.calls);

		objective.evaluate(new double[] { 0.1, 0.2 });
		objective.evaluate(new double[] { 0.3, 0.2 });
		assertEquals(2, chain.calls);
	}

	@Test
	void startingVectorIsCopied() {
		Chain chain = PlanarArms.planar(2);
		double[] start = PlanarArms.full(0, 0);
		IkObjective objective = new IkObjective(chain, Transforms.translation(2, 0, 0), start, OrientationMode.NONE, OptionalDouble.empty());
		start[1] = 1.0;
		assertArrayEquals(new double[] { 0, 0 }, objective.getStartingActive());
	}
}
