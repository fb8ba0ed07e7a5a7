package com.github.micycle1.ikopt;

import static org.junit.jupiter.api.Assertions.*;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.ikopt.chain.Transforms;

public class OrientationModeTest {

	@Test
	void parsesNames() {
		assertEquals(OrientationMode.NONE, OrientationMode.fromName(null));
		assertEquals(OrientationMode.X, OrientationMode.fromName("X"));
		assertEquals(OrientationMode.Y, OrientationMode.fromName("Y"));
		assertEquals(OrientationMode.Z, OrientationMode.fromName("Z"));
		assertEquals(OrientationMode.ALL, OrientationMode.fromName("all"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "W", "", "xy", "ALLL", "x", "y", " Z", "ALL", "All", "none", "NONE", "None" })
	void rejectsUnknownNames(String name) {
		assertThrows(IllegalArgumentException.class, () -> OrientationMode.fromName(name));
	}

	@Test
	void noneIgnoresOrientation() {
		DMatrixRMaj a = Transforms.rotation(new double[] { 1, 0, 0 }, 1.0);
		assertEquals(0.0, OrientationMode.NONE.error(a, Transforms.identity()));
		assertFalse(OrientationMode.NONE.isEnabled());
		assertThrows(IllegalStateException.class, () -> OrientationMode.NONE.slice(a));
	}

	@Test
	void axisModesCompareOneColumn() {
		// rotating about z leaves the z axis alone and moves x and y by the same amount
		double angle = Math.PI / 3;
		DMatrixRMaj pose = Transforms.rotation(new double[] { 0, 0, 1 }, angle);
		DMatrixRMaj target = Transforms.identity();
		double chord = 2 * Math.sin(angle / 2);

		assertEquals(chord, OrientationMode.X.error(pose, target), 1e-12);
		assertEquals(chord, OrientationMode.Y.error(pose, target), 1e-12);
		assertEquals(0.0, OrientationMode.Z.error(pose, target), 1e-12);
		assertEquals(2, OrientationMode.Z.getColumn());
	}

	@Test
	void allComparesWholeRotation() {
		double angle = Math.PI / 3;
		DMatrixRMaj pose = Transforms.rotation(new double[] { 0, 0, 1 }, angle);
		double chord = 2 * Math.sin(angle / 2);

		assertEquals(Math.sqrt(2) * chord, OrientationMode.ALL.error(pose, Transforms.identity()), 1e-12);
		assertEquals(3, OrientationMode.ALL.slice(pose).numCols);
	}

	@Test
	void translationIsIgnored() {
		DMatrixRMaj moved = Transforms.translation(5, -3, 1);
		for (OrientationMode mode : OrientationMode.values()) {
			assertEquals(0.0, mode.error(moved, Transforms.identity()), 0.0, mode.name());
		}
	}
}
