package com.github.micycle1.ikopt.chain;

import static org.junit.jupiter.api.Assertions.*;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

public class TransformsTest {

	@Test
	void rotationAboutZ() {
		DMatrixRMaj r = Transforms.rotation(new double[] { 0, 0, 2 }, Math.PI / 2);
		assertEquals(0, r.get(0, 0), 1e-12);
		assertEquals(-1, r.get(0, 1), 1e-12);
		assertEquals(1, r.get(1, 0), 1e-12);
		assertEquals(1, r.get(2, 2), 1e-12);
		assertEquals(1, r.get(3, 3), 1e-12);
	}

	@Test
	void rotationsAreOrthonormal() {
		DMatrixRMaj r = Transforms.rotationBlock(Transforms.rpy(0.3, -0.7, 1.1));
		DMatrixRMaj rrt = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.multTransB(r, r, rrt);
		assertArrayEquals(CommonOps_DDRM.identity(3).data, rrt.data, 1e-12);
		assertEquals(1.0, CommonOps_DDRM.det(r), 1e-12);
	}

	@Test
	void rpyMatchesAxisRotations() {
		DMatrixRMaj yaw = Transforms.rpy(0, 0, 0.4);
		assertArrayEquals(Transforms.rotation(new double[] { 0, 0, 1 }, 0.4).data, yaw.data, 1e-12);
		DMatrixRMaj roll = Transforms.rpy(0.4, 0, 0);
		assertArrayEquals(Transforms.rotation(new double[] { 1, 0, 0 }, 0.4).data, roll.data, 1e-12);
	}

	@Test
	void frameAndSlices() {
		DMatrixRMaj rot = Transforms.rotationBlock(Transforms.rotation(new double[] { 0, 0, 1 }, Math.PI / 2));
		DMatrixRMaj f = Transforms.frame(new double[] { 1, 2, 3 }, rot);

		assertArrayEquals(new double[] { 1, 2, 3 }, Transforms.position(f), 0.0);
		DMatrixRMaj x = Transforms.axis(f, 0);
		assertEquals(3, x.numRows);
		assertEquals(1, x.numCols);
		assertEquals(1.0, x.get(1, 0), 1e-12);
		assertArrayEquals(rot.data, Transforms.rotationBlock(f).data, 0.0);

		assertThrows(IllegalArgumentException.class, () -> Transforms.frame(new double[] { 0, 0, 0 }, new DMatrixRMaj(2, 2)));
		assertThrows(IllegalArgumentException.class, () -> Transforms.rotation(new double[] { 0, 0, 0 }, 1));
	}
}
