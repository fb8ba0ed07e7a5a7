package com.github.micycle1.ikopt.chain;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Helpers for 4x4 homogeneous transforms stored as EJML {@code DMatrixRMaj}.
 * Position is column 3 of rows 0..2; the rotation block is rows/cols 0..2.
 */
public final class Transforms {

	private Transforms() {
	}

	public static DMatrixRMaj identity() {
		return CommonOps_DDRM.identity(4);
	}

	public static DMatrixRMaj translation(double x, double y, double z) {
		DMatrixRMaj t = identity();
		t.set(0, 3, x);
		t.set(1, 3, y);
		t.set(2, 3, z);
		return t;
	}

	public static DMatrixRMaj translation(double[] v) {
		return translation(v[0], v[1], v[2]);
	}

	/**
	 * Rotation of {@code angle} radians about {@code axis} (Rodrigues). The axis
	 * need not be normalized but must be non-zero.
	 */
	public static DMatrixRMaj rotation(double[] axis, double angle) {
		double norm = Math.sqrt(axis[0] * axis[0] + axis[1] * axis[1] + axis[2] * axis[2]);
		if (norm == 0.0) {
			throw new IllegalArgumentException("Rotation axis must be non-zero");
		}
		double x = axis[0] / norm, y = axis[1] / norm, z = axis[2] / norm;
		double c = Math.cos(angle), s = Math.sin(angle), t = 1.0 - c;

		DMatrixRMaj r = identity();
		r.set(0, 0, t * x * x + c);
		r.set(0, 1, t * x * y - s * z);
		r.set(0, 2, t * x * z + s * y);
		r.set(1, 0, t * x * y + s * z);
		r.set(1, 1, t * y * y + c);
		r.set(1, 2, t * y * z - s * x);
		r.set(2, 0, t * x * z - s * y);
		r.set(2, 1, t * y * z + s * x);
		r.set(2, 2, t * z * z + c);
		return r;
	}

	/**
	 * Fixed-axis roll/pitch/yaw as used by URDF origins: Rz(yaw) * Ry(pitch) *
	 * Rx(roll).
	 */
	public static DMatrixRMaj rpy(double roll, double pitch, double yaw) {
		DMatrixRMaj rx = rotation(new double[] { 1, 0, 0 }, roll);
		DMatrixRMaj ry = rotation(new double[] { 0, 1, 0 }, pitch);
		DMatrixRMaj rz = rotation(new double[] { 0, 0, 1 }, yaw);
		return compose(compose(rz, ry), rx);
	}

	/** Returns a * b. */
	public static DMatrixRMaj compose(DMatrixRMaj a, DMatrixRMaj b) {
		DMatrixRMaj out = new DMatrixRMaj(4, 4);
		CommonOps_DDRM.mult(a, b, out);
		return out;
	}

	/** Builds a frame from a position and a 3x3 rotation (null for identity). */
	public static DMatrixRMaj frame(double[] position, DMatrixRMaj rotation) {
		DMatrixRMaj f = translation(position);
		if (rotation != null) {
			if (rotation.numRows != 3 || rotation.numCols != 3) {
				throw new IllegalArgumentException("Rotation must be 3x3 but was " + rotation.numRows + "x" + rotation.numCols);
			}
			CommonOps_DDRM.insert(rotation, f, 0, 0);
		}
		return f;
	}

	public static double[] position(DMatrixRMaj pose) {
		return new double[] { pose.get(0, 3), pose.get(1, 3), pose.get(2, 3) };
	}

	/** Rotation column {@code col} (0=x, 1=y, 2=z axis) as a 3x1 matrix. */
	public static DMatrixRMaj axis(DMatrixRMaj pose, int col) {
		return CommonOps_DDRM.extract(pose, 0, 3, col, col + 1);
	}

	public static DMatrixRMaj rotationBlock(DMatrixRMaj pose) {
		return CommonOps_DDRM.extract(pose, 0, 3, 0, 3);
	}
}
