package com.github.micycle1.ikopt;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

final class MathUtil {

	private MathUtil() {
	}

	// Euclidean distance between two vectors of equal length
	public static double distance(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			double d = a[i] - b[i];
			s += d * d;
		}
		return Math.sqrt(s);
	}

	// Distance between the translation columns of two homogeneous transforms
	public static double translationDistance(DMatrixRMaj a, DMatrixRMaj b) {
		double dx = a.get(0, 3) - b.get(0, 3);
		double dy = a.get(1, 3) - b.get(1, 3);
		double dz = a.get(2, 3) - b.get(2, 3);
		return Math.sqrt(dx * dx + dy * dy + dz * dz);
	}

	// Frobenius norm of a - b. For column vectors this is the Euclidean norm.
	public static double frobeniusDistance(DMatrixRMaj a, DMatrixRMaj b) {
		DMatrixRMaj diff = new DMatrixRMaj(a.numRows, a.numCols);
		CommonOps_DDRM.subtract(a, b, diff);
		return NormOps_DDRM.normF(diff);
	}
}
