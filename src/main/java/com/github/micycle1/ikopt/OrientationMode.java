package com.github.micycle1.ikopt;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.chain.Transforms;

/**
 * Which part of the end-effector orientation is matched against the target.
 * <ul>
 * <li>NONE: orientation is ignored.</li>
 * <li>X, Y, Z: the matching rotation column (direction of that axis) is
 * compared, by Euclidean norm of the difference.</li>
 * <li>ALL: the whole 3x3 rotation block is compared, by Frobenius norm.</li>
 * </ul>
 */
public enum OrientationMode {

	NONE(-1), X(0), Y(1), Z(2), ALL(-1);

	private final int column;

	OrientationMode(int column) {
		this.column = column;
	}

	/** Rotation column compared by this mode, or -1 for NONE and ALL. */
	public int getColumn() {
		return column;
	}

	public boolean isEnabled() {
		return this != NONE;
	}

	/**
	 * Parses one of the exact names "X", "Y", "Z" or "all". A null name means
	 * NONE.
	 *
	 * @throws IllegalArgumentException for any other name, including other
	 *                                  spellings of these
	 */
	public static OrientationMode fromName(String name) {
		if (name == null) {
			return NONE;
		}
		switch (name) {
			case "X":
				return X;
			case "Y":
				return Y;
			case "Z":
				return Z;
			case "all":
				return ALL;
			default:
				throw new IllegalArgumentException("Unknown orientation mode: " + name);
		}
	}

	/**
	 * The part of {@code pose} this mode compares: a 3x1 axis column or the 3x3
	 * rotation block.
	 *
	 * @throws IllegalStateException for NONE, which compares nothing
	 */
	public DMatrixRMaj slice(DMatrixRMaj pose) {
		switch (this) {
			case X:
			case Y:
			case Z:
				return Transforms.axis(pose, column);
			case ALL:
				return Transforms.rotationBlock(pose);
			default:
				throw new IllegalStateException("Orientation mode " + this + " has no orientation slice");
		}
	}

	/** Orientation error between a computed pose and the target; 0 for NONE. */
	public double error(DMatrixRMaj pose, DMatrixRMaj target) {
		if (this == NONE) {
			return 0.0;
		}
		return MathUtil.frobeniusDistance(slice(pose), slice(target));
	}
}
