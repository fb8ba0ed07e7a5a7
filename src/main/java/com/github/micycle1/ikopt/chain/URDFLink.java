package com.github.micycle1.ikopt.chain;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.optim.Bound;

/**
 * Link in the URDF convention: a fixed origin (translation followed by
 * roll/pitch/yaw) and then the joint motion along or about {@code axis}.
 */
public final class URDFLink extends Link {

	public enum JointType {
		REVOLUTE, PRISMATIC, FIXED
	}

	private final double[] axis;
	private final JointType jointType;
	private final DMatrixRMaj origin;

	/**
	 * @param translation origin translation (x, y, z)
	 * @param orientation origin roll, pitch, yaw in radians
	 * @param axis        joint axis in the origin frame; ignored for FIXED
	 */
	public URDFLink(String name, double[] translation, double[] orientation, double[] axis, Bound bounds, JointType jointType) {
		super(name, bounds);
		double[] t = vec3(translation, "translation");
		double[] rpy = vec3(orientation, "orientation");
		this.jointType = Objects.requireNonNull(jointType, "jointType must not be null");
		this.axis = jointType == JointType.FIXED && axis == null ? new double[] { 0, 0, 1 } : vec3(axis, "axis");
		if (jointType != JointType.FIXED && this.axis[0] == 0 && this.axis[1] == 0 && this.axis[2] == 0) {
			throw new IllegalArgumentException("Joint axis of " + name + " must be non-zero");
		}
		this.origin = Transforms.compose(Transforms.translation(t), Transforms.rpy(rpy[0], rpy[1], rpy[2]));
	}

	public static URDFLink revolute(String name, double[] translation, double[] orientation, double[] axis, Bound bounds) {
		return new URDFLink(name, translation, orientation, axis, bounds, JointType.REVOLUTE);
	}

	public static URDFLink prismatic(String name, double[] translation, double[] orientation, double[] axis, Bound bounds) {
		return new URDFLink(name, translation, orientation, axis, bounds, JointType.PRISMATIC);
	}

	public static URDFLink fixed(String name, double[] translation, double[] orientation) {
		return new URDFLink(name, translation, orientation, null, Bound.UNBOUNDED, JointType.FIXED);
	}

	@Override
	public boolean isActive() {
		return jointType != JointType.FIXED;
	}

	@Override
	public DMatrixRMaj transform(double q) {
		switch (jointType) {
			case REVOLUTE:
				return Transforms.compose(origin, Transforms.rotation(axis, q));
			case PRISMATIC:
				return Transforms.compose(origin, Transforms.translation(axis[0] * q, axis[1] * q, axis[2] * q));
			case FIXED:
			default:
				return origin.copy();
		}
	}

	public JointType getJointType() {
		return jointType;
	}

	private static double[] vec3(double[] v, String what) {
		Objects.requireNonNull(v, what + " must not be null");
		if (v.length != 3) {
			throw new IllegalArgumentException(what + " must have 3 components but had " + v.length);
		}
		return v.clone();
	}
}
