package com.github.micycle1.ikopt.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.InverseKinematics;
import com.github.micycle1.ikopt.OrientationMode;
import com.github.micycle1.ikopt.SolverConfig;

/**
 * Ordered sequence of links from the base to the end effector, with a mask
 * telling which joints are optimized.
 * <p>
 * Joint vectors passed to this class are "full": one value per link,
 * including fixed links, in link order. Forward kinematics is a pure function
 * of such a vector; a chain is not modified after construction and may be
 * shared between concurrent solves.
 */
public class Chain {

	private static final Logger LOGGER = LogManager.getLogger(Chain.class);

	private final String name;
	private final List<Link> links;
	private final boolean[] activeMask;
	private final int activeCount;
	private final int firstActiveJoint;

	/** Chain whose active joints are exactly the links reporting active. */
	public Chain(String name, List<Link> links) {
		this(name, links, defaultMask(links));
	}

	public Chain(String name, List<Link> links, boolean[] activeMask) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(links, "links must not be null");
		Objects.requireNonNull(activeMask, "activeMask must not be null");
		if (links.isEmpty()) {
			throw new IllegalArgumentException("Chain must have at least one link");
		}
		if (activeMask.length != links.size()) {
			throw new IllegalArgumentException("Active mask length " + activeMask.length + " does not match link count " + links.size());
		}
		this.links = Collections.unmodifiableList(new ArrayList<>(links));
		this.activeMask = activeMask.clone();

		int count = 0;
		int first = -1;
		for (int i = 0; i < activeMask.length; i++) {
			Link link = Objects.requireNonNull(this.links.get(i), "link " + i + " is null");
			if (activeMask[i]) {
				if (!link.isActive()) {
					LOGGER.warn("Link {} ({}) is a fixed link but is marked active; its value will not affect the pose", i, link.getName());
				}
				count++;
				if (first < 0) {
					first = i;
				}
			}
		}
		this.activeCount = count;
		this.firstActiveJoint = first;
	}

	private static boolean[] defaultMask(List<Link> links) {
		Objects.requireNonNull(links, "links must not be null");
		boolean[] mask = new boolean[links.size()];
		for (int i = 0; i < mask.length; i++) {
			mask[i] = links.get(i) != null && links.get(i).isActive();
		}
		return mask;
	}

	public String getName() {
		return name;
	}

	public List<Link> getLinks() {
		return links;
	}

	public Link getLink(int i) {
		return links.get(i);
	}

	/** Number of links, i.e. the length of a full joint vector. */
	public int size() {
		return links.size();
	}

	public boolean isActive(int i) {
		return activeMask[i];
	}

	public boolean[] getActiveMask() {
		return activeMask.clone();
	}

	public int getActiveCount() {
		return activeCount;
	}

	/** Index of the first active link, or -1 when none is active. */
	public int getFirstActiveJoint() {
		return firstActiveJoint;
	}

	/** Pose of the end effector for the given full joint vector. */
	public DMatrixRMaj forwardKinematics(double[] joints) {
		checkLength(joints);
		DMatrixRMaj frame = Transforms.identity();
		for (int i = 0; i < links.size(); i++) {
			frame = Transforms.compose(frame, links.get(i).transform(joints[i]));
		}
		return frame;
	}

	/** Frames of every link, base first; the last entry is the end effector. */
	public List<DMatrixRMaj> forwardKinematicsFrames(double[] joints) {
		checkLength(joints);
		List<DMatrixRMaj> frames = new ArrayList<>(links.size());
		DMatrixRMaj frame = Transforms.identity();
		for (int i = 0; i < links.size(); i++) {
			frame = Transforms.compose(frame, links.get(i).transform(joints[i]));
			frames.add(frame);
		}
		return frames;
	}

	/**
	 * Solves for a full joint vector reaching {@code target}.
	 *
	 * @param initialPosition starting full joint vector; zeros when null
	 */
	public double[] inverseKinematicsFrame(DMatrixRMaj target, double[] initialPosition, SolverConfig config) {
		double[] start = initialPosition != null ? initialPosition : new double[links.size()];
		return InverseKinematics.solve(this, target, start, config);
	}

	/** Position-only solve. */
	public double[] inverseKinematics(double[] targetPosition, double[] initialPosition) {
		return inverseKinematicsFrame(Transforms.frame(targetPosition, null), initialPosition, SolverConfig.defaults());
	}

	/**
	 * Solve for a position and the direction of one end-effector axis.
	 *
	 * @param axisDirection target direction of the axis selected by {@code mode}
	 * @param mode          X, Y or Z
	 */
	public double[] inverseKinematics(double[] targetPosition, double[] axisDirection, OrientationMode mode, double[] initialPosition) {
		Objects.requireNonNull(mode, "mode must not be null");
		if (mode.getColumn() < 0) {
			throw new IllegalArgumentException("A single axis direction needs mode X, Y or Z, not " + mode);
		}
		Objects.requireNonNull(axisDirection, "axisDirection must not be null");
		if (axisDirection.length != 3) {
			throw new IllegalArgumentException("axisDirection must have 3 components");
		}
		DMatrixRMaj target = Transforms.frame(targetPosition, null);
		for (int r = 0; r < 3; r++) {
			target.set(r, mode.getColumn(), axisDirection[r]);
		}
		return inverseKinematicsFrame(target, initialPosition, SolverConfig.defaults().withOrientationMode(mode));
	}

	/** Solve for a position and a full 3x3 orientation. */
	public double[] inverseKinematics(double[] targetPosition, DMatrixRMaj targetRotation, double[] initialPosition) {
		Objects.requireNonNull(targetRotation, "targetRotation must not be null");
		DMatrixRMaj target = Transforms.frame(targetPosition, targetRotation);
		return inverseKinematicsFrame(target, initialPosition, SolverConfig.defaults().withOrientationMode(OrientationMode.ALL));
	}

	private void checkLength(double[] joints) {
		Objects.requireNonNull(joints, "joints must not be null");
		if (joints.length != links.size()) {
			throw new IllegalArgumentException("Expected " + links.size() + " joint values but got " + joints.length);
		}
	}

	@Override
	public String toString() {
		return "Chain{name=" + name + ", links=" + links.size() + ", active=" + activeCount + "}";
	}
}
