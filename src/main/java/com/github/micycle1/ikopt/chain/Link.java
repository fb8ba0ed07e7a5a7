package com.github.micycle1.ikopt.chain;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.optim.Bound;

/**
 * One link of a kinematic chain: the transform from the previous link's frame
 * to this one, parameterized by a single joint value.
 */
public abstract class Link {

	private final String name;
	private final Bound bounds;

	protected Link(String name, Bound bounds) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
	}

	public String getName() {
		return name;
	}

	/** Joint limits; open sides are infinite. */
	public Bound getBounds() {
		return bounds;
	}

	/** False for links whose transform ignores the joint value. */
	public abstract boolean isActive();

	/** Local 4x4 transform for joint value q. Returns a new matrix. */
	public abstract DMatrixRMaj transform(double q);

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{name=" + name + ", bounds=" + bounds + ", active=" + isActive() + "}";
	}
}
