package com.github.micycle1.ikopt.chain;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.optim.Bound;

/** Fixed base frame of a chain. */
public final class OriginLink extends Link {

	public OriginLink() {
		this("Base link");
	}

	public OriginLink(String name) {
		super(name, Bound.UNBOUNDED);
	}

	@Override
	public boolean isActive() {
		return false;
	}

	@Override
	public DMatrixRMaj transform(double q) {
		return Transforms.identity();
	}
}
