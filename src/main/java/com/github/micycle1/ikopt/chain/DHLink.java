package com.github.micycle1.ikopt.chain;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.ikopt.optim.Bound;

/**
 * Revolute link described by classic Denavit-Hartenberg parameters. The joint
 * value is added to {@code thetaOffset}.
 */
public final class DHLink extends Link {

	private final double d;
	private final double a;
	private final double alpha;
	private final double thetaOffset;

	public DHLink(String name, double d, double a, double alpha, double thetaOffset, Bound bounds) {
		super(name, bounds);
		this.d = d;
		this.a = a;
		this.alpha = alpha;
		this.thetaOffset = thetaOffset;
	}

	public DHLink(String name, double d, double a, double alpha) {
		this(name, d, a, alpha, 0.0, Bound.UNBOUNDED);
	}

	@Override
	public boolean isActive() {
		return true;
	}

	@Override
	public DMatrixRMaj transform(double q) {
		double theta = thetaOffset + q;
		double ct = Math.cos(theta), st = Math.sin(theta);
		double ca = Math.cos(alpha), sa = Math.sin(alpha);

		// Rz(theta) * Tz(d) * Tx(a) * Rx(alpha)
		DMatrixRMaj m = new DMatrixRMaj(4, 4);
		m.set(0, 0, ct);
		m.set(0, 1, -st * ca);
		m.set(0, 2, st * sa);
		m.set(0, 3, a * ct);
		m.set(1, 0, st);
		m.set(1, 1, ct * ca);
		m.set(1, 2, -ct * sa);
		m.set(1, 3, a * st);
		m.set(2, 1, sa);
		m.set(2, 2, ca);
		m.set(2, 3, d);
		m.set(3, 3, 1.0);
		return m;
	}
}
