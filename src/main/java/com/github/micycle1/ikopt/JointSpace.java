package com.github.micycle1.ikopt;

import java.util.Objects;

import com.github.micycle1.ikopt.chain.Chain;
import com.github.micycle1.ikopt.optim.Bound;

/**
 * Conversions between full joint vectors (one value per link) and active
 * joint vectors (one value per optimized link), and the matching reduction of
 * joint bounds. Both directions follow the chain's active mask, so entry
 * {@code k} of an active vector always belongs to the k-th active link.
 */
public final class JointSpace {

	private JointSpace() {
	}

	/** Values of the active links of {@code full}, in link order. */
	public static double[] reduce(Chain chain, double[] full) {
		checkFull(chain, full);
		double[] active = new double[chain.getActiveCount()];
		int k = 0;
		for (int i = 0; i < full.length; i++) {
			if (chain.isActive(i)) {
				active[k++] = full[i];
			}
		}
		return active;
	}

	/**
	 * Copy of {@code full} with its active entries replaced, in order, by
	 * {@code active}. {@code full} is not modified.
	 */
	public static double[] merge(Chain chain, double[] active, double[] full) {
		checkFull(chain, full);
		Objects.requireNonNull(active, "active must not be null");
		if (active.length != chain.getActiveCount()) {
			throw new IllegalArgumentException("Expected " + chain.getActiveCount() + " active values but got " + active.length);
		}
		double[] out = full.clone();
		int k = 0;
		for (int i = 0; i < out.length; i++) {
			if (chain.isActive(i)) {
				out[i] = active[k++];
			}
		}
		return out;
	}

	/** One bound per active link, in the same order as {@link #reduce}. */
	public static Bound[] reduceBounds(Chain chain) {
		Objects.requireNonNull(chain, "chain must not be null");
		Bound[] bounds = new Bound[chain.getActiveCount()];
		int k = 0;
		for (int i = 0; i < chain.size(); i++) {
			if (chain.isActive(i)) {
				bounds[k++] = chain.getLink(i).getBounds();
			}
		}
		return bounds;
	}

	private static void checkFull(Chain chain, double[] full) {
		Objects.requireNonNull(chain, "chain must not be null");
		Objects.requireNonNull(full, "full must not be null");
		if (full.length != chain.size()) {
			throw new IllegalArgumentException("Expected " + chain.size() + " joint values but got " + full.length);
		}
	}
}
