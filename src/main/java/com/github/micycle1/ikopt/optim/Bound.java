package com.github.micycle1.ikopt.optim;

/**
 * Closed interval [lower, upper] for a single optimization variable. Either
 * side may be open, in which case it holds the matching infinity.
 */
public final class Bound {

	/** A variable with no limit on either side. */
	public static final Bound UNBOUNDED = new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

	private final double lower;
	private final double upper;

	private Bound(double lower, double upper) {
		this.lower = lower;
		this.upper = upper;
	}

	public static Bound of(double lower, double upper) {
		return new Bound(lower, upper);
	}

	public static Bound atLeast(double lower) {
		return new Bound(lower, Double.POSITIVE_INFINITY);
	}

	public static Bound atMost(double upper) {
		return new Bound(Double.NEGATIVE_INFINITY, upper);
	}

	public double getLower() {
		return lower;
	}

	public double getUpper() {
		return upper;
	}

	public boolean hasLower() {
		return lower != Double.NEGATIVE_INFINITY;
	}

	public boolean hasUpper() {
		return upper != Double.POSITIVE_INFINITY;
	}

	public boolean contains(double v) {
		return v >= lower && v <= upper;
	}

	/** Nearest value to v inside this interval. */
	public double clip(double v) {
		if (v < lower) {
			return lower;
		}
		if (v > upper) {
			return upper;
		}
		return v;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Bound)) {
			return false;
		}
		Bound b = (Bound) o;
		return Double.compare(lower, b.lower) == 0 && Double.compare(upper, b.upper) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(lower) + Double.hashCode(upper);
	}

	@Override
	public String toString() {
		return "[" + lower + ", " + upper + "]";
	}
}
