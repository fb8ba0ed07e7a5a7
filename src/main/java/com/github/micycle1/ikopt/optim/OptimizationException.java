package com.github.micycle1.ikopt.optim;

/**
 * Raised by an optimizer that cannot run on the problem it was given, e.g.
 * malformed bounds or an objective that is not finite at the initial guess.
 * Running out of iterations is not reported this way.
 */
public class OptimizationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public OptimizationException(String message) {
		super(message);
	}

	public OptimizationException(String message, Throwable cause) {
		super(message, cause);
	}
}
