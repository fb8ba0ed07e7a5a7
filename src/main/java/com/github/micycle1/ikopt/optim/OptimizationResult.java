package com.github.micycle1.ikopt.optim;

import java.util.Arrays;

public final class OptimizationResult {

	private final double[] solution;
	private final double value;
	private final int iterations;
	private final int evaluations;
	private final boolean converged;
	private final String message;

	public OptimizationResult(double[] solution, double value, int iterations, int evaluations, boolean converged, String message) {
		this.solution = solution.clone();
		this.value = value;
		this.iterations = iterations;
		this.evaluations = evaluations;
		this.converged = converged;
		this.message = message;
	}

	/** Best point found; a fresh copy on each call. */
	public double[] getSolution() {
		return solution.clone();
	}

	public double getValue() {
		return value;
	}

	public int getIterations() {
		return iterations;
	}

	/** Number of objective evaluations, including any spent on building models. */
	public int getEvaluations() {
		return evaluations;
	}

	public boolean isConverged() {
		return converged;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("OptimizationResult{");
		sb.append("solution=").append(Arrays.toString(solution)).append(", ");
		sb.append("value=").append(value).append(", ");
		sb.append("iterations=").append(iterations).append(", ");
		sb.append("evaluations=").append(evaluations).append(", ");
		sb.append("converged=").append(converged).append(", ");
		sb.append("message=").append(message);
		sb.append("}");
		return sb.toString();
	}
}
