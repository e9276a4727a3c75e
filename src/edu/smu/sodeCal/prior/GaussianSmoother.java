 /*
    This file is part of sodeCal.

    sodeCal is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    sodeCal is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with sodeCal.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.smu.sodeCal.prior;

import org.apache.commons.math3.util.MathArrays;

// Gaussian moving window. Positions where the window does not fit completely are set to zero.
public class GaussianSmoother {
	
	// three weeks
	public static final int DEFAULT_WINDOW = 21;
	public static final double DEFAULT_ALPHA = 2.5;
	
	private final double[] weights;
	
	public GaussianSmoother() {
		this(DEFAULT_WINDOW, DEFAULT_ALPHA);
	}
	
	public GaussianSmoother(int window, double alpha) {
		if (window < 1) throw new IllegalArgumentException("Window has to contain at least one position.");
		this.weights = makeWindow(window, Math.abs(alpha));
	}
	
	private static double[] makeWindow(int window, double alpha) {
		double halfWidth = window / 2.0;
		double[] w = new double[window];
		for (int i = 0; i < window; i++) {
			int n = i - (int) halfWidth;
			double k = alpha * n / halfWidth;
			w[i] = Math.exp(-0.5 * k * k);
		}
		return MathArrays.normalizeArray(w, 1d);
	}
	
	public double[] getWeights() {
		return weights.clone();
	}
	
	public double[] smooth(double[] values) {
		int leftHalf = this.weights.length / 2;
		double[] smoothed = new double[values.length];
		
		for (int i = 0; i < values.length; i++) {
			int first = i - leftHalf;
			int last = first + this.weights.length - 1;
			if (first < 0 || last >= values.length) {
				// no tails
				smoothed[i] = 0d;
				continue;
			}
			double total = 0d;
			for (int j = 0; j < this.weights.length; j++) {
				total += values[first + j] * this.weights[j];
			}
			smoothed[i] = total;
		}
		return smoothed;
	}
	
	// smoothed and back to a probability mass
	public double[] smoothDistribution(double[] probabilities) {
		return MathArrays.normalizeArray(this.smooth(probabilities), 1d);
	}
}
