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

import java.util.Arrays;

import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.Precision;

import edu.smu.sodeCal.utility.SumArray;

/**
 * Prior probability of the day gestation began. Position 1 is June 1, position 245 is January 31.
 * The values are not required to sum to one; a prior without mass fails when it is convolved.
 */
public final class ConceptionPrior {
	
	public static final int LENGTH = 245;
	
	private final String name;
	private final double[] dayProbabilities;
	
	public ConceptionPrior(String name, double[] dayProbabilities) {
		if (dayProbabilities.length != LENGTH) {
			throw new IllegalArgumentException("A conception prior needs " + LENGTH + " days, got " + dayProbabilities.length);
		}
		for (int i = 0; i < dayProbabilities.length; i++) {
			if (!(dayProbabilities[i] >= 0d) || Double.isInfinite(dayProbabilities[i])) {
				throw new IllegalArgumentException("Invalid conception probability " + dayProbabilities[i] + " at position " + (i + 1));
			}
		}
		this.name = name;
		this.dayProbabilities = Arrays.copyOf(dayProbabilities, dayProbabilities.length);
	}
	
	/**
	 * Scales raw observation counts (or any nonnegative weights) to a probability mass.
	 */
	public static ConceptionPrior fromWeights(String name, double[] weights) {
		return new ConceptionPrior(name, MathArrays.normalizeArray(weights, 1d));
	}
	
	public String getName() {
		return name;
	}
	
	public int length() {
		return this.dayProbabilities.length;
	}
	
	public double getProbability(int position) {
		if (position < 1 || position > LENGTH) {
			throw new IllegalArgumentException("Position " + position + " outside of 1.." + LENGTH);
		}
		return this.dayProbabilities[position - 1];
	}
	
	public double[] getProbabilities() {
		return Arrays.copyOf(this.dayProbabilities, this.dayProbabilities.length);
	}
	
	public double getTotalMass() {
		return SumArray.getSum(this.dayProbabilities);
	}
	
	public boolean isNormalized(double epsilon) {
		return Precision.equals(this.getTotalMass(), 1d, epsilon);
	}
	
	public String toString() {
		return this.name;
	}
}
