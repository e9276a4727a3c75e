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

package edu.smu.sodeCal.calendar;

import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.prior.ConceptionPrior;
import edu.smu.sodeCal.utility.SumArray;

// Turns a conception prior and a gestation age range into a death date distribution over the calendar year.
// Every gestation age in the range is taken to be equally likely, so the death date is the conception date
// shifted by each age in turn, summed, folded onto the year and normalized.
public class DeathDateConvolver {
	
	// anything at or below this is no mass at all
	public static final double MIN_TOTAL_MASS = Double.MIN_NORMAL;
	
	// largest gestation age for which the shifted prior still fits into the extended cycle
	public static int getMaxGestationAge(ConceptionPrior prior) {
		return CycleMapper.CYCLE_LENGTH - prior.length() + 1;
	}

	public static ProbabilityCalendar convolve(ConceptionPrior prior, GestationAgeRange range) {
		// the unnormalized death dates over the extended cycle
		double[] cycleMass = accumulate(prior, range);
		
		// onto the year
		double[] dayMass = CycleMapper.fold(cycleMass);
		
		double total = SumArray.getSum(dayMass);
		if (!(total > MIN_TOTAL_MASS) || Double.isInfinite(total)) {
			throw new NormalizationFailureException("Death date mass for gestation ages " + range + " cannot be normalized (total " + total + ").", total);
		}
		
		for (int i = 0; i < dayMass.length; i++) {
			dayMass[i] /= total;
		}
		
		return new ProbabilityCalendar(dayMass);
	}
	
	// the conception prior shifted by every gestation age in the range and summed up, index i is cycle position i+1
	public static double[] accumulate(ConceptionPrior prior, GestationAgeRange range) {
		int maxAge = getMaxGestationAge(prior);
		if (range.getMaxDay() > maxAge) {
			throw new IllegalArgumentException("Gestation age " + range.getMaxDay() + " exceeds the reproductive cycle (at most " + maxAge + " days).");
		}
		
		double[] priorMass = prior.getProbabilities();
		double[] cycleMass = new double[CycleMapper.CYCLE_LENGTH];
		
		for (int age = range.getMinDay(); age <= range.getMaxDay(); age++) {
			// gestation age 1 means death on the day of conception
			int offset = age - 1;
			for (int i = 0; i < priorMass.length; i++) {
				cycleMass[offset + i] += priorMass[i];
			}
		}
		
		return cycleMass;
	}
}
