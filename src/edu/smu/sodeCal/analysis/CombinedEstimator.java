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

package edu.smu.sodeCal.analysis;

import java.util.Collection;

import edu.smu.sodeCal.calendar.DeathDateConvolver;
import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.prior.ConceptionPrior;

// Elements deposited with a single fetus share one gestation age, so it has to lie in every one of their
// ranges. The intersection of the ranges is convolved again with the conception prior.
public class CombinedEstimator {

	public static CombinedEstimate estimate(ConceptionPrior prior, Collection<GestationAgeRange> ranges) {
		if (ranges.size() < 2) throw new IllegalArgumentException("Combining needs at least two gestation age ranges, got " + ranges.size());
		
		int lowDay = Integer.MIN_VALUE;
		int highDay = Integer.MAX_VALUE;
		for (GestationAgeRange range : ranges) {
			lowDay = Math.max(lowDay, range.getMinDay());
			highDay = Math.min(highDay, range.getMaxDay());
		}
		
		if (lowDay > highDay) {
			return new CombinedEstimate(CombinedEstimate.Status.EMPTY_INTERSECTION, lowDay, highDay, ProbabilityCalendar.zeroCalendar());
		}
		
		ProbabilityCalendar combined = DeathDateConvolver.convolve(prior, new GestationAgeRange(lowDay, highDay));
		return new CombinedEstimate(CombinedEstimate.Status.COMBINED, lowDay, highDay, combined);
	}
}
