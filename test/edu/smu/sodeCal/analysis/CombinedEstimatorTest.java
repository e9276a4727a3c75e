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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import edu.smu.sodeCal.calendar.DeathDateConvolver;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.prior.ConceptionCalendars;
import edu.smu.sodeCal.prior.ConceptionPrior;

public class CombinedEstimatorTest {
	
	private final ConceptionPrior prior = ConceptionCalendars.YNP_SMOOTH.getPrior();

	@Test
	public void testOverlappingRanges() {
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, Arrays.asList(new GestationAgeRange(10, 50), new GestationAgeRange(30, 80)));
		assertEquals(CombinedEstimate.Status.COMBINED, estimate.getStatus());
		assertEquals(new GestationAgeRange(30, 50), estimate.getRange());
		assertEquals(DeathDateConvolver.convolve(prior, new GestationAgeRange(30, 50)), estimate.getCalendar());
	}
	
	@Test
	public void testOrderDoesNotMatter() {
		GestationAgeRange a = new GestationAgeRange(100, 180);
		GestationAgeRange b = new GestationAgeRange(120, 200);
		GestationAgeRange c = new GestationAgeRange(90, 150);
		CombinedEstimate forward = CombinedEstimator.estimate(prior, Arrays.asList(a, b, c));
		CombinedEstimate backward = CombinedEstimator.estimate(prior, Arrays.asList(c, b, a));
		assertEquals(forward.getRange(), backward.getRange());
		assertEquals(forward.getCalendar(), backward.getCalendar());
		assertEquals(new GestationAgeRange(120, 150), forward.getRange());
		for (GestationAgeRange range : Arrays.asList(a, b, c)) assertTrue(range.contains(forward.getRange()));
	}
	
	@Test
	public void testTouchingRanges() {
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, Arrays.asList(new GestationAgeRange(10, 20), new GestationAgeRange(20, 30)));
		assertTrue(estimate.isCombined());
		assertEquals(new GestationAgeRange(20, 20), estimate.getRange());
	}
	
	@Test
	public void testDisjointRanges() {
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, Arrays.asList(new GestationAgeRange(10, 20), new GestationAgeRange(30, 40)));
		assertEquals(CombinedEstimate.Status.EMPTY_INTERSECTION, estimate.getStatus());
		assertFalse(estimate.isCombined());
		assertEquals(30, estimate.getLowDay());
		assertEquals(20, estimate.getHighDay());
		assertNull(estimate.getRange());
		assertTrue(estimate.getCalendar().isZero());
	}
	
	@Test
	public void testSelfConsistentCombination() {
		GestationAgeRange range = new GestationAgeRange(50, 60);
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, Arrays.asList(range, new GestationAgeRange(50, 60)));
		assertTrue(estimate.isCombined());
		assertEquals(range, estimate.getRange());
		assertEquals(DeathDateConvolver.convolve(prior, range), estimate.getCalendar());
	}
	
	@Test
	public void testCombineIdempotent() {
		GestationAgeRange a = new GestationAgeRange(40, 90);
		GestationAgeRange b = new GestationAgeRange(70, 120);
		CombinedEstimate first = CombinedEstimator.estimate(prior, Arrays.asList(a, b));
		CombinedEstimate again = CombinedEstimator.estimate(prior, Arrays.asList(a, b));
		CombinedEstimate swapped = CombinedEstimator.estimate(prior, Arrays.asList(b, a));
		assertEquals(first.getCalendar(), again.getCalendar());
		assertEquals(first.getCalendar(), swapped.getCalendar());
		
		// fusing the result with its own intersection changes nothing
		CombinedEstimate refused = CombinedEstimator.estimate(prior, Arrays.asList(first.getRange(), a, b));
		assertEquals(first.getCalendar(), refused.getCalendar());
	}
	
	@Test
	public void testFarApartRanges() {
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, Arrays.asList(new GestationAgeRange(1, 50), new GestationAgeRange(100, 150)));
		assertEquals(CombinedEstimate.Status.EMPTY_INTERSECTION, estimate.getStatus());
		assertEquals(100, estimate.getLowDay());
		assertEquals(50, estimate.getHighDay());
		assertTrue(estimate.getCalendar().isZero());
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testSingleRange() {
		CombinedEstimator.estimate(prior, Collections.singletonList(new GestationAgeRange(10, 20)));
	}
}
