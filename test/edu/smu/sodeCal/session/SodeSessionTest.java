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

package edu.smu.sodeCal.session;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import edu.smu.sodeCal.analysis.CombinedEstimate;
import edu.smu.sodeCal.analysis.IntervalAnalysis;
import edu.smu.sodeCal.calendar.DayInterval;
import edu.smu.sodeCal.calendar.DeathDateConvolver;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.gestation.GestationAgeResolver;
import edu.smu.sodeCal.gestation.SkeletalElement;
import edu.smu.sodeCal.prior.ConceptionCalendars;
import edu.smu.sodeCal.session.SodeSession.CombinedResult;

public class SodeSessionTest {
	
	private SodeSession session;
	
	@Before
	public void setUp() {
		session = new SodeSession(ConceptionCalendars.AGGREGATED_FETAL_SMOOTH.getPrior());
		session.addMeasured("tibia", new GestationAgeRange(100, 160));
		session.addMeasured("femur", new GestationAgeRange(140, 200));
		session.addMeasured("radius", new GestationAgeRange(250, 280));
	}
	
	@Test
	public void testMeasuredEntries() {
		assertEquals(3, session.size());
		Entry femur = session.getEntry(2);
		assertEquals(2, femur.getIndex());
		assertEquals("femur", femur.getLabel());
		assertFalse(femur.isCombined());
		assertEquals(DeathDateConvolver.convolve(session.getPrior(), new GestationAgeRange(140, 200)), femur.getCalendar());
		assertFalse(femur.getSegments().isEmpty());
	}
	
	@Test
	public void testCombine() {
		CombinedResult result = session.combine(2, 1, 2);
		assertTrue(result.isCombined());
		assertEquals(4, session.size());
		
		Entry combined = result.getEntry();
		assertEquals(4, combined.getIndex());
		assertTrue(combined.isCombined());
		assertArrayEquals(new int[] {1, 2}, combined.getSources().toArray());
		assertEquals("combined [entries 1, 2]", combined.getLabel());
		assertEquals(new GestationAgeRange(140, 160), combined.getRange());
		assertEquals(combined, session.getEntry(4));
	}
	
	@Test
	public void testEmptyIntersectionAppendsNothing() {
		CombinedResult result = session.combine(1, 3);
		assertFalse(result.isCombined());
		assertEquals(CombinedEstimate.Status.EMPTY_INTERSECTION, result.getEstimate().getStatus());
		assertNull(result.getEntry());
		assertArrayEquals(new int[] {1, 3}, result.getSources().toArray());
		assertEquals(3, session.size());
	}
	
	@Test
	public void testCombineCombined() {
		session.addMeasured("humerus", new GestationAgeRange(150, 155));
		Entry first = session.combine(1, 2).getEntry();
		Entry second = session.combine(first.getIndex(), 4).getEntry();
		assertEquals(6, second.getIndex());
		assertEquals(new GestationAgeRange(150, 155), second.getRange());
		assertEquals("combined [entries 4, 5]", second.getLabel());
	}
	
	@Test
	public void testCombineEqualRanges() {
		session.addMeasured("left tibia", new GestationAgeRange(50, 60));
		session.addMeasured("right tibia", new GestationAgeRange(50, 60));
		Entry combined = session.combine(4, 5).getEntry();
		assertEquals(DeathDateConvolver.convolve(session.getPrior(), new GestationAgeRange(50, 60)), combined.getCalendar());
		assertEquals(session.getEntry(4).getCalendar(), combined.getCalendar());
		
		Entry swapped = session.combine(5, 4).getEntry();
		assertEquals(combined.getCalendar(), swapped.getCalendar());
		assertEquals(combined.getLabel(), swapped.getLabel());
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testCombineSameEntry() {
		session.combine(1, 1);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testCombineUnknownEntry() {
		session.combine(1, 7);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testEntryZero() {
		session.getEntry(0);
	}
	
	@Test
	public void testAnalyzeInterval() {
		IntervalAnalysis some = session.analyzeInterval(new DayInterval(300, 60), 1, 2);
		assertEquals(2, some.numCalendars());
		assertEquals(IntervalAnalysis.QueryType.SAME_DAY_AND_WITHIN, some.getQueryType());
		
		IntervalAnalysis all = session.analyzeInterval(DayInterval.FULL_YEAR);
		assertEquals(3, all.numCalendars());
		assertEquals(1d, all.getAllWithinProbability(), 1e-9);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testAnalyzeNoEntries() {
		session.analyzeInterval(DayInterval.FULL_YEAR, new int[0]);
	}
	
	@Test
	public void testMeasuredThroughResolver() {
		GestationAgeResolver fixed = new GestationAgeResolver() {
			public GestationAgeRange resolve(SkeletalElement element, double depth) {
				return new GestationAgeRange(120, 130);
			}
		};
		Entry entry = session.addMeasured("humerus", SkeletalElement.HUMERUS, 4.2, fixed);
		assertEquals(4, entry.getIndex());
		assertEquals(new GestationAgeRange(120, 130), entry.getRange());
	}
}
