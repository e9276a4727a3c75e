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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class CycleMapperTest {

	@Test
	public void testBoundaryPositions() {
		assertEquals(152, CycleMapper.getCalendarDay(1));
		assertEquals(365, CycleMapper.getCalendarDay(214));
		assertEquals(1, CycleMapper.getCalendarDay(215));
		assertEquals(151, CycleMapper.getCalendarDay(365));
		assertEquals(152, CycleMapper.getCalendarDay(366));
		assertEquals(365, CycleMapper.getCalendarDay(579));
	}
	
	@Test
	public void testPositionsPerDay() {
		int doubleDays = 0;
		for (int day = 1; day <= ProbabilityCalendar.DAYS_PER_YEAR; day++) {
			int[] positions = CycleMapper.getCyclePositions(day);
			assertEquals(true, positions.length == 1 || positions.length == 2);
			for (int pos : positions) assertEquals(day, CycleMapper.getCalendarDay(pos));
			if (positions.length == 2) doubleDays++;
		}
		assertEquals(214, doubleDays);
		assertArrayEquals(new int[] {1, 366}, CycleMapper.getCyclePositions(152));
		assertArrayEquals(new int[] {215}, CycleMapper.getCyclePositions(1));
	}
	
	@Test
	public void testFold() {
		double[] ones = new double[CycleMapper.CYCLE_LENGTH];
		for (int i = 0; i < ones.length; i++) ones[i] = 1d;
		double[] folded = CycleMapper.fold(ones);
		
		assertEquals(ProbabilityCalendar.DAYS_PER_YEAR, folded.length);
		assertEquals(2d, folded[152 - 1], 0d);
		assertEquals(2d, folded[365 - 1], 0d);
		assertEquals(1d, folded[1 - 1], 0d);
		assertEquals(1d, folded[151 - 1], 0d);
		
		double total = 0d;
		for (double v : folded) total += v;
		assertEquals(CycleMapper.CYCLE_LENGTH, total, 0d);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testPositionZero() {
		CycleMapper.getCalendarDay(0);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testPositionBeyondCycle() {
		CycleMapper.getCalendarDay(CycleMapper.CYCLE_LENGTH + 1);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testFoldWrongLength() {
		CycleMapper.fold(new double[ProbabilityCalendar.DAYS_PER_YEAR]);
	}
}
