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

package edu.smu.sodeCal.report;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class CalendarDatesTest {

	@Test
	public void testFormat() {
		assertEquals("Jan 1", CalendarDates.format(1));
		assertEquals("Jan 31", CalendarDates.format(31));
		assertEquals("Feb 28", CalendarDates.format(59));
		assertEquals("Mar 1", CalendarDates.format(60));
		assertEquals("Jun 1", CalendarDates.format(152));
		assertEquals("Dec 31", CalendarDates.format(365));
	}
	
	@Test
	public void testParts() {
		assertEquals("Sep", CalendarDates.getMonthName(244));
		assertEquals(1, CalendarDates.getDayOfMonth(244));
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testDayZero() {
		CalendarDates.format(0);
	}
}
