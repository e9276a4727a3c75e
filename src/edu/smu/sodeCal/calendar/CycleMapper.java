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

import java.util.Arrays;

// Maps the extended reproductive cycle (first possible conception on June 1 through the
// last possible birth) onto the 365 days of a calendar year. The cycle is longer than a year,
// so the days from June 1 to December 31 occur twice in it.
public class CycleMapper {

	// number of positions in the extended cycle
	public static final int CYCLE_LENGTH = 579;
	// calendar day of the first cycle position (June 1)
	public static final int CYCLE_START_DAY = 152;
	
	// cycle position (1-based) -> calendar day (1-based), slot 0 unused
	private static final int[] CYCLE_TO_DAY = buildCycleToDay();
	// calendar day (1-based) -> all cycle positions (1-based, ascending) on that day, slot 0 unused
	private static final int[][] DAY_TO_CYCLE = buildDayToCycle(CYCLE_TO_DAY);
	
	private static int[] buildCycleToDay() {
		int[] table = new int[CYCLE_LENGTH + 1];
		for (int pos = 1; pos <= CYCLE_LENGTH; pos++) {
			table[pos] = ((CYCLE_START_DAY - 1 + pos - 1) % ProbabilityCalendar.DAYS_PER_YEAR) + 1;
		}
		return table;
	}
	
	private static int[][] buildDayToCycle(int[] cycleToDay) {
		// count first
		int[] counts = new int[ProbabilityCalendar.DAYS_PER_YEAR + 1];
		for (int pos = 1; pos <= CYCLE_LENGTH; pos++) {
			counts[cycleToDay[pos]]++;
		}
		
		int[][] table = new int[ProbabilityCalendar.DAYS_PER_YEAR + 1][];
		table[0] = new int[0];
		for (int day = 1; day <= ProbabilityCalendar.DAYS_PER_YEAR; day++) {
			table[day] = new int[counts[day]];
		}
		
		// and fill in ascending position order
		int[] filled = new int[ProbabilityCalendar.DAYS_PER_YEAR + 1];
		for (int pos = 1; pos <= CYCLE_LENGTH; pos++) {
			int day = cycleToDay[pos];
			table[day][filled[day]++] = pos;
		}
		return table;
	}
	
	public static int getCalendarDay(int cyclePosition) {
		if (cyclePosition < 1 || cyclePosition > CYCLE_LENGTH) {
			throw new IllegalArgumentException("Cycle position " + cyclePosition + " outside of 1.." + CYCLE_LENGTH);
		}
		return CYCLE_TO_DAY[cyclePosition];
	}
	
	public static int[] getCyclePositions(int day) {
		ProbabilityCalendar.checkDay(day);
		return Arrays.copyOf(DAY_TO_CYCLE[day], DAY_TO_CYCLE[day].length);
	}
	
	// folds values over the extended cycle (0-based array, index = position - 1) onto the year
	// every day is the sum of its positions, added in ascending position order
	public static double[] fold(double[] cycleValues) {
		if (cycleValues.length != CYCLE_LENGTH) {
			throw new IllegalArgumentException("Expected " + CYCLE_LENGTH + " cycle values, got " + cycleValues.length);
		}
		
		double[] dayValues = new double[ProbabilityCalendar.DAYS_PER_YEAR];
		for (int day = 1; day <= ProbabilityCalendar.DAYS_PER_YEAR; day++) {
			double total = 0d;
			for (int pos : DAY_TO_CYCLE[day]) {
				total += cycleValues[pos - 1];
			}
			dayValues[day - 1] = total;
		}
		return dayValues;
	}
}
