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

import edu.smu.sodeCal.calendar.ProbabilityCalendar;

// Month and day labels for the days of a non-leap year.
public class CalendarDates {
	
	private static final String[] MONTH_NAMES = {"Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"};
	private static final int[] MONTH_LENGTHS = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
	
	// [day] -> month index, day of month; day 0 unused
	private static final int[] DAY_TO_MONTH = new int[ProbabilityCalendar.DAYS_PER_YEAR + 1];
	private static final int[] DAY_TO_DAY_OF_MONTH = new int[ProbabilityCalendar.DAYS_PER_YEAR + 1];
	
	static {
		int day = 1;
		for (int m = 0; m < MONTH_LENGTHS.length; m++) {
			for (int d = 1; d <= MONTH_LENGTHS[m]; d++) {
				DAY_TO_MONTH[day] = m;
				DAY_TO_DAY_OF_MONTH[day] = d;
				day++;
			}
		}
		assert (day == ProbabilityCalendar.DAYS_PER_YEAR + 1);
	}
	
	public static String getMonthName(int day) {
		checkDay(day);
		return MONTH_NAMES[DAY_TO_MONTH[day]];
	}
	
	public static int getDayOfMonth(int day) {
		checkDay(day);
		return DAY_TO_DAY_OF_MONTH[day];
	}
	
	public static String format(int day) {
		return getMonthName(day) + " " + getDayOfMonth(day);
	}
	
	private static void checkDay(int day) {
		if (day < 1 || day > ProbabilityCalendar.DAYS_PER_YEAR) throw new IllegalArgumentException("Day of year must be in [1, " + ProbabilityCalendar.DAYS_PER_YEAR + "], got " + day);
	}
}
