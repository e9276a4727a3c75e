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

// A closed interval of calendar days. If the start day comes after the end day, the interval
// runs through the turn of the year: start..365, then 1..end.
public class DayInterval {
	
	public static final DayInterval FULL_YEAR = new DayInterval(1, ProbabilityCalendar.DAYS_PER_YEAR);
	
	// the values
	public final int startDay;
	public final int endDay;

	public DayInterval(int startDay, int endDay) {
		ProbabilityCalendar.checkDay(startDay);
		ProbabilityCalendar.checkDay(endDay);
		this.startDay = startDay;
		this.endDay = endDay;
	}
	
	public boolean wraps() {
		return this.startDay > this.endDay;
	}
	
	public boolean isFullYear() {
		return this.startDay == 1 && this.endDay == ProbabilityCalendar.DAYS_PER_YEAR;
	}
	
	public int numDays() {
		if (!this.wraps()) return this.endDay - this.startDay + 1;
		return ProbabilityCalendar.DAYS_PER_YEAR - this.startDay + 1 + this.endDay;
	}
	
	public boolean contains(int day) {
		if (!this.wraps()) return day >= this.startDay && day <= this.endDay;
		return day >= this.startDay || day <= this.endDay;
	}
	
	// the days in walking order
	public int[] getDays() {
		int[] days = new int[this.numDays()];
		int day = this.startDay;
		for (int i = 0; i < days.length; i++) {
			days[i] = day;
			day = (day == ProbabilityCalendar.DAYS_PER_YEAR) ? 1 : day + 1;
		}
		return days;
	}
	
	@Override
	public boolean equals(Object o) {
		if (o == null || this.getClass() != o.getClass()) return false;
		DayInterval other = (DayInterval) o;
		return this.startDay == other.startDay && this.endDay == other.endDay;
	}
	
	@Override
	public int hashCode() {
		return 31 * this.startDay + this.endDay;
	}
	
	// just for debug
	public String toString () {
		return "[" + this.startDay + ", " + this.endDay + "]";
	}
}
