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

import edu.smu.sodeCal.utility.SumArray;

// A probability mass over the 365 days of a year. Days are 1-based and circular: day 365 is followed by day 1.
// Zero entries are exact zeros, segmentation relies on that.
public final class ProbabilityCalendar {
	
	public static final int DAYS_PER_YEAR = 365;
	
	private final double[] dayProbabilities;
	
	public ProbabilityCalendar(double[] dayProbabilities) {
		if (dayProbabilities.length != DAYS_PER_YEAR) {
			throw new IllegalArgumentException("A calendar needs " + DAYS_PER_YEAR + " days, got " + dayProbabilities.length);
		}
		for (int i = 0; i < dayProbabilities.length; i++) {
			if (!(dayProbabilities[i] >= 0d) || Double.isInfinite(dayProbabilities[i])) {
				throw new IllegalArgumentException("Invalid probability " + dayProbabilities[i] + " on day " + (i + 1));
			}
		}
		this.dayProbabilities = Arrays.copyOf(dayProbabilities, dayProbabilities.length);
	}
	
	public static ProbabilityCalendar zeroCalendar() {
		return new ProbabilityCalendar(new double[DAYS_PER_YEAR]);
	}
	
	static void checkDay(int day) {
		if (day < 1 || day > DAYS_PER_YEAR) {
			throw new IllegalArgumentException("Day " + day + " outside of 1.." + DAYS_PER_YEAR);
		}
	}
	
	public double getProbability(int day) {
		checkDay(day);
		return this.dayProbabilities[day - 1];
	}
	
	public double[] getProbabilities() {
		return Arrays.copyOf(this.dayProbabilities, this.dayProbabilities.length);
	}
	
	public double getTotalMass() {
		return SumArray.getSum(this.dayProbabilities);
	}
	
	public double getMass(DayInterval interval) {
		double mass = 0d;
		for (int day : interval.getDays()) {
			mass += this.dayProbabilities[day - 1];
		}
		return mass;
	}
	
	// first day with an exact zero, or -1 if there is none
	public int firstZeroDay() {
		for (int i = 0; i < DAYS_PER_YEAR; i++) {
			if (this.dayProbabilities[i] == 0d) return i + 1;
		}
		return -1;
	}
	
	public boolean isZero() {
		for (double p : this.dayProbabilities) {
			if (p != 0d) return false;
		}
		return true;
	}
	
	@Override
	public boolean equals(Object o) {
		if (o == null || this.getClass() != o.getClass()) return false;
		return Arrays.equals(this.dayProbabilities, ((ProbabilityCalendar) o).dayProbabilities);
	}
	
	@Override
	public int hashCode() {
		return Arrays.hashCode(this.dayProbabilities);
	}
}
