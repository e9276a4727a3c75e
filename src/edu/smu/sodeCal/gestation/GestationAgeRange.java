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

package edu.smu.sodeCal.gestation;

// The gestation ages (in days) consistent with a measurement, both ends inclusive.
public final class GestationAgeRange {
	
	private final int minDay;
	private final int maxDay;

	public GestationAgeRange(int minDay, int maxDay) {
		if (minDay < 1) throw new IllegalArgumentException("Gestation age has to be at least one day, got " + minDay);
		if (minDay > maxDay) throw new IllegalArgumentException("Invalid gestation age range: minimum " + minDay + " exceeds maximum " + maxDay);
		this.minDay = minDay;
		this.maxDay = maxDay;
	}
	
	public int getMinDay() {
		return minDay;
	}
	
	public int getMaxDay() {
		return maxDay;
	}
	
	public int numDays() {
		return maxDay - minDay + 1;
	}
	
	public boolean contains(GestationAgeRange other) {
		return this.minDay <= other.minDay && other.maxDay <= this.maxDay;
	}
	
	@Override
	public boolean equals(Object o) {
		if (o == null || this.getClass() != o.getClass()) return false;
		GestationAgeRange other = (GestationAgeRange) o;
		return this.minDay == other.minDay && this.maxDay == other.maxDay;
	}
	
	@Override
	public int hashCode() {
		return 31 * minDay + maxDay;
	}
	
	public String toString() {
		return "[" + minDay + ", " + maxDay + "]";
	}
}
