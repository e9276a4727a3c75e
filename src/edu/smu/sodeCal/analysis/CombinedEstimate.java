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

import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.gestation.GestationAgeRange;

// Outcome of fusing several gestation age ranges believed to describe the same death.
public class CombinedEstimate {
	
	public static enum Status {COMBINED, EMPTY_INTERSECTION};
	
	private final Status status;
	// intersection bounds, lowDay > highDay if the ranges do not overlap
	private final int lowDay;
	private final int highDay;
	private final ProbabilityCalendar calendar;
	
	CombinedEstimate(Status status, int lowDay, int highDay, ProbabilityCalendar calendar) {
		assert ((status == Status.COMBINED) == (lowDay <= highDay));
		this.status = status;
		this.lowDay = lowDay;
		this.highDay = highDay;
		this.calendar = calendar;
	}
	
	public Status getStatus() {
		return status;
	}
	
	public boolean isCombined() {
		return status == Status.COMBINED;
	}
	
	public int getLowDay() {
		return lowDay;
	}
	
	public int getHighDay() {
		return highDay;
	}
	
	// null for an empty intersection
	public GestationAgeRange getRange() {
		return this.isCombined() ? new GestationAgeRange(lowDay, highDay) : null;
	}
	
	// all zero for an empty intersection
	public ProbabilityCalendar getCalendar() {
		return calendar;
	}
}
