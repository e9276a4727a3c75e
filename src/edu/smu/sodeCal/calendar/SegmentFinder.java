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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

// Finds the maximal runs of days with positive probability on a calendar.
// The scan starts on a day with zero probability, so a run through the turn of the year needs no special handling.
public class SegmentFinder {
	
	private static enum ScanState {OUTSIDE_RUN, INSIDE_RUN};
	
	/// a run of positive probability, wraps through Dec 31 if highDay < lowDay
	public static class Segment {
		
		public Segment(int lowDay, int highDay, double mass) {
			this.lowDay = lowDay;
			this.highDay = highDay;
			this.mass = mass;
		}
		
		public boolean wraps() {
			return this.highDay < this.lowDay;
		}
		
		public DayInterval toInterval() {
			return new DayInterval(this.lowDay, this.highDay);
		}
		
		public int numDays() {
			return this.toInterval().numDays();
		}
		
		public String toString () {
			return "[" + this.lowDay + ", " + this.highDay + "]: " + this.mass;
		}
		
		public final int lowDay;
		public final int highDay;
		public final double mass;
	}

	public static List<Segment> findSegments(ProbabilityCalendar calendar) {
		
		double[] probs = calendar.getProbabilities();
		int numDays = probs.length;
		
		int zeroDay = calendar.firstZeroDay();
		
		// no zero anywhere, so the whole year is one segment
		if (zeroDay == -1) {
			return Collections.singletonList(new Segment(1, numDays, calendar.getTotalMass()));
		}
		
		List<Segment> segments = new ArrayList<Segment>();
		
		ScanState state = ScanState.OUTSIDE_RUN;
		int runStart = -1;
		double runMass = 0d;
		
		// walk once around the year, starting at the zero
		int zeroIdx = zeroDay - 1;
		for (int step = 0; step < numDays; step++) {
			int idx = (zeroIdx + step) % numDays;
			boolean positive = probs[idx] > 0d;
			
			if (state == ScanState.OUTSIDE_RUN && positive) {
				state = ScanState.INSIDE_RUN;
				runStart = idx;
				runMass = probs[idx];
			}
			else if (state == ScanState.INSIDE_RUN && positive) {
				runMass += probs[idx];
			}
			else if (state == ScanState.INSIDE_RUN) {
				// previous day closed the run
				int runEnd = (idx + numDays - 1) % numDays;
				segments.add(new Segment(runStart + 1, runEnd + 1, runMass));
				state = ScanState.OUTSIDE_RUN;
			}
		}
		
		// a run reaching the day before the zero
		if (state == ScanState.INSIDE_RUN) {
			int runEnd = (zeroIdx + numDays - 1) % numDays;
			segments.add(new Segment(runStart + 1, runEnd + 1, runMass));
		}
		
		assert (segments.size() <= (numDays + 1) / 2);
		
		// a run starting on Jan 1 is only closed at the end of the walk
		Collections.sort(segments, new Comparator<Segment>() {
			public int compare(Segment s1, Segment s2) {
				return Integer.compare(s1.lowDay, s2.lowDay);
			}
		});
		
		return segments;
	}
}
