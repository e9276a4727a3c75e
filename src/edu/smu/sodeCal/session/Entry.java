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

import java.util.Collections;
import java.util.List;

import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.calendar.SegmentFinder;
import edu.smu.sodeCal.calendar.SegmentFinder.Segment;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

// One estimated death date distribution, either from a measured element or combined from earlier entries.
public class Entry {
	
	private final int index;
	private final String label;
	private final GestationAgeRange range;
	private final ProbabilityCalendar calendar;
	private final List<Segment> segments;
	// indices of the entries this one was combined from, empty for measured entries
	private final TIntList sources;
	
	Entry(int index, String label, GestationAgeRange range, ProbabilityCalendar calendar, TIntList sources) {
		this.index = index;
		this.label = label;
		this.range = range;
		this.calendar = calendar;
		this.segments = Collections.unmodifiableList(SegmentFinder.findSegments(calendar));
		this.sources = new TIntArrayList(sources);
	}
	
	// 1-based position in the session
	public int getIndex() {
		return index;
	}
	
	public String getLabel() {
		return label;
	}
	
	public GestationAgeRange getRange() {
		return range;
	}
	
	public ProbabilityCalendar getCalendar() {
		return calendar;
	}
	
	public List<Segment> getSegments() {
		return segments;
	}
	
	public TIntList getSources() {
		return new TIntArrayList(sources);
	}
	
	public boolean isCombined() {
		return !sources.isEmpty();
	}
	
	@Override
	public String toString() {
		return index + ": " + label + " " + range;
	}
}
