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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.smu.sodeCal.analysis.CombinedEstimate;
import edu.smu.sodeCal.analysis.CombinedEstimator;
import edu.smu.sodeCal.analysis.IntervalAnalysis;
import edu.smu.sodeCal.analysis.IntervalAnalyzer;
import edu.smu.sodeCal.calendar.DayInterval;
import edu.smu.sodeCal.calendar.DeathDateConvolver;
import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.gestation.GestationAgeResolver;
import edu.smu.sodeCal.gestation.SkeletalElement;
import edu.smu.sodeCal.prior.ConceptionPrior;
import edu.smu.sodeCal.utility.CollectionFormat;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

/**
 * Ordered collection of death date estimates that all use the same conception prior.
 * Entries are numbered from 1 in the order they were added; combined estimates are appended
 * and can themselves be combined again.
 * 
 * Not thread safe.
 */
public class SodeSession {
	
	private final ConceptionPrior prior;
	private final List<Entry> entries = new ArrayList<Entry>();
	
	public SodeSession(ConceptionPrior prior) {
		if (prior == null) throw new IllegalArgumentException("A session needs a conception prior.");
		this.prior = prior;
	}
	
	public ConceptionPrior getPrior() {
		return prior;
	}
	
	public Entry addMeasured(String label, GestationAgeRange range) {
		ProbabilityCalendar calendar = DeathDateConvolver.convolve(prior, range);
		return this.append(label, range, calendar, new TIntArrayList());
	}
	
	public Entry addMeasured(String label, SkeletalElement element, double depth, GestationAgeResolver resolver) {
		return this.addMeasured(label, resolver.resolve(element, depth));
	}
	
	public int size() {
		return entries.size();
	}
	
	public Entry getEntry(int index) {
		if (index < 1 || index > entries.size()) throw new IllegalArgumentException("No entry " + index + ", the session has " + entries.size() + " entries.");
		return entries.get(index - 1);
	}
	
	public List<Entry> getEntries() {
		return Collections.unmodifiableList(entries);
	}
	
	/**
	 * Fuses the given entries into one estimate. On success the combined entry is appended to the session
	 * and its index is in {@link CombinedResult#getEntry()}; if the gestation age ranges do not overlap,
	 * nothing is appended.
	 */
	public CombinedResult combine(int... indices) {
		TIntList sources = this.getSortedIndices(indices);
		if (sources.size() < 2) throw new IllegalArgumentException("Combining needs at least two distinct entries, got " + sources.size());
		
		List<GestationAgeRange> ranges = new ArrayList<GestationAgeRange>();
		for (int i = 0; i < sources.size(); i++) {
			ranges.add(this.getEntry(sources.get(i)).getRange());
		}
		
		CombinedEstimate estimate = CombinedEstimator.estimate(prior, ranges);
		if (!estimate.isCombined()) return new CombinedResult(estimate, sources, null);
		
		String label = "combined " + CollectionFormat.formatList(sources, ", ", "[entries ", "]");
		Entry combined = this.append(label, estimate.getRange(), estimate.getCalendar(), sources);
		return new CombinedResult(estimate, sources, combined);
	}
	
	// duplicates are analyzed as given
	public IntervalAnalysis analyzeInterval(DayInterval interval, int... indices) {
		if (indices.length < 1) throw new IllegalArgumentException("Interval analysis needs at least one entry.");
		
		List<ProbabilityCalendar> calendars = new ArrayList<ProbabilityCalendar>();
		for (int index : indices) {
			calendars.add(this.getEntry(index).getCalendar());
		}
		return IntervalAnalyzer.analyze(calendars, interval);
	}
	
	// all entries in session order
	public IntervalAnalysis analyzeInterval(DayInterval interval) {
		int[] all = new int[entries.size()];
		for (int i = 0; i < all.length; i++) all[i] = i + 1;
		return this.analyzeInterval(interval, all);
	}
	
	private Entry append(String label, GestationAgeRange range, ProbabilityCalendar calendar, TIntList sources) {
		Entry entry = new Entry(entries.size() + 1, label, range, calendar, sources);
		entries.add(entry);
		return entry;
	}
	
	private TIntList getSortedIndices(int[] indices) {
		TIntSet distinct = new TIntHashSet();
		for (int index : indices) {
			// validates
			this.getEntry(index);
			distinct.add(index);
		}
		TIntList sorted = new TIntArrayList(distinct);
		sorted.sort();
		return sorted;
	}
	
	public static class CombinedResult {
		
		private final CombinedEstimate estimate;
		private final TIntList sources;
		private final Entry entry;
		
		CombinedResult(CombinedEstimate estimate, TIntList sources, Entry entry) {
			this.estimate = estimate;
			this.sources = sources;
			this.entry = entry;
		}
		
		public CombinedEstimate getEstimate() {
			return estimate;
		}
		
		public boolean isCombined() {
			return estimate.isCombined();
		}
		
		public TIntList getSources() {
			return new TIntArrayList(sources);
		}
		
		// null if the ranges did not overlap
		public Entry getEntry() {
			return entry;
		}
	}
}
