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

package edu.smu.sodeCal.main;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;
import com.martiansoftware.jsap.Switch;

import edu.smu.sodeCal.calendar.DayInterval;
import edu.smu.sodeCal.calendar.DeathDateConvolver;
import edu.smu.sodeCal.gestation.GestationAgeRange;
import edu.smu.sodeCal.prior.ConceptionCalendars;
import edu.smu.sodeCal.prior.ConceptionPrior;
import edu.smu.sodeCal.prior.ConceptionPriorReader;
import edu.smu.sodeCal.utility.CollectionFormat;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

public class SodeParamSet {
	
	// tolerance for prior files that are not renormalized
	public static final double PRIOR_EPSILON = 1e-6;
	
	public final JSAPResult jsapParams;
	
	public final ConceptionPrior prior;
	public final List<GestationAgeRange> ranges;
	public final List<String> labels;
	// groups of entry indices to combine, in order
	public final List<TIntList> combineGroups;
	// null if no interval analysis requested
	public final DayInterval interval;
	// null means all entries
	public final TIntList intervalEntries;
	public final boolean printCalendars;
	
	public SodeParamSet(String args[], PrintStream outStream) throws JSAPException, IOException {
		
		Parameter[] params = new Parameter[] {
	            new FlaggedOption ("calendar", JSAP.INTEGER_PARSER, "2", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "calendar",
	            		"Index of the conception calendar to use, between 1 and " + ConceptionCalendars.values().length + ". Odd indices are raw data, even indices the smoothed version."),
	            new FlaggedOption ("priorFile", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "priorFile",
	            		"File with " + ConceptionPrior.LENGTH + " conception probabilities, one for each day starting June 1. Overrides --calendar."),
	            new Switch ("renormalizePrior", JSAP.NO_SHORTFLAG, "renormalizePrior",
	            		"If this switch is set, the values in the priorFile are treated as weights and renormalized."),
	            new FlaggedOption ("ranges", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, 'r', "ranges",
	            		"A string of semi-colon separated list of pairs of integers, each pair separated by a comma. Each pair is the minimal and maximal gestation age in days of one element."),
	            new FlaggedOption ("labels", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "labels",
	            		"Semi-colon separated list of labels, one for each range."),
	            new FlaggedOption ("combine", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'c', "combine",
	            		"Semi-colon separated groups of comma separated entry indices. Each group is combined into a new entry, in the given order."),
	            new FlaggedOption ("interval", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'i', "interval",
	            		"Hypothesized interval of death as two comma separated days of the year. The interval wraps around Dec 31 if the first day is after the second."),
	            new FlaggedOption ("intervalEntries", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "intervalEntries",
	            		"Comma separated entry indices to compare against the interval. Default is all entries."),
	            new Switch ("printCalendars", JSAP.NO_SHORTFLAG, "printCalendars",
	            		"Print the probability of each day for every entry."),
		};
		
		SimpleJSAP jsap = new SimpleJSAP(
				"SeasonOfDeath",
				"Estimates the season of death from fetal bison bones",
				params
				);
		
		if (args.length == 0) {
			System.err.println ("Use --help for more options.");
			throw new IOException("No command-line arguments given.");
		}
		this.jsapParams = jsap.parse(args);
		
		if (jsap.messagePrinted()) {
			if (jsapParams.contains("help") && jsapParams.getBoolean("help")) System.exit(0);
			throw new IOException("Invalid command-line arguments.");
		}
		
		outStream.println("# Parameter values:");
		
		// the prior
		if (jsapParams.contains("priorFile")) {
			String priorFile = jsapParams.getString("priorFile");
			boolean renormalize = jsapParams.getBoolean("renormalizePrior");
			Reader r = new BufferedReader(new FileReader(priorFile));
			try {
				this.prior = ConceptionPriorReader.readPrior(r, priorFile, PRIOR_EPSILON, renormalize);
			}
			finally {
				r.close();
			}
			outStream.println("# priorFile = " + priorFile);
			outStream.println("# renormalizePrior = " + renormalize);
		}
		else {
			int calendarIndex = jsapParams.getInt("calendar");
			if (calendarIndex < 1 || calendarIndex > ConceptionCalendars.values().length) {
				throw new IOException("Calendar index must be an integer between 1 and " + ConceptionCalendars.values().length + ", got " + calendarIndex);
			}
			ConceptionCalendars calendar = ConceptionCalendars.byMenuIndex(calendarIndex);
			this.prior = calendar.getPrior();
			outStream.println("# calendar = " + calendarIndex + " (" + calendar.getDescription() + ")");
		}
		
		// the elements
		this.ranges = Collections.unmodifiableList(parseRanges(jsapParams.getString("ranges")));
		int maxAge = DeathDateConvolver.getMaxGestationAge(this.prior);
		for (GestationAgeRange range : this.ranges) {
			if (range.getMaxDay() > maxAge) throw new IOException("Invalid gestation age range: " + range + ", gestation ages go up to " + maxAge + " days.");
		}
		List<String> labelList = new ArrayList<String>();
		if (jsapParams.contains("labels")) {
			for (String label : jsapParams.getString("labels").split(";")) labelList.add(label.trim());
			if (labelList.size() != this.ranges.size()) throw new IOException("Number of labels [" + labelList.size() + "] differs from number of ranges [" + this.ranges.size() + "].");
		}
		else {
			for (int i = 0; i < this.ranges.size(); i++) labelList.add("element " + (i + 1));
		}
		this.labels = Collections.unmodifiableList(labelList);
		outStream.println("# ranges = " + CollectionFormat.formatCollection(this.ranges, ", ", "", ""));
		outStream.println("# labels = " + CollectionFormat.formatCollection(this.labels, ", ", "", ""));
		
		// combinations
		if (jsapParams.contains("combine")) {
			this.combineGroups = Collections.unmodifiableList(parseGroups(jsapParams.getString("combine")));
			outStream.println("# combine = " + CollectionFormat.formatCollection(this.combineGroups, "; ", "", "", new CollectionFormat.Formatter<TIntList>() {
				public String formatItem(TIntList group) {
					return CollectionFormat.formatList(group, ",", "", "");
				}
			}));
		}
		else {
			this.combineGroups = Collections.emptyList();
		}
		
		// interval analysis
		if (jsapParams.contains("interval")) {
			this.interval = parseInterval(jsapParams.getString("interval"));
			outStream.println("# interval = " + this.interval);
		}
		else {
			this.interval = null;
		}
		if (jsapParams.contains("intervalEntries")) {
			if (this.interval == null) throw new IOException("intervalEntries can only be given together with an interval.");
			this.intervalEntries = parseIndices(jsapParams.getString("intervalEntries"));
			outStream.println("# intervalEntries = " + CollectionFormat.formatList(this.intervalEntries, ",", "", ""));
		}
		else {
			this.intervalEntries = null;
		}
		
		this.printCalendars = jsapParams.getBoolean("printCalendars");
		outStream.println("# printCalendars = " + this.printCalendars);
	}
	
	// "min,max;min,max"
	public static List<GestationAgeRange> parseRanges(String rangeString) throws IOException {
		List<GestationAgeRange> result = new ArrayList<GestationAgeRange>();
		for (String pair : rangeString.split(";")) {
			int[] thisPair = parseIntegers(pair);
			if (thisPair.length != 2) throw new IOException("Each range has to be two integers separated by a comma, got: " + pair);
			try {
				result.add(new GestationAgeRange(thisPair[0], thisPair[1]));
			}
			catch (IllegalArgumentException e) {
				throw new IOException("Invalid gestation age range: " + pair, e);
			}
		}
		return result;
	}
	
	// "i,j;k,l"
	public static List<TIntList> parseGroups(String groupString) throws IOException {
		List<TIntList> result = new ArrayList<TIntList>();
		for (String group : groupString.split(";")) {
			TIntList indices = parseIndices(group);
			if (indices.size() < 2) throw new IOException("Each group to combine needs at least two entries, got: " + group);
			result.add(indices);
		}
		return result;
	}
	
	// "start,end"
	public static DayInterval parseInterval(String intervalString) throws IOException {
		int[] days = parseIntegers(intervalString);
		if (days.length != 2) throw new IOException("The interval has to be two days separated by a comma, got: " + intervalString);
		try {
			return new DayInterval(days[0], days[1]);
		}
		catch (IllegalArgumentException e) {
			throw new IOException("Invalid interval: " + intervalString, e);
		}
	}
	
	public static TIntList parseIndices(String indexString) throws IOException {
		TIntList indices = new TIntArrayList(parseIntegers(indexString));
		for (int i = 0; i < indices.size(); i++) {
			if (indices.get(i) < 1) throw new IOException("Entry indices start at 1, got " + indices.get(i));
		}
		return indices;
	}
	
	private static int[] parseIntegers(String commaString) throws IOException {
		String[] fields = commaString.trim().split(",");
		int[] values = new int[fields.length];
		for (int i = 0; i < fields.length; i++) {
			try {
				values[i] = Integer.parseInt(fields[i].trim());
			}
			catch (NumberFormatException e) {
				throw new IOException("Not an integer: " + fields[i], e);
			}
		}
		return values;
	}
}
