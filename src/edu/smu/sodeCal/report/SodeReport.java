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

import java.io.PrintStream;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

import edu.smu.sodeCal.analysis.IntervalAnalysis;
import edu.smu.sodeCal.calendar.DayInterval;
import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.calendar.SegmentFinder.Segment;
import edu.smu.sodeCal.session.Entry;
import edu.smu.sodeCal.session.SodeSession.CombinedResult;
import edu.smu.sodeCal.utility.CollectionFormat;

/**
 * Writes season of death estimates as text.
 */
public class SodeReport {
	
	public static final String NO_OVERLAP = "Age distributions do not overlap, no combined estimate possible.";
	public static final String NO_STATEMENT = "No specific hypothesized date interval and only one element selected. No probabilistic statement.";
	
	private final PrintStream outStream;
	private final DecimalFormat probabilityFormat;
	
	public SodeReport(PrintStream outStream) {
		this(outStream, new DecimalFormat("0.######", DecimalFormatSymbols.getInstance(Locale.US)));
	}
	
	public SodeReport(PrintStream outStream, DecimalFormat probabilityFormat) {
		this.outStream = outStream;
		this.probabilityFormat = probabilityFormat;
	}
	
	public void printEntry(Entry entry) {
		outStream.println("Entry " + entry.getIndex() + ": " + entry.getLabel());
		outStream.println("Gestation age: " + entry.getRange().getMinDay() + " to " + entry.getRange().getMaxDay() + " days");
		if (entry.isCombined()) {
			outStream.println("Combined from entries " + CollectionFormat.formatList(entry.getSources(), ", ", "", ""));
		}
		this.printSegments(entry.getSegments());
	}
	
	public void printSegments(List<Segment> segments) {
		if (segments.isEmpty()) {
			outStream.println("The SODE has no probability mass.");
		} else if (segments.size() == 1) {
			Segment s = segments.get(0);
			outStream.println("The SODE is distributed between " + CalendarDates.format(s.lowDay) + " and " + CalendarDates.format(s.highDay) + ".");
		} else {
			outStream.println("The SODE is distributed across " + segments.size() + " intervals.");
			for (Segment s : segments) {
				outStream.println(probabilityFormat.format(s.mass) + " of the SODE is distributed from " + CalendarDates.format(s.lowDay) + " to " + CalendarDates.format(s.highDay) + ".");
			}
		}
	}
	
	public void printCombination(CombinedResult result) {
		if (!result.isCombined()) {
			outStream.println("Entries " + CollectionFormat.formatList(result.getSources(), ", ", "", "") + ": " + NO_OVERLAP);
			return;
		}
		this.printEntry(result.getEntry());
	}
	
	public void printIntervalAnalysis(IntervalAnalysis analysis) {
		String interval = formatInterval(analysis.getInterval());
		switch (analysis.getQueryType()) {
			case NO_STATEMENT:
				outStream.println(NO_STATEMENT);
				break;
			case SAME_DAY_ONLY:
				outStream.println("The probability that all elements were deposited on the same date is " + probabilityFormat.format(analysis.getSameDayProbability()) + ".");
				break;
			case SINGLE_WITHIN:
				outStream.println("The probability that the element was deposited within " + interval + " is " + probabilityFormat.format(analysis.getAllWithinProbability()) + ".");
				break;
			case SAME_DAY_AND_WITHIN:
				outStream.println("The probability that all elements were deposited on the same date within the interval " + interval + " is " + probabilityFormat.format(analysis.getSameDayProbability()) + ".");
				outStream.println("The probability that all elements were deposited within the interval " + interval + " is " + probabilityFormat.format(analysis.getAllWithinProbability()) + ".");
				break;
			default:
				throw new RuntimeException("Unknown query type " + analysis.getQueryType());
		}
	}
	
	// one line per day with nonzero probability
	public void printCalendar(ProbabilityCalendar calendar) {
		for (int day = 1; day <= ProbabilityCalendar.DAYS_PER_YEAR; day++) {
			double p = calendar.getProbability(day);
			if (p > 0d) outStream.println(day + "\t" + CalendarDates.format(day) + "\t" + p);
		}
	}
	
	public static String formatInterval(DayInterval interval) {
		return CalendarDates.format(interval.startDay) + " - " + CalendarDates.format(interval.endDay);
	}
}
