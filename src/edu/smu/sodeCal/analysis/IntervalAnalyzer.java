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

import java.util.List;

import Jama.Matrix;
import edu.smu.sodeCal.calendar.DayInterval;
import edu.smu.sodeCal.calendar.ProbabilityCalendar;
import edu.smu.sodeCal.utility.SumArray;

// Compares independent death date calendars against a (possibly year-wrapping) interval of days.
public class IntervalAnalyzer {

	public static IntervalAnalysis analyze(List<ProbabilityCalendar> calendars, DayInterval interval) {
		int numCalendars = calendars.size();
		if (numCalendars < 1) throw new IllegalArgumentException("Interval analysis needs at least one calendar.");
		
		// one row per day, one column per calendar
		Matrix calendarMatrix = getCalendarMatrix(calendars);
		
		// rows of the days in the interval, in walking order
		int[] days = interval.getDays();
		int[] rows = new int[days.length];
		for (int i = 0; i < days.length; i++) rows[i] = days[i] - 1;
		Matrix intervalMatrix = calendarMatrix.getMatrix(rows, 0, numCalendars - 1);
		double[][] intervalRows = intervalMatrix.getArray();
		
		double[] dayProducts = new double[ProbabilityCalendar.DAYS_PER_YEAR];
		double[] dayMinima = new double[ProbabilityCalendar.DAYS_PER_YEAR];
		double[] dayMaxima = new double[ProbabilityCalendar.DAYS_PER_YEAR];
		
		double sameDayProbability = 0d;
		for (int i = 0; i < rows.length; i++) {
			double[] dayRow = intervalRows[i];
			
			double min = dayRow[0];
			double max = dayRow[0];
			for (double p : dayRow) {
				min = Math.min(min, p);
				max = Math.max(max, p);
			}
			
			dayProducts[rows[i]] = SumArray.getProduct(dayRow);
			dayMinima[rows[i]] = min;
			dayMaxima[rows[i]] = max;
			
			sameDayProbability += dayProducts[rows[i]];
		}
		
		// column sums
		double[] intervalMasses = new double[numCalendars];
		for (int i = 0; i < rows.length; i++) {
			for (int k = 0; k < numCalendars; k++) {
				intervalMasses[k] += intervalRows[i][k];
			}
		}
		
		double allWithinProbability = SumArray.getProduct(intervalMasses);
		
		return new IntervalAnalysis(interval, dayProducts, dayMinima, dayMaxima, intervalMasses, sameDayProbability, allWithinProbability);
	}
	
	public static Matrix getCalendarMatrix(List<ProbabilityCalendar> calendars) {
		double[][] byCalendar = new double[calendars.size()][];
		for (int k = 0; k < calendars.size(); k++) {
			byCalendar[k] = calendars.get(k).getProbabilities();
		}
		return new Matrix(byCalendar).transpose();
	}
}
