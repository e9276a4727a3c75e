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

import java.util.Arrays;

import edu.smu.sodeCal.calendar.DayInterval;

// Outcome of comparing one or more death date calendars against a day interval.
public class IntervalAnalysis {
	
	/// which statements the analysis supports
	public static enum QueryType {
		// a single calendar against the whole year says nothing
		NO_STATEMENT,
		// several calendars against the whole year, only the shared day is of interest
		SAME_DAY_ONLY,
		// a single calendar against a hypothesized interval
		SINGLE_WITHIN,
		// several calendars against a hypothesized interval
		SAME_DAY_AND_WITHIN;
		
		public static QueryType forQuery(int numCalendars, DayInterval interval) {
			if (interval.isFullYear()) {
				return numCalendars == 1 ? NO_STATEMENT : SAME_DAY_ONLY;
			}
			return numCalendars == 1 ? SINGLE_WITHIN : SAME_DAY_AND_WITHIN;
		}
	}
	
	private final DayInterval interval;
	private final QueryType queryType;
	
	// per day, zero outside of the interval
	private final double[] dayProducts;
	private final double[] dayMinima;
	private final double[] dayMaxima;
	
	// mass of each calendar inside the interval
	private final double[] intervalMasses;
	
	private final double sameDayProbability;
	private final double allWithinProbability;
	
	IntervalAnalysis(DayInterval interval, double[] dayProducts, double[] dayMinima, double[] dayMaxima, double[] intervalMasses, double sameDayProbability, double allWithinProbability) {
		this.interval = interval;
		this.queryType = QueryType.forQuery(intervalMasses.length, interval);
		this.dayProducts = dayProducts;
		this.dayMinima = dayMinima;
		this.dayMaxima = dayMaxima;
		this.intervalMasses = intervalMasses;
		this.sameDayProbability = sameDayProbability;
		this.allWithinProbability = allWithinProbability;
	}
	
	public DayInterval getInterval() {
		return interval;
	}
	
	public QueryType getQueryType() {
		return queryType;
	}
	
	public int numCalendars() {
		return intervalMasses.length;
	}
	
	public boolean isDegenerate() {
		return queryType == QueryType.NO_STATEMENT;
	}
	
	// probability that all death dates fall on one and the same day inside the interval
	public double getSameDayProbability() {
		return sameDayProbability;
	}
	
	// probability that every death date falls somewhere inside the interval
	public double getAllWithinProbability() {
		return allWithinProbability;
	}
	
	public double[] getIntervalMasses() {
		return Arrays.copyOf(intervalMasses, intervalMasses.length);
	}
	
	public double[] getDayProducts() {
		return Arrays.copyOf(dayProducts, dayProducts.length);
	}
	
	public double[] getDayMinima() {
		return Arrays.copyOf(dayMinima, dayMinima.length);
	}
	
	public double[] getDayMaxima() {
		return Arrays.copyOf(dayMaxima, dayMaxima.length);
	}
}
