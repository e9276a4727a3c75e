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

package edu.smu.sodeCal.prior;

import java.util.EnumMap;

import org.apache.commons.math3.util.MathArrays;

/**
 * Conception calendars derived from observations of modern bison herds, in menu order.
 * Positions are days counted from June 1 (position 1) through January 31 (position 245).
 * Every herd is offered as sample data and as a three week Gaussian smooth of it.
 */
public enum ConceptionCalendars {
	
	AGGREGATED_FETAL (Herd.AGGREGATED_FETAL, false, "Aggregated YNP, Custer State Park, and Wind Cave herds, based on fetal data (n = 428) [sample data]"),
	AGGREGATED_FETAL_SMOOTH (Herd.AGGREGATED_FETAL, true, "Aggregated YNP, Custer State Park, and Wind Cave herds, based on fetal data (n = 428) [3 week smooth]"),
	YNP (Herd.YNP, false, "YNP western and northern herds, based on fetal metrics (n = 297) [sample data]"),
	YNP_SMOOTH (Herd.YNP, true, "YNP western and northern herds, based on fetal metrics (n = 297) [3 week smooth]"),
	YNP_NORTH (Herd.YNP_NORTH, false, "YNP northern herd, based on fetal metrics (n = 192) [sample data]"),
	YNP_NORTH_SMOOTH (Herd.YNP_NORTH, true, "YNP northern herd, based on fetal metrics (n = 192) [3 week smooth]"),
	YNP_WEST (Herd.YNP_WEST, false, "YNP western herd, based on fetal metrics (n = 105) [sample data]"),
	YNP_WEST_SMOOTH (Herd.YNP_WEST, true, "YNP western herd, based on fetal metrics (n = 105) [3 week smooth]"),
	CUSTER_WIND_CAVE (Herd.CUSTER_WIND_CAVE, false, "Custer State Park and Wind Cave, based on fetal metrics (n = 131) [sample data]"),
	CUSTER_WIND_CAVE_SMOOTH (Herd.CUSTER_WIND_CAVE, true, "Custer State Park and Wind Cave, based on fetal metrics (n = 131) [3 week smooth]"),
	NIOBRARA_BULL_FIGHTS (Herd.NIOBRARA_BULL_FIGHTS, false, "Niobrara bull fights [sample data]"),
	NIOBRARA_BULL_FIGHTS_SMOOTH (Herd.NIOBRARA_BULL_FIGHTS, true, "Niobrara bull fights [3 week smooth]"),
	NBR_COPULATIONS (Herd.NBR_COPULATIONS, false, "National Bison Range copulations (n = 37) [sample data]"),
	NBR_COPULATIONS_SMOOTH (Herd.NBR_COPULATIONS, true, "National Bison Range copulations (n = 37) [3 week smooth]");
	
	private static enum Herd {AGGREGATED_FETAL, YNP, YNP_NORTH, YNP_WEST, CUSTER_WIND_CAVE, NIOBRARA_BULL_FIGHTS, NBR_COPULATIONS};
	
	private final Herd herd;
	private final boolean smoothed;
	private final String description;
	
	private ConceptionCalendars(Herd herd, boolean smoothed, String description) {
		this.herd = herd;
		this.smoothed = smoothed;
		this.description = description;
	}
	
	public String getDescription() {
		return description;
	}
	
	public boolean isSmoothed() {
		return smoothed;
	}
	
	// 1-based, as listed to the user
	public int getMenuIndex() {
		return this.ordinal() + 1;
	}
	
	public static ConceptionCalendars byMenuIndex(int menuIndex) {
		ConceptionCalendars[] all = values();
		if (menuIndex < 1 || menuIndex > all.length) {
			throw new IllegalArgumentException("Calendar index must be an integer between 1 and " + all.length + ", got " + menuIndex);
		}
		return all[menuIndex - 1];
	}
	
	private static final EnumMap<ConceptionCalendars, ConceptionPrior> PRIOR_CACHE = new EnumMap<ConceptionCalendars, ConceptionPrior>(ConceptionCalendars.class);
	
	public ConceptionPrior getPrior() {
		return getCachedPrior(this);
	}
	
	private static synchronized ConceptionPrior getCachedPrior(ConceptionCalendars calendar) {
		ConceptionPrior prior = PRIOR_CACHE.get(calendar);
		if (prior == null) {
			double[] probs = getSampleProbabilities(calendar.herd);
			if (calendar.smoothed) {
				probs = new GaussianSmoother().smoothDistribution(probs);
			}
			prior = new ConceptionPrior(calendar.description, probs);
			PRIOR_CACHE.put(calendar, prior);
		}
		return prior;
	}
	
	private static double[] getSampleProbabilities(Herd herd) {
		switch (herd) {
			case NIOBRARA_BULL_FIGHTS:
				return MathArrays.normalizeArray(niobraraBullFights(), 1d);
			case NBR_COPULATIONS:
				return MathArrays.normalizeArray(nbrCopulations(), 1d);
			case CUSTER_WIND_CAVE:
				return MathArrays.normalizeArray(custerWindCave(), 1d);
			case YNP_NORTH:
				return MathArrays.normalizeArray(ynpNorth(), 1d);
			case YNP_WEST:
				return MathArrays.normalizeArray(ynpWest(), 1d);
			case YNP:
				return MathArrays.normalizeArray(MathArrays.ebeAdd(ynpNorth(), ynpWest()), 1d);
			case AGGREGATED_FETAL:
				// Custer State Park and Wind Cave are two herds, so that calendar counts twice
				double[] assorted = MathArrays.normalizeArray(custerWindCave(), 1d);
				double[] north = MathArrays.normalizeArray(ynpNorth(), 1d);
				double[] west = MathArrays.normalizeArray(ynpWest(), 1d);
				double[] aggregated = new double[ConceptionPrior.LENGTH];
				for (int i = 0; i < aggregated.length; i++) {
					aggregated[i] = ((assorted[i] * 2) + north[i] + west[i]) / 4;
				}
				return aggregated;
			default:
				throw new RuntimeException("Unknown herd " + herd);
		}
	}
	
	// spread a count evenly over the positions from..to (1-based, inclusive)
	private static void spread(double[] counts, int from, int to, double count) {
		double perDay = count / (to - from + 1);
		for (int pos = from; pos <= to; pos++) {
			counts[pos - 1] += perDay;
		}
	}
	
	// Wolff JO, 1998. Breeding strategies, mate choice, and reproductive success in American bison. Oikos 83, 529-544.
	private static final int[][] NIOBRARA_BULL_FIGHTS_DATA = new int[][] {
		{53, 3}, {54, 1}, {56, 1}, {57, 7}, {58, 2}, {60, 7}, {61, 7}, {62, 3}, {63, 13}, {64, 9},
		{65, 43}, {66, 8}, {67, 25}, {68, 17}, {69, 14}, {70, 17}, {71, 33}, {72, 24}, {73, 24}, {74, 33},
		{75, 25}, {76, 18}, {77, 28}, {78, 23}, {79, 6}, {80, 9}, {81, 17}, {82, 11}, {83, 4}, {84, 5},
		{85, 10}, {86, 9}, {87, 3}, {88, 4}, {92, 1}, {95, 2}, {96, 1}, {98, 2},
	};
	
	// Lott DF, 1981. Sexual behavior and intersexual strategies in American bison. Z. Tierpsychol. 56, 97-114.
	private static final int[][] NBR_COPULATIONS_DATA = new int[][] {
		{56, 1}, {58, 1}, {59, 2}, {60, 4}, {61, 4}, {62, 4}, {63, 5}, {64, 2},
		{65, 3}, {66, 1}, {68, 2}, {70, 1}, {71, 5}, {72, 1}, {73, 1},
	};
	
	// Haugen AO, 1974. Reproduction in the Plains bison. Iowa State J. Res. 49, 1-8.
	// conceptions in 5-day bins, {first position, count}
	private static final int[][] CUSTER_WIND_CAVE_DATA = new int[][] {
		{31, 1}, {36, 1}, {41, 1}, {46, 2}, {51, 8}, {56, 20}, {61, 32}, {66, 20}, {71, 15},
		{76, 5}, {81, 1}, {86, 10}, {91, 7}, {96, 3}, {101, 2}, {106, 1}, {111, 1}, {121, 1},
	};
	
	// Gogan PJP, Podruzny KM, Olexa EM, Pac HI, Frey KL, 2005. Yellowstone bison fetal development
	// and phenology of parturition. J. Wildl. Manag. 69, 1716-1730.
	// Births back-calculated to conceptions in weekly bins. First position of each week; the 1941
	// northern herd is offset by one week.
	private static final int[] YNP_WEEK_STARTS = new int[] {
		27, 34, 41, 48, 55, 62, 69, 76, 83, 90, 97, 104, 111, 118, 125, 132, 139, 146, 153, 160, 174, 202,
	};
	private static final int YNP_1941_OFFSET = 7;
	
	// per week: N1941, N1989, W1995, W1996, N1997, W1997, W1999, W2002
	private static final int[][] YNP_WEEKLY_COUNTS = new int[][] {
		{1, 1, 0, 0, 0, 0, 0, 0},
		{13, 3, 0, 0, 0, 0, 0, 0},
		{11, 3, 0, 0, 1, 0, 1, 1},
		{7, 9, 0, 0, 3, 0, 4, 3},
		{9, 11, 1, 0, 7, 1, 1, 3},
		{8, 2, 1, 2, 21, 2, 10, 4},
		{10, 4, 0, 2, 15, 4, 7, 2},
		{5, 4, 0, 2, 9, 5, 2, 6},
		{4, 4, 0, 1, 6, 4, 0, 1},
		{2, 3, 0, 0, 3, 10, 3, 1},
		{1, 0, 1, 2, 2, 2, 0, 0},
		{0, 1, 0, 0, 0, 0, 0, 1},
		{0, 1, 0, 0, 0, 0, 1, 0},
		{2, 1, 0, 1, 1, 0, 0, 1},
		{1, 0, 0, 0, 0, 0, 1, 0},
		{0, 1, 0, 0, 1, 0, 1, 1},
		{0, 0, 0, 0, 0, 0, 0, 2},
		{0, 1, 0, 0, 0, 0, 0, 0},
		{0, 0, 0, 0, 0, 0, 0, 1},
		{0, 0, 0, 0, 0, 0, 0, 1},
		{0, 0, 0, 0, 0, 0, 0, 1},
		{0, 0, 0, 0, 0, 0, 0, 1},
	};
	private static final int[] YNP_NORTH_COLUMNS = new int[] {0, 1, 4};
	private static final int[] YNP_WEST_COLUMNS = new int[] {2, 3, 5, 6, 7};
	
	static double[] niobraraBullFights() {
		double[] counts = new double[ConceptionPrior.LENGTH];
		for (int[] obs : NIOBRARA_BULL_FIGHTS_DATA) counts[obs[0] - 1] += obs[1];
		return counts;
	}
	
	static double[] nbrCopulations() {
		double[] counts = new double[ConceptionPrior.LENGTH];
		for (int[] obs : NBR_COPULATIONS_DATA) counts[obs[0] - 1] += obs[1];
		return counts;
	}
	
	static double[] custerWindCave() {
		double[] counts = new double[ConceptionPrior.LENGTH];
		for (int[] bin : CUSTER_WIND_CAVE_DATA) spread(counts, bin[0], bin[0] + 4, bin[1]);
		return counts;
	}
	
	static double[] ynpNorth() {
		return ynpHerds(YNP_NORTH_COLUMNS);
	}
	
	static double[] ynpWest() {
		return ynpHerds(YNP_WEST_COLUMNS);
	}
	
	private static double[] ynpHerds(int[] columns) {
		double[] counts = new double[ConceptionPrior.LENGTH];
		for (int week = 0; week < YNP_WEEK_STARTS.length; week++) {
			for (int col : columns) {
				int count = YNP_WEEKLY_COUNTS[week][col];
				if (count == 0) continue;
				int start = YNP_WEEK_STARTS[week] + (col == 0 ? YNP_1941_OFFSET : 0);
				spread(counts, start, start + 6, count);
			}
		}
		return counts;
	}
}
