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

import java.util.Arrays;
import java.util.EnumMap;

/**
 * Resolves gestation ages from diaphyseal depths using calibration tables per element:
 * a pair of log-linear quantile models converting depth to diaphysis length, and the lowest and highest
 * simulated diaphysis length for every day of gestation.
 * <p>
 * The measured depth is widened by the measurement tolerance before it enters the models; the earliest
 * day whose lowest simulated length reaches the lower length bound and the latest day whose highest
 * simulated length stays below the upper length bound make up the range.
 */
public class GrowthCurveResolver implements GestationAgeResolver {
	
	// mm
	public static final double MEASUREMENT_TOLERANCE = 0.225;
	
	/// calibration for one element
	public static class ElementCalibration {
		
		// ln(length) = intercept + slope * ln(depth)
		public final double lowerIntercept;
		public final double lowerSlope;
		public final double upperIntercept;
		public final double upperSlope;
		
		// index 0 is gestation day 1
		private final double[] minLengthByDay;
		private final double[] maxLengthByDay;
		
		public ElementCalibration(double lowerIntercept, double lowerSlope, double upperIntercept, double upperSlope, double[] minLengthByDay, double[] maxLengthByDay) {
			if (minLengthByDay.length != maxLengthByDay.length || minLengthByDay.length == 0) {
				throw new IllegalArgumentException("Growth curves need the same, positive number of days.");
			}
			this.lowerIntercept = lowerIntercept;
			this.lowerSlope = lowerSlope;
			this.upperIntercept = upperIntercept;
			this.upperSlope = upperSlope;
			this.minLengthByDay = Arrays.copyOf(minLengthByDay, minLengthByDay.length);
			this.maxLengthByDay = Arrays.copyOf(maxLengthByDay, maxLengthByDay.length);
		}
		
		public int numDays() {
			return this.minLengthByDay.length;
		}
		
		public double getLowerLength(double depth) {
			return Math.exp(this.lowerIntercept + this.lowerSlope * Math.log(depth - MEASUREMENT_TOLERANCE));
		}
		
		public double getUpperLength(double depth) {
			return Math.exp(this.upperIntercept + this.upperSlope * Math.log(depth + MEASUREMENT_TOLERANCE));
		}
	}
	
	private final EnumMap<SkeletalElement, ElementCalibration> calibrations;

	public GrowthCurveResolver() {
		this.calibrations = new EnumMap<SkeletalElement, ElementCalibration>(SkeletalElement.class);
	}
	
	public GrowthCurveResolver withCalibration(SkeletalElement element, ElementCalibration calibration) {
		this.calibrations.put(element, calibration);
		return this;
	}
	
	public boolean isCalibrated(SkeletalElement element) {
		return this.calibrations.containsKey(element);
	}

	@Override
	public GestationAgeRange resolve(SkeletalElement element, double depth) {
		ElementCalibration calibration = this.calibrations.get(element);
		if (calibration == null) throw new IllegalArgumentException("No growth calibration for " + element.getName());
		if (!(depth > MEASUREMENT_TOLERANCE)) throw new IllegalArgumentException("Depth " + depth + " mm is below the measurement tolerance.");
		
		double lowerLength = calibration.getLowerLength(depth);
		double upperLength = calibration.getUpperLength(depth);
		
		int minDay = -1;
		for (int i = 0; i < calibration.numDays(); i++) {
			if (calibration.minLengthByDay[i] >= lowerLength) {
				minDay = i + 1;
				break;
			}
		}
		
		int maxDay = -1;
		for (int i = calibration.numDays() - 1; i >= 0; i--) {
			if (calibration.maxLengthByDay[i] <= upperLength) {
				maxDay = i + 1;
				break;
			}
		}
		
		if (minDay == -1 || maxDay == -1) {
			throw new IllegalArgumentException("Depth " + depth + " mm of " + element.getName() + " is outside of the calibrated growth range.");
		}
		
		return new GestationAgeRange(minDay, maxDay);
	}
}
