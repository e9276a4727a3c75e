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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class GaussianSmootherTest {
	
	private static final double EPSILON = 1e-12;

	@Test
	public void testWeights() {
		double[] w = new GaussianSmoother().getWeights();
		assertEquals(GaussianSmoother.DEFAULT_WINDOW, w.length);
		
		double total = 0d;
		for (double v : w) total += v;
		assertEquals(1d, total, EPSILON);
		
		for (int i = 0; i < w.length; i++) {
			assertEquals(w[i], w[w.length - 1 - i], EPSILON);
			assertTrue(w[i] <= w[10]);
		}
	}
	
	@Test
	public void testConstantStaysConstant() {
		double[] ones = new double[50];
		Arrays.fill(ones, 1d);
		double[] smoothed = new GaussianSmoother().smooth(ones);
		
		for (int i = 0; i < 10; i++) {
			assertEquals(0d, smoothed[i], 0d);
			assertEquals(0d, smoothed[49 - i], 0d);
		}
		for (int i = 10; i < 40; i++) {
			assertEquals(1d, smoothed[i], EPSILON);
		}
	}
	
	@Test
	public void testSpikeSpreads() {
		double[] spike = new double[ConceptionPrior.LENGTH];
		spike[100] = 1d;
		double[] smoothed = new GaussianSmoother().smoothDistribution(spike);
		
		double total = 0d;
		for (double v : smoothed) total += v;
		assertEquals(1d, total, EPSILON);
		assertTrue(smoothed[100] > smoothed[95]);
		assertEquals(smoothed[95], smoothed[105], EPSILON);
		assertEquals(0d, smoothed[89], 0d);
		assertTrue(smoothed[90] > 0d);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testEmptyWindow() {
		new GaussianSmoother(0, 2.5);
	}
}
