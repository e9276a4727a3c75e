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

import java.io.IOException;
import java.io.StringReader;

import org.junit.Test;

public class ConceptionPriorReaderTest {
	
	private static final double EPSILON = 1e-6;
	
	// count values, several per line
	private static String values(int count, String value, String sep) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < count; i++) {
			sb.append(value);
			sb.append(i % 10 == 9 ? "\n" : sep);
		}
		return sb.toString();
	}

	@Test
	public void testReadWithComments() throws IOException {
		String input = "# uniform prior\n\n" + values(ConceptionPrior.LENGTH, Double.toString(1d / ConceptionPrior.LENGTH), "\t") + "\n# end\n";
		ConceptionPrior prior = ConceptionPriorReader.readPrior(new StringReader(input), "uniform", EPSILON);
		assertEquals(ConceptionPrior.LENGTH, prior.length());
		assertEquals("uniform", prior.getName());
		assertEquals(1d / ConceptionPrior.LENGTH, prior.getProbability(1), 0d);
	}
	
	@Test
	public void testRenormalize() throws IOException {
		String input = values(ConceptionPrior.LENGTH, "2", ", ");
		ConceptionPrior prior = ConceptionPriorReader.readPrior(new StringReader(input), "weights", EPSILON, true);
		assertEquals(1d, prior.getTotalMass(), 1e-12);
		assertEquals(1d / ConceptionPrior.LENGTH, prior.getProbability(245), 1e-12);
	}
	
	@Test(expected = IOException.class)
	public void testNotNormalized() throws IOException {
		ConceptionPriorReader.readPrior(new StringReader(values(ConceptionPrior.LENGTH, "2", " ")), "weights", EPSILON);
	}
	
	@Test(expected = IOException.class)
	public void testWrongCount() throws IOException {
		ConceptionPriorReader.readPrior(new StringReader(values(ConceptionPrior.LENGTH - 1, "1", " ")), "short", EPSILON, true);
	}
	
	@Test(expected = IOException.class)
	public void testNegative() throws IOException {
		String input = "-1\n" + values(ConceptionPrior.LENGTH - 1, "1", " ");
		ConceptionPriorReader.readPrior(new StringReader(input), "negative", EPSILON, true);
	}
	
	@Test(expected = IOException.class)
	public void testGarbage() throws IOException {
		String input = "abc\n" + values(ConceptionPrior.LENGTH - 1, "1", " ");
		ConceptionPriorReader.readPrior(new StringReader(input), "garbage", EPSILON, true);
	}
	
	@Test(expected = IOException.class)
	public void testNoMass() throws IOException {
		ConceptionPriorReader.readPrior(new StringReader(values(ConceptionPrior.LENGTH, "0", " ")), "zero", EPSILON, true);
	}
}
