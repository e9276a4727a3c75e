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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;

// This class reads a conception prior from a text file: one or more numbers per line, separated by
// whitespace or commas, lines starting with # are comments. Exactly one value per day from June 1 to January 31.
public class ConceptionPriorReader {
	
	public static ConceptionPrior readPrior(Reader r, String name, double EPSILON) throws IOException {
		return readPrior(r, name, EPSILON, false);
	}

	public static ConceptionPrior readPrior(Reader r, String name, double EPSILON, boolean renormalize) throws IOException {
		BufferedReader bReader = new BufferedReader(r);
		
		ArrayList<Double> values = new ArrayList<Double>();
		String line;
		int lineNumber = 0;
		while ((line = bReader.readLine()) != null) {
			lineNumber++;
			if (line.trim().startsWith("#") || line.trim().equals("")) continue;
			
			for (String field : line.trim().split("(\t| |,)+")) {
				if (field.isEmpty()) continue;
				double value;
				try {
					value = Double.parseDouble(field);
				}
				catch (NumberFormatException e) {
					throw new IOException("Improperly formatted conception prior, line " + lineNumber + ": " + field, e);
				}
				if (!(value >= 0d) || Double.isInfinite(value)) throw new IOException("Conception probabilities must be nonnegative and finite, line " + lineNumber + ": " + field);
				values.add(value);
			}
		}
		bReader.close();
		
		if (values.size() != ConceptionPrior.LENGTH) throw new IOException("Conception prior needs " + ConceptionPrior.LENGTH + " values, found " + values.size() + ".");
		
		double[] probs = new double[values.size()];
		double total = 0d;
		for (int i = 0; i < probs.length; i++) {
			total += probs[i] = values.get(i);
		}
		if (total <= 0d) throw new IOException("Conception prior carries no mass.");
		
		if (renormalize) {
			return ConceptionPrior.fromWeights(name, probs);
		}
		
		ConceptionPrior prior = new ConceptionPrior(name, probs);
		if (!prior.isNormalized(EPSILON)) throw new IOException("Conception prior does not sum to 1 (sum is " + total + ").");
		return prior;
	}
}
