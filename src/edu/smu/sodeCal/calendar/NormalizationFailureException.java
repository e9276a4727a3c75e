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

package edu.smu.sodeCal.calendar;

// thrown when a folded calendar carries no mass, so it cannot be turned into a distribution
public class NormalizationFailureException extends RuntimeException {
	
	private static final long serialVersionUID = 1L;
	
	private final double totalMass;

	public NormalizationFailureException(String message, double totalMass) {
		super(message);
		this.totalMass = totalMass;
	}
	
	public double getTotalMass() {
		return totalMass;
	}
}
