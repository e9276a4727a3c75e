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

// long bones with calibrated diaphyseal growth
public enum SkeletalElement {
	TIBIA, FEMUR, RADIUS, HUMERUS;
	
	public String getName() {
		return this.name().toLowerCase();
	}
	
	public static SkeletalElement fromName(String name) {
		for (SkeletalElement element : values()) {
			if (element.getName().equals(name.trim().toLowerCase())) return element;
		}
		throw new IllegalArgumentException("Unknown element: " + name);
	}
}
