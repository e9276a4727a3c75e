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

package edu.smu.sodeCal.utility;

import java.util.Collection;

import gnu.trove.list.TIntList;

// Joins collections and index lists into single report and parameter lines.
public class CollectionFormat {
	
	public interface Formatter<T> {
		public String formatItem(T item);
	}
	
	public static <T> String formatCollection(Collection<T> collection, String sep, String start, String end) {
		return formatCollection(collection, sep, start, end, null);
	}
	
	// formatter null means toString
	public static <T> String formatCollection(Collection<T> collection, String sep, String start, String end, Formatter<T> formatter) {
		StringBuilder sb = new StringBuilder(start);
		boolean first = true;
		for (T item : collection) {
			if (!first) sb.append(sep);
			sb.append(formatter == null ? String.valueOf(item) : formatter.formatItem(item));
			first = false;
		}
		return sb.append(end).toString();
	}

	// entry indices, in list order
	public static String formatList(TIntList list, String sep, String start, String end) {
		StringBuilder sb = new StringBuilder(start);
		for (int i = 0; i < list.size(); i++) {
			if (i > 0) sb.append(sep);
			sb.append(list.get(i));
		}
		return sb.append(end).toString();
	}
}
