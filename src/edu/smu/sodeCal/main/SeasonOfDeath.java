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

package edu.smu.sodeCal.main;

import java.io.IOException;
import java.io.PrintStream;

import com.martiansoftware.jsap.JSAPException;

import edu.smu.sodeCal.analysis.IntervalAnalysis;
import edu.smu.sodeCal.session.Entry;
import edu.smu.sodeCal.session.SodeSession;
import edu.smu.sodeCal.session.SodeSession.CombinedResult;
import edu.smu.sodeCal.report.SodeReport;
import gnu.trove.list.TIntList;

public class SeasonOfDeath {

	public static void main (String[] args) throws JSAPException, IOException {
		
		// print out the command line arguments
		PrintStream outStream = System.out;
		outStream.print("# Command-line arguments: ");
		for (String arg: args)	{
			outStream.print(arg + " ");
		}
		outStream.print("\n");
		
		SodeParamSet params = new SodeParamSet(args, outStream);
		run(params, outStream);
	}
	
	public static SodeSession run(SodeParamSet params, PrintStream outStream) throws IOException {
		SodeSession session = new SodeSession(params.prior);
		SodeReport report = new SodeReport(outStream);
		
		for (int i = 0; i < params.ranges.size(); i++) {
			Entry entry = session.addMeasured(params.labels.get(i), params.ranges.get(i));
			outStream.println();
			report.printEntry(entry);
			if (params.printCalendars) report.printCalendar(entry.getCalendar());
		}
		
		for (TIntList group : params.combineGroups) {
			checkIndices(group, session);
			CombinedResult result = session.combine(group.toArray());
			outStream.println();
			report.printCombination(result);
			if (params.printCalendars && result.isCombined()) report.printCalendar(result.getEntry().getCalendar());
		}
		
		if (params.interval != null) {
			IntervalAnalysis analysis;
			if (params.intervalEntries == null) {
				analysis = session.analyzeInterval(params.interval);
			}
			else {
				checkIndices(params.intervalEntries, session);
				analysis = session.analyzeInterval(params.interval, params.intervalEntries.toArray());
			}
			outStream.println();
			report.printIntervalAnalysis(analysis);
		}
		
		return session;
	}
	
	private static void checkIndices(TIntList indices, SodeSession session) throws IOException {
		for (int i = 0; i < indices.size(); i++) {
			if (indices.get(i) > session.size()) throw new IOException("No entry " + indices.get(i) + ", there are only " + session.size() + " entries at this point.");
		}
	}
}
