/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.subaruu.example;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.subaruu.Subaruu;

/**
 * SUBARUU for Java
 *
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (execute (args));
	}

	/**
	 * Runs the command line
	 *
	 * @param args The command line options
	 * @return The return code for the invoking shell
	 */
	static int execute (String[] args) {
		/** The return code sent to the invoking shell */
		int returnCode = -1;

		/** The program to run (loaded from disk or internal example) */
		String sourceData = null;

		// Process command line flags, anything not a flag is the source file
		List <String> params = Arrays.asList (args);
		boolean paramVersion = params.contains ("--v");
		boolean paramHelp = params.contains ("--help");
		boolean paramExample = params.contains ("--hello");
		Integer paramFrom = null;
		int paramWatchdog = -1;
		List <String> files = new ArrayList <String> ();

		for (String param : params) {
			try {
				if (param.startsWith ("--from=")) {
					paramFrom = Integer.valueOf (param.substring (7));
				} else if (param.startsWith ("--watchdog=")) {
					paramWatchdog = Integer.parseInt (param.substring (11));
				} else if (!param.startsWith ("--")) {
					files.add (param);
				}
			} catch (NumberFormatException e) {
				System.err.println ("Not a number: " + param);
				paramHelp = true;
			}
		}

		if (paramVersion || paramHelp || (files.size () != 1 && !paramExample) || files.size () > 1) { // Called with wrong arguments, version or help
			// Show version
			System.out.println ("SUBARUU for Java (v " + Subaruu.VERSION_MAJOR + "." + Subaruu.VERSION_MINOR + ")\n");

			// Show usage information
			if (!paramVersion || paramHelp) {
				System.out.println ("Usage:  java -jar subaruu.jar sourcefile");
				System.out.println ("        (to execute a SUBARUU program)");
				System.out.println ("Alternatively set run configuration arguments in your IDE");
				System.out.println ("");
				System.out.println ("Options:");
				System.out.println ("       --help     Show this help");
				System.out.println ("          --v     Show version information");
				System.out.println ("      --hello     Run internal example program");
				System.out.println ("     --from=N     Start at line N instead of the first line");
				System.out.println (" --watchdog=N     Stop at statement N, letting N-1 run (0 = never, the default is 100000)");
			}

			returnCode = 2;
		} else if (paramExample) { // Called to execute the internal example program
			/* The example used:
			 *
			 *  10 LET a = 2 + 2
			 *  20 PRINT "Hello world! 2+2=", a
			 */
			sourceData = "10 LET a = 2 + 2\n" + "20 PRINT \"Hello world! 2+2=\", a\n";
		} else { // Called to execute a program from disk
			File sourceFile = new File (files.get (0));

			// Attempt to read the file from disk
			if (!sourceFile.exists ()) {
				System.err.println ("File does not exist: " + files.get (0));
				returnCode = 3;
			} else if (!sourceFile.canRead ()) {
				System.err.println ("File read permission denied: " + files.get (0));
				returnCode = 13;
			} else {
				sourceData = readFile (sourceFile);
				if (sourceData == null) {
					System.err.println ("File unknown error: " + files.get (0));
					returnCode = 4;
				}
			}
		}

		// If a program is in this variable, execute it
		if (sourceData != null) {
			boolean success;

			// Create a new instance, printing as the program runs rather than when it has finished
			Subaruu subaruu = new Subaruu ();
			subaruu.streamSet (System.out, System.err);
			subaruu.watchdogSet (paramWatchdog);

			success = subaruu.script (sourceData);
			if (success)
				success = (paramFrom == null ? subaruu.run () : subaruu.run (paramFrom));

			System.out.flush ();

			// Set the return code for the shell (0=success)
			returnCode = (success ? 0 : 1);
		}

		return returnCode;
	}

	/**
	 * Reads a file from disk and returns it as a string
	 *
	 * @param file The file object to read
	 * @return String containing the file contents, or null if file cannot be read
	 */
	private static String readFile (File file) {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try {
			FileInputStream inputStream = new FileInputStream (file);
			try {
				byte buf[] = new byte[1024];
				int len;

				while ((len = inputStream.read (buf)) != -1)
					outputStream.write (buf, 0, len);
			} finally {
				inputStream.close ();
			}

			return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
		} catch (IOException e) {
			e.printStackTrace ();
		}

		return null;
	}
}
