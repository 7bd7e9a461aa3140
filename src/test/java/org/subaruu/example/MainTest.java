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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Command line tests, checking return codes and what reaches the console
 *
 * @version 1.0
 * @since 1.0
 */
public class MainTest {
	private PrintStream savedOut;
	private PrintStream savedErr;
	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void captureConsole () throws IOException {
		savedOut = System.out;
		savedErr = System.err;
		out = new ByteArrayOutputStream ();
		err = new ByteArrayOutputStream ();
		System.setOut (new PrintStream (out, true, "UTF-8"));
		System.setErr (new PrintStream (err, true, "UTF-8"));
	}

	@After
	public void restoreConsole () {
		System.setOut (savedOut);
		System.setErr (savedErr);
	}

	private String out () {
		return new String (out.toByteArray (), StandardCharsets.UTF_8);
	}

	private String err () {
		return new String (err.toByteArray (), StandardCharsets.UTF_8);
	}

	@Test
	public void version () {
		assertEquals (2, Main.execute (new String[] {"--v"}));
		assertTrue (out ().startsWith ("SUBARUU for Java (v 1.0)"));
	}

	@Test
	public void noArguments () {
		assertEquals (2, Main.execute (new String[0]));
		assertTrue (out ().contains ("Usage:"));
	}

	@Test
	public void tooManyFiles () {
		assertEquals (2, Main.execute (new String[] {"a.bas", "b.bas"}));
	}

	@Test
	public void badNumberShowsHelp () {
		assertEquals (2, Main.execute (new String[] {"--from=ten", "x.bas"}));
		assertTrue (err ().contains ("Not a number: --from=ten"));
		assertTrue (out ().contains ("Usage:"));
	}

	@Test
	public void hello () {
		assertEquals (0, Main.execute (new String[] {"--hello"}));
		assertEquals ("Hello world! 2+2= 4\n", out ());
	}

	@Test
	public void missingFile () {
		assertEquals (3, Main.execute (new String[] {"/no/such/dir/missing.bas"}));
		assertTrue (err ().contains ("File does not exist"));
	}

	@Test
	public void unreadableSource () throws IOException {
		File directory = File.createTempFile ("subaruu", ".dir");
		directory.delete ();
		directory.mkdir ();

		assertEquals (4, Main.execute (new String[] {directory.getPath ()}));
		assertTrue (err ().contains ("File unknown error"));
		directory.delete ();
	}

	@Test
	public void runFile () {
		File program = writeTmpFile ("10 LET a = 6\n20 PRINT a * 7\n");
		assertEquals (0, Main.execute (new String[] {program.getPath ()}));
		assertEquals ("42\n", out ());
		program.delete ();
	}

	@Test
	public void failingProgram () {
		File program = writeTmpFile ("10 PRINT \"before\"\n20 FOO\n");
		assertEquals (1, Main.execute (new String[] {program.getPath ()}));
		assertEquals ("before\n", out ());
		assertTrue (err ().contains ("ERROR: Syntax Error: Unrecognized statement `error`"));
		program.delete ();
	}

	@Test
	public void startLineOption () {
		File program = writeTmpFile ("10 PRINT \"ten\"\n20 PRINT \"twenty\"\n");
		assertEquals (0, Main.execute (new String[] {"--from=20", program.getPath ()}));
		assertEquals ("twenty\n", out ());
		program.delete ();
	}

	@Test
	public void watchdogOption () {
		File program = writeTmpFile ("10 GOTO 10\n");
		assertEquals (1, Main.execute (new String[] {"--watchdog=50", program.getPath ()}));
		assertTrue (err ().contains ("Watchdog 50 ticks timeout, execution break"));
		program.delete ();
	}

	@Test
	public void watchdogAllowsOneFewerStatement () {
		File program = writeTmpFile ("10 PRINT \"only\"\n");
		assertEquals (0, Main.execute (new String[] {"--watchdog=2", program.getPath ()}));
		assertEquals ("only\n", out ());
		program.delete ();
	}

	/**
	 * Writes a temporary program file
	 *
	 * @param fileData Program text
	 * @return The file handle, or null if it could not be written
	 */
	private static File writeTmpFile (String fileData) {
		try {
			File fileHandle = File.createTempFile ("subaruu", ".bas");

			OutputStream outputStream = new FileOutputStream (fileHandle);
			outputStream.write (fileData.getBytes (StandardCharsets.UTF_8));
			outputStream.flush ();
			outputStream.close ();

			return fileHandle;
		} catch (IOException e) {
			return null;
		}
	}
}
