// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wpgen.util;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wpgen.core.Logic.Expr;
import wpgen.io.SmtLibPrinter;

/**
 * A wrapper for the "z3" SMT solver. Each query is written as an SMT-LIB script
 * into a temporary file, which is then passed to a fresh solver process.
 */
public class Z3 implements Solver {
	private static final Logger logger = LoggerFactory.getLogger(Z3.class);

	private static final String Z3_COMMAND = "z3";

	private String command;

	/**
	 * Timeout (in milliseconds) for each query.
	 */
	private int timeout = 10000;

	/**
	 * Record command-line options.
	 */
	private final Map<String, String> options;

	public Z3() {
		this(Z3_COMMAND);
	}

	public Z3(String command) {
		this.command = command;
		this.options = new LinkedHashMap<>();
	}

	public Z3 setCommand(String command) {
		this.command = command;
		return this;
	}

	public Z3 setTimeout(int timeout) {
		this.timeout = timeout;
		return this;
	}

	/**
	 * Pass an option of the form <code>key=value</code> (or just <code>key</code>
	 * when the value is <code>null</code>) to the solver.
	 *
	 * @param key
	 * @param value
	 * @return
	 */
	public Z3 setOption(String key, String value) {
		options.put(key, value);
		return this;
	}

	/**
	 * Check whether the solver command can be run at all.
	 *
	 * @return
	 */
	public boolean isAvailable() {
		try {
			Process child = new ProcessBuilder(command, "-version").redirectErrorStream(true).start();
			try {
				return child.waitFor(timeout, TimeUnit.MILLISECONDS) && child.exitValue() == 0;
			} finally {
				child.destroy();
			}
		} catch (IOException e) {
			logger.debug("solver \"{}\" not available: {}", command, e.getMessage());
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	@Override
	public Result check(Expr formula) {
		byte[] bytes = SmtLibPrinter.toScript(formula).getBytes(StandardCharsets.UTF_8);
		String filename = null;
		try {
			filename = createTemporaryFile("wpgen", ".smt2", bytes);
			// ===================================================
			// Construct command
			// ===================================================
			ArrayList<String> cmd = new ArrayList<>();
			cmd.add(command);
			cmd.add("-smt2");
			for (Map.Entry<String, String> e : options.entrySet()) {
				if (e.getValue() == null) {
					cmd.add(e.getKey());
				} else {
					cmd.add(e.getKey() + "=" + e.getValue());
				}
			}
			cmd.add(filename);
			// ===================================================
			// Construct the process
			// ===================================================
			ProcessBuilder builder = new ProcessBuilder(cmd);
			builder.redirectErrorStream(true);
			Process child = builder.start();
			try {
				boolean success = child.waitFor(timeout, TimeUnit.MILLISECONDS);
				if (!success) {
					logger.warn("solver timed out after {}ms", timeout);
					return Result.UNKNOWN;
				}
				String output = new String(readInputStream(child.getInputStream()), StandardCharsets.UTF_8);
				return parseResult(output);
			} finally {
				// make sure child process is destroyed.
				child.destroy();
			}
		} catch (IOException e) {
			throw new RuntimeException(e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(e.getMessage(), e);
		} finally {
			if (filename != null) {
				new File(filename).delete();
			}
		}
	}

	/**
	 * Parse the first verdict reported by the solver. Any error reported before
	 * the verdict makes the result unknown.
	 *
	 * @param output
	 * @return
	 */
	static Result parseResult(String output) {
		for (String line : output.split("\n")) {
			String ith = line.trim();
			switch (ith) {
				case "sat":
					return Result.SAT;
				case "unsat":
					return Result.UNSAT;
				case "unknown":
				case "timeout":
					return Result.UNKNOWN;
				default:
					if (ith.startsWith("(error")) {
						// Part of the query was rejected, so any verdict is meaningless
						logger.warn("solver error: {}", ith);
						return Result.UNKNOWN;
					} else if (!ith.isEmpty()) {
						logger.warn("unexpected solver output: {}", ith);
					}
			}
		}
		return Result.UNKNOWN;
	}

	private static String createTemporaryFile(String prefix, String suffix, byte[] contents) throws IOException {
		File f = File.createTempFile(prefix, suffix);
		try (FileOutputStream fout = new FileOutputStream(f)) {
			fout.write(contents);
		}
		return f.getAbsolutePath();
	}

	private static byte[] readInputStream(InputStream input) throws IOException {
		byte[] buffer = new byte[1024];
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		int count;
		while ((count = input.read(buffer)) > 0) {
			output.write(buffer, 0, count);
		}
		return output.toByteArray();
	}
}
