package org.hxlens.history;

/*
 * This file is part of HxLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * HxLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * HxLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with HxLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.hxlens.history.conf.ConfigLoader;
import org.hxlens.history.io.CsvRecordLoader;
import org.hxlens.history.io.PayloadCodec;
import org.hxlens.history.io.PayloadException;
import org.hxlens.history.io.SummaryRequest;
import org.hxlens.history.om.PatientData;
import org.hxlens.history.om.PredictionResult;
import org.hxlens.history.processing.HistoryPipeline;
import org.hxlens.history.util.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * hxlens summarize|predict [--csv FILE] [--age N] [--now yyyy-MM-dd] [--config FILE]
 * </pre>
 *
 * The request is read from stdin (unless {@code --csv} supplies the records) and
 * the response is written to stdout as a single JSON object. Logging goes to
 * stderr. Exit status is 0 on success and 1 on any error.
 */
public class HxLensMain {

	public static final String CMD_SUMMARIZE = "summarize";
	public static final String CMD_PREDICT = "predict";

	static final String INVALID_REQUEST = "Invalid request: ";
	static final String PROCESSING_FAILED = "Processing failed: ";

	static final int EXIT_OK = 0;
	static final int EXIT_ERROR = 1;

	/**
	 * Application entry point.
	 */
	public static void main(String[] args) {
		int status = new HxLensMain().run(args, System.in, System.out);
		System.exit(status);
	}

	/**
	 * Runs one request and writes exactly one response object to {@code out}.
	 *
	 * @return the process exit status
	 */
	public int run(String[] args, InputStream in, PrintStream out) {
		// Used for the error payload when the arguments themselves are bad
		PayloadCodec codec = new PayloadCodec(true);
		try {
			Options opts = Options.parse(args);
			ConfigLoader cfg = loadConfig(opts.configPath);
			codec = new PayloadCodec(cfg.isDefaultEmergencyMode());
			HistoryPipeline pipeline = new HistoryPipeline(cfg, clockFor(opts.now, cfg.getTimeZone()));

			String response;
			if (CMD_SUMMARIZE.equals(opts.command)) {
				SummaryRequest req = codec.readSummaryRequest(readAll(in));
				response = codec.writeSummary(pipeline.summarize(req.getHistory(), req.isEmergencyMode()));
			} else {
				PatientData data = (opts.csvPath != null) ? fromCsv(opts.csvPath)
						: codec.readPredictionRequest(readAll(in));
				if (opts.age != null) {
					data.setAge(opts.age);
				}
				PredictionResult result = pipeline.predict(data);
				response = codec.writePrediction(result);
			}
			out.println(response);
			out.flush();
			return EXIT_OK;
		} catch (PayloadException e) {
			Logger.warn("Rejected request: {}", describe(e));
			out.println(codec.writeError(INVALID_REQUEST + describe(e)));
		} catch (Exception e) {
			Logger.error("Processing failed", e);
			out.println(codec.writeError(PROCESSING_FAILED + describe(e)));
		}
		out.flush();
		return EXIT_ERROR;
	}

	/** The message, or the exception type when there is none. */
	static String describe(Throwable e) {
		return e.getMessage() != null ? e.getMessage() : e.toString();
	}

	private static ConfigLoader loadConfig(String configPath) {
		ConfigLoader cfg = (configPath == null) ? new ConfigLoader() : new ConfigLoader(Paths.get(configPath));
		List<String> issues = cfg.validate();
		for (String issue : issues) {
			Logger.warn("Config: {}", issue);
		}
		return cfg;
	}

	/** Fixed at the start of the pinned day, or the system clock. */
	static Clock clockFor(LocalDate now, ZoneId zone) {
		if (now == null) {
			return Clock.system(zone);
		}
		return Clock.fixed(now.atStartOfDay(zone).toInstant(), zone);
	}

	private static PatientData fromCsv(Path csv) throws IOException {
		PatientData data = new PatientData();
		data.setRecords(new CsvRecordLoader().load(csv));
		Logger.info("Read {} record(s) from {}", data.getRecords().size(), csv);
		return data;
	}

	private static String readAll(InputStream in) throws IOException {
		return new String(in.readAllBytes(), StandardCharsets.UTF_8);
	}

	/** Parsed command line. */
	static final class Options {
		String command;
		Path csvPath;
		Integer age;
		LocalDate now;
		String configPath;

		static Options parse(String[] args) {
			if (args == null || args.length == 0) {
				throw new PayloadException("missing command (expected '" + CMD_SUMMARIZE + "' or '" + CMD_PREDICT + "')");
			}
			Options o = new Options();
			o.command = args[0];
			if (!CMD_SUMMARIZE.equals(o.command) && !CMD_PREDICT.equals(o.command)) {
				throw new PayloadException("unknown command '" + o.command + "'");
			}
			for (int i = 1; i < args.length; i++) {
				String flag = args[i];
				switch (flag) {
				case "--csv":
					o.csvPath = Paths.get(value(args, ++i, flag));
					break;
				case "--age":
					o.age = parseAge(value(args, ++i, flag));
					break;
				case "--now":
					o.now = parseDate(value(args, ++i, flag));
					break;
				case "--config":
					o.configPath = value(args, ++i, flag);
					break;
				default:
					throw new PayloadException("unknown option '" + flag + "'");
				}
			}
			if (o.csvPath != null && !CMD_PREDICT.equals(o.command)) {
				throw new PayloadException("--csv is only supported by '" + CMD_PREDICT + "'");
			}
			return o;
		}

		private static String value(String[] args, int i, String flag) {
			if (i >= args.length || StringUtils.isBlank(args[i])) {
				throw new PayloadException("missing value for " + flag);
			}
			return args[i];
		}

		private static Integer parseAge(String raw) {
			try {
				int age = Integer.parseInt(raw.trim());
				if (age < 0) {
					throw new PayloadException("--age must not be negative");
				}
				return age;
			} catch (NumberFormatException e) {
				throw new PayloadException("--age must be an integer: " + raw, e);
			}
		}

		private static LocalDate parseDate(String raw) {
			try {
				return LocalDate.parse(raw.trim());
			} catch (DateTimeParseException e) {
				throw new PayloadException("--now must be yyyy-MM-dd: " + raw, e);
			}
		}
	}
}
