package org.javai.errata.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.errata.Cause;
import org.javai.errata.ErrorCategory;
import org.javai.errata.ErrorKind;
import org.javai.errata.ops.OpReporter;

/**
 * Reports failures through Log4j2.
 *
 * <p>The log level follows the failure's {@link ErrorCategory}:
 * <ul>
 *   <li>{@code IO} → WARN</li>
 *   <li>{@code PARSE}, {@code PARSE_FLOAT} → INFO</li>
 *   <li>{@code DOMAIN} → INFO</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.errata.OpReporter"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, ErrorKind kind) {
		logger.atLevel(levelFor(kind.category()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(operation, kind));
	}

	static String formatFailureMessage(String operation, ErrorKind kind) {
		return "Failure in operation [%s]: %s | code=%s%s".formatted(
				operation,
				kind.describe(),
				kind.code(),
				formatCause(kind));
	}

	private static String formatCause(ErrorKind kind) {
		Cause cause = causeOf(kind);
		return cause != null ? ", cause=" + cause.type() : "";
	}

	private static Cause causeOf(ErrorKind kind) {
		if (kind instanceof ErrorKind.Io io) {
			return io.cause();
		}
		if (kind instanceof ErrorKind.Parse parse) {
			return parse.cause();
		}
		if (kind instanceof ErrorKind.ParseFloat parseFloat) {
			return parseFloat.cause();
		}
		return null;
	}

	static Level levelFor(ErrorCategory category) {
		return switch (category) {
			case IO -> Level.WARN;
			case PARSE, PARSE_FLOAT -> Level.INFO;
			case DOMAIN -> Level.INFO;
		};
	}
}
