/*
 * Copyright (c) 2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package cascade.util;

import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.regex.Matcher;

import org.jspecify.annotations.Nullable;

/**
 * Expose static methods to get a {@link Logger} depending on the environment. If SLF4J
 * is on the classpath, it is used. Otherwise, loggers fall back to the Console, or to
 * {@link java.util.logging.Logger java.util.logging} when the {@value #FALLBACK_PROPERTY}
 * {@link System#setProperty(String, String) System property} is set to "{@code JDK}".
 * <p>
 * Stages do not use this factory by default: each stage is handed its logger at
 * construction and defaults to {@link #noOp(String)}. The factory is the convenient
 * way to obtain a real logger to inject.
 */
public abstract class Loggers {

	/**
	 * The system property that determines which fallback implementation to use for loggers
	 * when SLF4J isn't available. Use {@code JDK} for the JDK-backed logging and anything
	 * else for Console-based (the default).
	 */
	public static final String FALLBACK_PROPERTY = "cascade.logging.fallback";

	private static volatile Function<String, ? extends Logger> LOGGER_FACTORY;

	static {
		resetLoggerFactory();
	}

	/**
	 * Activate the SLF4J logger factory if available, falling back to Console or JDK
	 * loggers as defined by {@value #FALLBACK_PROPERTY}.
	 */
	public static void resetLoggerFactory() {
		try {
			useSl4jLoggers();
		}
		catch (Throwable t) {
			if (isFallbackToJdk()) {
				useJdkLoggers();
			}
			else {
				useConsoleLoggers();
			}
		}
	}

	static boolean isFallbackToJdk() {
		return "JDK".equalsIgnoreCase(System.getProperty(FALLBACK_PROPERTY));
	}

	/**
	 * Force Console loggers: ERROR and WARN go to {@link System#err}, INFO to
	 * {@link System#out}, TRACE and DEBUG are disabled.
	 */
	public static void useConsoleLoggers() {
		install(new ConsoleLoggerFactory(false), "Using Console logging");
	}

	/**
	 * Force Console loggers with every level enabled, including TRACE and DEBUG.
	 */
	public static void useVerboseConsoleLoggers() {
		install(new ConsoleLoggerFactory(true), "Using Verbose Console logging");
	}

	/**
	 * Use a custom type of {@link Logger} created through the provided {@link Function},
	 * which takes a logger name as input. The function must be thread-safe.
	 *
	 * @param loggerFactory the {@link Function} that provides a (possibly cached) {@link Logger}
	 * given a name.
	 */
	public static void useCustomLoggers(final Function<String, ? extends Logger> loggerFactory) {
		install(Objects.requireNonNull(loggerFactory, "loggerFactory"), "Using custom logging");
	}

	/**
	 * Force JDK-backed loggers, even if SLF4J is available.
	 */
	public static void useJdkLoggers() {
		install(name -> new JdkLogger(java.util.logging.Logger.getLogger(name)),
				"Using JDK logging framework");
	}

	/**
	 * Force SLF4J-backed loggers, throwing if SLF4J isn't on the classpath. Prefer
	 * {@link #resetLoggerFactory()} which falls back in that case.
	 */
	public static void useSl4jLoggers() {
		install(name -> new Slf4JLogger(org.slf4j.LoggerFactory.getLogger(name)),
				"Using Slf4j logging framework");
	}

	private static void install(Function<String, ? extends Logger> loggerFactory, String message) {
		//resolve one logger before swapping, so a missing backend throws here
		Logger self = loggerFactory.apply(Loggers.class.getName());
		LOGGER_FACTORY = loggerFactory;
		self.debug(message);
	}

	/**
	 * Get a {@link Logger} from the currently active factory.
	 *
	 * @param name the category or logger name to use
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(String name) {
		return LOGGER_FACTORY.apply(name);
	}

	/**
	 * Get a {@link Logger} named after the given class.
	 *
	 * @param cls the source {@link Class} to derive the logger name from
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(Class<?> cls) {
		return LOGGER_FACTORY.apply(cls.getName());
	}

	/**
	 * Create a {@link Logger} that discards every event and reports every level as
	 * disabled. Each call returns a distinct instance.
	 *
	 * @param name the name reported by {@link Logger#getName()}
	 * @return a new no-op {@link Logger}
	 */
	public static Logger noOp(String name) {
		return new NoOpLogger(name);
	}

	/**
	 * Replace each {@code {}} placeholder of the format with the next argument, the way
	 * SLF4J does for the simple cases.
	 *
	 * @param from the format
	 * @param arguments the arguments, possibly null
	 * @return the formatted message, or null if the format is null
	 */
	@Nullable
	static String format(@Nullable String from, @Nullable Object... arguments) {
		if (from == null || arguments == null || arguments.length == 0) {
			return from;
		}
		String computed = from;
		for (Object argument : arguments) {
			computed = computed.replaceFirst("\\{\\}", Matcher.quoteReplacement(String.valueOf(argument)));
		}
		return computed;
	}

	private static final class Slf4JLogger implements Logger {

		private final org.slf4j.Logger logger;

		Slf4JLogger(org.slf4j.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		public boolean isTraceEnabled() {
			return logger.isTraceEnabled();
		}

		@Override
		public void trace(String msg) {
			logger.trace(msg);
		}

		@Override
		public void trace(String format, Object... arguments) {
			logger.trace(format, arguments);
		}

		@Override
		public void trace(String msg, Throwable t) {
			logger.trace(msg, t);
		}

		@Override
		public boolean isDebugEnabled() {
			return logger.isDebugEnabled();
		}

		@Override
		public void debug(String msg) {
			logger.debug(msg);
		}

		@Override
		public void debug(String format, Object... arguments) {
			logger.debug(format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			logger.debug(msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return logger.isInfoEnabled();
		}

		@Override
		public void info(String msg) {
			logger.info(msg);
		}

		@Override
		public void info(String format, Object... arguments) {
			logger.info(format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			logger.info(msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return logger.isWarnEnabled();
		}

		@Override
		public void warn(String msg) {
			logger.warn(msg);
		}

		@Override
		public void warn(String format, Object... arguments) {
			logger.warn(format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logger.warn(msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return logger.isErrorEnabled();
		}

		@Override
		public void error(String msg) {
			logger.error(msg);
		}

		@Override
		public void error(String format, Object... arguments) {
			logger.error(format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			logger.error(msg, t);
		}
	}

	/**
	 * Base for the non-SLF4J loggers: every method funnels into
	 * {@link #log(LogLevel, String, Throwable)} once the level is known to be enabled.
	 */
	abstract static class LevelLogger implements Logger {

		enum LogLevel {
			TRACE("[TRACE]", Level.FINEST),
			DEBUG("[DEBUG]", Level.FINE),
			INFO("[ INFO]", Level.INFO),
			WARN("[ WARN]", Level.WARNING),
			ERROR("[ERROR]", Level.SEVERE);

			final String tag;
			final Level  jdk;

			LogLevel(String tag, Level jdk) {
				this.tag = tag;
				this.jdk = jdk;
			}
		}

		abstract boolean isEnabled(LogLevel level);

		abstract void log(LogLevel level, @Nullable String msg, @Nullable Throwable t);

		private void logIfEnabled(LogLevel level, @Nullable String msg, @Nullable Throwable t) {
			if (isEnabled(level)) {
				log(level, msg, t);
			}
		}

		private void formatIfEnabled(LogLevel level, String format, Object... arguments) {
			if (isEnabled(level)) {
				log(level, Loggers.format(format, arguments), null);
			}
		}

		@Override
		public boolean isTraceEnabled() {
			return isEnabled(LogLevel.TRACE);
		}

		@Override
		public void trace(String msg) {
			logIfEnabled(LogLevel.TRACE, msg, null);
		}

		@Override
		public void trace(String format, Object... arguments) {
			formatIfEnabled(LogLevel.TRACE, format, arguments);
		}

		@Override
		public void trace(String msg, Throwable t) {
			logIfEnabled(LogLevel.TRACE, msg, t);
		}

		@Override
		public boolean isDebugEnabled() {
			return isEnabled(LogLevel.DEBUG);
		}

		@Override
		public void debug(String msg) {
			logIfEnabled(LogLevel.DEBUG, msg, null);
		}

		@Override
		public void debug(String format, Object... arguments) {
			formatIfEnabled(LogLevel.DEBUG, format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			logIfEnabled(LogLevel.DEBUG, msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return isEnabled(LogLevel.INFO);
		}

		@Override
		public void info(String msg) {
			logIfEnabled(LogLevel.INFO, msg, null);
		}

		@Override
		public void info(String format, Object... arguments) {
			formatIfEnabled(LogLevel.INFO, format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			logIfEnabled(LogLevel.INFO, msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return isEnabled(LogLevel.WARN);
		}

		@Override
		public void warn(String msg) {
			logIfEnabled(LogLevel.WARN, msg, null);
		}

		@Override
		public void warn(String format, Object... arguments) {
			formatIfEnabled(LogLevel.WARN, format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logIfEnabled(LogLevel.WARN, msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return isEnabled(LogLevel.ERROR);
		}

		@Override
		public void error(String msg) {
			logIfEnabled(LogLevel.ERROR, msg, null);
		}

		@Override
		public void error(String format, Object... arguments) {
			formatIfEnabled(LogLevel.ERROR, format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			logIfEnabled(LogLevel.ERROR, msg, t);
		}
	}

	/**
	 * Wrapper over JDK logger
	 */
	static final class JdkLogger extends LevelLogger {

		private final java.util.logging.Logger logger;

		JdkLogger(java.util.logging.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		boolean isEnabled(LogLevel level) {
			return logger.isLoggable(level.jdk);
		}

		@Override
		void log(LogLevel level, @Nullable String msg, @Nullable Throwable t) {
			if (t == null) {
				logger.log(level.jdk, msg);
			}
			else {
				logger.log(level.jdk, msg, t);
			}
		}
	}

	/**
	 * A {@link Logger} writing ERROR and WARN to one {@link PrintStream} and the other
	 * levels to another. TRACE and DEBUG are only enabled when verbose.
	 */
	static final class ConsoleLogger extends LevelLogger {

		private final String      name;
		private final boolean     verbose;
		private final PrintStream log;
		private final PrintStream err;

		ConsoleLogger(String name, PrintStream log, PrintStream err, boolean verbose) {
			this.name = name;
			this.log = log;
			this.err = err;
			this.verbose = verbose;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		boolean isEnabled(LogLevel level) {
			return verbose || level.compareTo(LogLevel.INFO) >= 0;
		}

		@Override
		synchronized void log(LogLevel level, @Nullable String msg, @Nullable Throwable t) {
			PrintStream target = level.compareTo(LogLevel.WARN) >= 0 ? err : log;
			if (t == null) {
				target.format("%s (%s) %s\n", level.tag, Thread.currentThread().getName(), msg);
			}
			else {
				target.format("%s (%s) %s - %s\n", level.tag, Thread.currentThread().getName(), msg, t);
				t.printStackTrace(target);
			}
		}

		@Override
		public String toString() {
			return "ConsoleLogger[name=" + name + ", verbose=" + verbose + "]";
		}
	}

	static final class ConsoleLoggerFactory implements Function<String, Logger> {

		final boolean verbose;
		final ConcurrentMap<String, Logger> cache = new ConcurrentHashMap<>();

		ConsoleLoggerFactory(boolean verbose) {
			this.verbose = verbose;
		}

		@Override
		public Logger apply(String name) {
			return cache.computeIfAbsent(name, n -> new ConsoleLogger(n, System.out, System.err, verbose));
		}
	}

	static final class NoOpLogger extends LevelLogger {

		private final String name;

		NoOpLogger(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		boolean isEnabled(LogLevel level) {
			return false;
		}

		@Override
		void log(LogLevel level, @Nullable String msg, @Nullable Throwable t) {
		}

		@Override
		public String toString() {
			return "NoOpLogger[name=" + name + "]";
		}
	}

	Loggers() {
	}
}
