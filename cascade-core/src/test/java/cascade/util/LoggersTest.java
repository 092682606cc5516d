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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.logging.Level;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LoggersTest {

	@AfterAll
	static void resetLoggerFactory() {
		Loggers.resetLoggerFactory();
	}

	@Test
	void dontFallbackToJdk() {
		String oldValue = System.getProperty(Loggers.FALLBACK_PROPERTY);

		System.setProperty(Loggers.FALLBACK_PROPERTY, "something");
		try {
			assertThat(Loggers.isFallbackToJdk()).isFalse();
		}
		finally {
			if (oldValue == null) System.clearProperty(Loggers.FALLBACK_PROPERTY);
			else System.setProperty(Loggers.FALLBACK_PROPERTY, oldValue);
		}
	}

	@Test
	void fallbackToJdk() {
		String oldValue = System.getProperty(Loggers.FALLBACK_PROPERTY);

		System.setProperty(Loggers.FALLBACK_PROPERTY, "JdK");
		try {
			assertThat(Loggers.isFallbackToJdk()).isTrue();
		}
		finally {
			if (oldValue == null) System.clearProperty(Loggers.FALLBACK_PROPERTY);
			else System.setProperty(Loggers.FALLBACK_PROPERTY, oldValue);
		}
	}

	@Test
	void slf4jIsTheDefaultWhenOnTheClasspath() {
		Loggers.resetLoggerFactory();
		Logger l = Loggers.getLogger(LoggersTest.class);

		assertThat(l.getClass().getSimpleName()).isEqualTo("Slf4JLogger");
		assertThat(l.getName()).isEqualTo(LoggersTest.class.getName());
	}

	@Test
	void useConsoleLoggers() {
		try {
			Loggers.useConsoleLoggers();
			Logger l = Loggers.getLogger("test");

			assertThat(l.getClass().getSimpleName()).isEqualTo("ConsoleLogger");
			assertThat(l.isDebugEnabled()).as("debug").isFalse();
			assertThat(l.isInfoEnabled()).as("info").isTrue();
			assertThat(Loggers.getLogger("test")).as("cached").isSameAs(l);
		}
		finally {
			Loggers.resetLoggerFactory();
		}
	}

	@Test
	void useVerboseConsoleLoggers() {
		try {
			Loggers.useVerboseConsoleLoggers();
			Logger l = Loggers.getLogger("test");

			assertThat(l.getClass().getSimpleName()).isEqualTo("ConsoleLogger");
			assertThat(l.isTraceEnabled()).isTrue();
		}
		finally {
			Loggers.resetLoggerFactory();
		}
	}

	@Test
	void useJdkLoggers() {
		try {
			Loggers.useJdkLoggers();
			Logger l = Loggers.getLogger("test");

			assertThat(l.getClass().getSimpleName()).isEqualTo("JdkLogger");
		}
		finally {
			Loggers.resetLoggerFactory();
		}
	}

	@Test
	void useCustomLoggers() {
		Logger custom = Loggers.noOp("custom");
		try {
			Loggers.useCustomLoggers(name -> custom);

			assertThat(Loggers.getLogger("anything")).isSameAs(custom);
		}
		finally {
			Loggers.resetLoggerFactory();
		}
	}

	@Test
	void logWhenUsingJdkLoggers() {
		java.util.logging.Logger jdkLogger = mock(java.util.logging.Logger.class);
		when(jdkLogger.isLoggable(any())).thenReturn(true);
		Loggers.JdkLogger log = new Loggers.JdkLogger(jdkLogger);

		log.warn("message: {}, {}", "foo", "bar");

		verify(jdkLogger, times(1)).log(Level.WARNING, "message: foo, bar");
	}

	@Test
	void logWithThrowableWhenUsingJdkLoggers() {
		java.util.logging.Logger jdkLogger = mock(java.util.logging.Logger.class);
		when(jdkLogger.isLoggable(any())).thenReturn(true);
		Loggers.JdkLogger log = new Loggers.JdkLogger(jdkLogger);
		Throwable t = new IllegalStateException("boom");

		log.error(t, "stage {} faulted", "parse");

		verify(jdkLogger, times(1)).log(Level.SEVERE, "stage parse faulted", t);
	}

	@Test
	void jdkLoggerSkipsDisabledLevels() {
		java.util.logging.Logger jdkLogger = mock(java.util.logging.Logger.class);
		when(jdkLogger.isLoggable(Level.FINE)).thenReturn(false);
		Loggers.JdkLogger log = new Loggers.JdkLogger(jdkLogger);

		log.debug("message: {}", "foo");

		verify(jdkLogger, never()).log(any(Level.class), anyString());
	}

	@Test
	void consoleLoggerRoutesWarnAndErrorToErr() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Loggers.ConsoleLogger log = new Loggers.ConsoleLogger("console", new PrintStream(out), new PrintStream(err), false);

		log.info("info {}", 1);
		log.debug("hidden");
		log.warn("warn {}", 2);
		log.error("error", new IllegalStateException("boom"));

		assertThat(out.toString())
				.contains("[ INFO]", "info 1")
				.doesNotContain("hidden");
		assertThat(err.toString())
				.contains("[ WARN]", "warn 2")
				.contains("[ERROR]", "error - java.lang.IllegalStateException: boom");
	}

	@Test
	void noOpLoggerDisablesEveryLevel() {
		Logger log = Loggers.noOp("quiet");

		log.error("never shown {}", 1);

		assertThat(log.getName()).isEqualTo("quiet");
		assertThat(log.isErrorEnabled()).isFalse();
		assertThat(log.isTraceEnabled()).isFalse();
		assertThat(Loggers.noOp("quiet")).isNotSameAs(log);
	}

	@Test
	void formatReplacesPlaceholdersInOrder() {
		assertThat(Loggers.format("{} -> {}", "a", 1)).isEqualTo("a -> 1");
		assertThat(Loggers.format("no args")).isEqualTo("no args");
		assertThat(Loggers.format("{} $1", "x")).isEqualTo("x $1");
		assertThat(Loggers.format("{}", (Object) null)).isEqualTo("null");
	}
}
