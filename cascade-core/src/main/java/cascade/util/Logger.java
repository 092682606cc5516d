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

/**
 * Logger interface used by stages and the rest of cascade. The {@link #getName() name}
 * identifies the component emitting the event, and the {@code format} variants take
 * SLF4J-style {@code {}} placeholders for the key/value data attached to a message.
 * <p>
 * Implementations must never throw from a logging method: a failing logger would
 * otherwise break the pipeline that called it.
 *
 * @see Loggers
 */
public interface Logger {

	/**
	 * Return the name of this {@link Logger}, usually the component it reports for.
	 *
	 * @return name of this logger instance
	 */
	String getName();

	/**
	 * @return true if this logger is enabled for the TRACE level
	 */
	boolean isTraceEnabled();

	/**
	 * Log a message at the TRACE level.
	 *
	 * @param msg the message string to be logged
	 */
	void trace(String msg);

	/**
	 * Log a message at the TRACE level, replacing each {@code {}} in the format with
	 * the next argument.
	 *
	 * @param format    the format string
	 * @param arguments the values to substitute
	 */
	void trace(String format, Object... arguments);

	/**
	 * Log an exception at the TRACE level with an accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t   the exception (throwable) to log
	 */
	void trace(String msg, Throwable t);

	/**
	 * @return true if this logger is enabled for the DEBUG level
	 */
	boolean isDebugEnabled();

	void debug(String msg);

	void debug(String format, Object... arguments);

	void debug(String msg, Throwable t);

	/**
	 * @return true if this logger is enabled for the INFO level
	 */
	boolean isInfoEnabled();

	void info(String msg);

	void info(String format, Object... arguments);

	void info(String msg, Throwable t);

	/**
	 * @return true if this logger is enabled for the WARN level
	 */
	boolean isWarnEnabled();

	void warn(String msg);

	void warn(String format, Object... arguments);

	void warn(String msg, Throwable t);

	/**
	 * @return true if this logger is enabled for the ERROR level
	 */
	boolean isErrorEnabled();

	void error(String msg);

	void error(String format, Object... arguments);

	void error(String msg, Throwable t);

	/**
	 * Log an exception at the ERROR level, with a message whose {@code {}}
	 * placeholders are replaced by the given arguments. The default implementation
	 * only formats the message when ERROR is enabled.
	 *
	 * @param t         the exception to log
	 * @param format    the format string
	 * @param arguments the values to substitute
	 */
	default void error(Throwable t, String format, Object... arguments) {
		if (isErrorEnabled()) {
			error(Loggers.format(format, arguments), t);
		}
	}
}
