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

package cascade.core;

import org.jspecify.annotations.Nullable;

/**
 * Exception handling utilities shared by stages: classification of fatal errors,
 * wrapping of checked exceptions and of processor faults.
 */
public abstract class Exceptions {

	/**
	 * Wrap a {@link Throwable} thrown by a processor into the exception broadcast to
	 * subscribers in its place. Instances created by this method can be detected with
	 * {@link #isFault(Throwable)} and the original failure is their
	 * {@link Throwable#getCause() cause}.
	 * <p>This method invokes {@link #throwIfJvmFatal(Throwable)}.
	 *
	 * @param cause the throwable raised by the processor, or null if the processor
	 * returned no outcome at all
	 * @param stage the name of the stage the fault happened in
	 * @return a new fault exception
	 */
	public static RuntimeException fault(@Nullable Throwable cause, String stage) {
		throwIfJvmFatal(cause);
		if (cause == null) {
			return new ProcessorFaultException("Processor of stage " + stage + " returned no outcome");
		}
		return new ProcessorFaultException("Processor of stage " + stage + " faulted: " + cause, cause);
	}

	/**
	 * Check whether the provided {@link Throwable} was produced by {@link #fault(Throwable, String)}.
	 *
	 * @param t the {@link Throwable} to check, may be null
	 * @return true if the throwable is a processor fault
	 */
	public static boolean isFault(@Nullable Throwable t) {
		return t instanceof ProcessorFaultException;
	}

	/**
	 * Prepare an unchecked {@link RuntimeException} to be thrown in place of the given
	 * one: runtime exceptions are returned as is, checked exceptions are wrapped.
	 * <p>This method invokes {@link #throwIfJvmFatal(Throwable)}.
	 *
	 * @param t the root cause
	 * @return an unchecked exception
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfJvmFatal(t);
		if (t instanceof RuntimeException) {
			return (RuntimeException) t;
		}
		return new CascadeException(t);
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties native to the JVM, which no stage attempts to contain:
	 * <ul> <li>{@link VirtualMachineError}</li> <li>{@link ThreadDeath}</li>
	 * <li>{@link LinkageError}</li> </ul>
	 *
	 * @param t the exception to evaluate
	 */
	@SuppressWarnings("deprecation")
	public static void throwIfJvmFatal(@Nullable Throwable t) {
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		if (t instanceof ThreadDeath) {
			throw (ThreadDeath) t;
		}
		if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Unwrap a {@code Throwable} wrapped via {@link #propagate(Throwable)} or
	 * {@link #fault(Throwable, String)}.
	 *
	 * @param t the exception to unwrap
	 * @return the unwrapped exception, or the given one if it wasn't wrapped
	 */
	public static Throwable unwrap(Throwable t) {
		Throwable _t = t;
		while (_t instanceof CascadeException) {
			_t = _t.getCause();
		}
		return _t == null ? t : _t;
	}

	Exceptions() {
	}

	/**
	 * Wrapper for a checked exception crossing an API that can only throw unchecked ones.
	 */
	static class CascadeException extends RuntimeException {

		CascadeException(Throwable cause) {
			super(cause);
		}

		CascadeException(String message) {
			super(message);
		}

		CascadeException(String message, Throwable cause) {
			super(message, cause);
		}

		private static final long serialVersionUID = 4206417416226154410L;
	}

	/**
	 * A failure raised by a processor rather than reported through its outcome, converted
	 * to data and broadcast to the subscribers of the stage it happened in.
	 */
	static final class ProcessorFaultException extends CascadeException {

		ProcessorFaultException(String message) {
			super(message);
		}

		ProcessorFaultException(String message, Throwable cause) {
			super(message, cause);
		}

		private static final long serialVersionUID = -3360413282719504927L;
	}
}
