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

package cascade.core.stage;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * The result of one {@link Processor} invocation: a value to forward to the
 * subscribers' {@link Stage#data data}, an error to forward to their
 * {@link Stage#error error}, or nothing at all.
 *
 * @param <T> the type of the value
 */
public final class Outcome<T> {

	static final Outcome<Object> EMPTY = new Outcome<>(null, null);

	@Nullable
	final T         value;
	@Nullable
	final Throwable error;

	Outcome(@Nullable T value, @Nullable Throwable error) {
		this.value = value;
		this.error = error;
	}

	/**
	 * @param value the value to broadcast, not null
	 * @param <T> the type of the value
	 * @return an outcome forwarding the value to every subscriber
	 */
	public static <T> Outcome<T> success(T value) {
		return new Outcome<>(Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * @param error the error to broadcast, not null
	 * @param <T> the type of the value this outcome stands in for
	 * @return an outcome forwarding the error to every subscriber
	 */
	public static <T> Outcome<T> failure(Throwable error) {
		return new Outcome<>(null, Objects.requireNonNull(error, "error"));
	}

	/**
	 * @param <T> the type of the value this outcome stands in for
	 * @return an outcome that broadcasts nothing
	 */
	@SuppressWarnings("unchecked")
	public static <T> Outcome<T> empty() {
		return (Outcome<T>) EMPTY;
	}

	/**
	 * Turn a possibly null value into an outcome, {@link #empty()} for null.
	 *
	 * @param value the value, possibly null
	 * @param <T> the type of the value
	 * @return a success outcome, or the empty outcome
	 */
	public static <T> Outcome<T> ofNullable(@Nullable T value) {
		return value == null ? empty() : new Outcome<>(value, null);
	}

	public boolean isSuccess() {
		return value != null;
	}

	public boolean isFailure() {
		return error != null;
	}

	public boolean isEmpty() {
		return value == null && error == null;
	}

	@Nullable
	public T value() {
		return value;
	}

	@Nullable
	public Throwable error() {
		return error;
	}

	@Override
	public String toString() {
		if (error != null) {
			return "Outcome{failure=" + error + "}";
		}
		if (value != null) {
			return "Outcome{success=" + value + "}";
		}
		return "Outcome{empty}";
	}
}
