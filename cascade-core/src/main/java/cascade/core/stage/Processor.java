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

import java.util.function.Function;

import cascade.util.context.Context;
import org.jspecify.annotations.Nullable;

/**
 * The unit of work a {@link Stage} runs for every payload it receives.
 * <p>
 * Each invocation gets the payload's {@link Context} and exactly one of a non-null
 * incoming error (the payload came through {@link Stage#error}) or a non-null incoming
 * value (it came through {@link Stage#data}). The returned {@link Outcome} decides what
 * is broadcast to the subscribers of the stage.
 * <p>
 * A processor is invoked concurrently by every worker of its stage and must be safe
 * for that. Throwing from {@link #process} (or returning null) is a fault: the stage
 * logs it and broadcasts a wrapping error instead, then carries on with the next
 * payload. Honoring {@link Context#isExpired()} is the processor's own business.
 *
 * @param <I> the type of values accepted
 * @param <O> the type of values produced
 */
@FunctionalInterface
public interface Processor<I, O> {

	/**
	 * Process one payload.
	 *
	 * @param context the execution context submitted along with the payload
	 * @param error the incoming error, or null for a data payload
	 * @param value the incoming value, or null for an error payload
	 * @return the outcome to broadcast, never null
	 * @throws Exception to signal a fault
	 */
	Outcome<O> process(Context context, @Nullable Throwable error, @Nullable I value) throws Exception;

	/**
	 * A processor forwarding values and errors unchanged.
	 *
	 * @param <T> the type of values
	 * @return the identity processor
	 */
	static <T> Processor<T, T> identity() {
		return (context, error, value) -> error != null ? Outcome.failure(error) : Outcome.ofNullable(value);
	}

	/**
	 * Adapt a value-only {@link Function}: values are mapped, incoming errors are
	 * forwarded unchanged, and a null result broadcasts nothing.
	 *
	 * @param mapper the function applied to each value
	 * @param <I> the type of values accepted
	 * @param <O> the type of values produced
	 * @return a processor applying the function
	 */
	static <I, O> Processor<I, O> map(Function<? super I, ? extends O> mapper) {
		return (context, error, value) -> {
			if (error != null) {
				return Outcome.failure(error);
			}
			return Outcome.ofNullable(mapper.apply(value));
		};
	}
}
