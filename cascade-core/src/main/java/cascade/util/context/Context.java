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

package cascade.util.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The execution context travelling with every unit of work through a pipeline of
 * stages: an immutable key/value store plus a lifetime that can be cancelled or given
 * a deadline.
 * <p>
 * {@link Context} implementations are thread-safe and immutable: {@link #put(Object, Object)}
 * returns a new {@link Context} that shares the lifetime of the original. Stages never
 * inspect the lifetime, they only forward the context to processors, which may choose to
 * stop early once {@link #isExpired()}.
 * <p>
 * Expiry is evaluated lazily when queried, no timer is involved.
 */
public interface Context extends ContextView {

	/**
	 * Return an empty {@link Context} that never expires.
	 *
	 * @return an empty {@link Context}
	 */
	static Context empty() {
		return Context0.INSTANCE;
	}

	/**
	 * Create a non-expiring {@link Context} pre-initialized with one key-value pair.
	 *
	 * @param key the key to initialize.
	 * @param value the value for the key.
	 * @return a {@link Context} with a single entry.
	 * @throws NullPointerException if either key or value are null
	 */
	static Context of(Object key, Object value) {
		return empty().put(key, value);
	}

	/**
	 * Create a non-expiring {@link Context} pre-initialized with two key-value pairs.
	 *
	 * @param key1 the first key to initialize.
	 * @param value1 the value for the first key.
	 * @param key2 the second key to initialize.
	 * @param value2 the value for the second key.
	 * @return a {@link Context} with two entries.
	 * @throws NullPointerException if any key or value is null
	 */
	static Context of(Object key1, Object value1, Object key2, Object value2) {
		return empty().put(key1, value1).put(key2, value2);
	}

	/**
	 * Create an empty root {@link CancellableContext}, with no deadline.
	 *
	 * @return a new cancellable context
	 */
	static CancellableContext cancellable() {
		return cancellable(Clock.systemUTC());
	}

	/**
	 * Create an empty root {@link CancellableContext} whose deadlines are evaluated
	 * against the given {@link Clock}.
	 *
	 * @param clock the clock to evaluate deadlines against
	 * @return a new cancellable context
	 */
	static CancellableContext cancellable(Clock clock) {
		return new ContextN(Lifetime.root(Objects.requireNonNull(clock, "clock")));
	}

	/**
	 * Create a new {@link Context} with the given key/value pair added (or replaced),
	 * sharing the lifetime of this one.
	 *
	 * @param key the key to add/update in the new {@link Context}
	 * @param value the value to associate to the key in the new {@link Context}
	 * @return a new {@link Context} including the provided key/value
	 * @throws NullPointerException if either the key or value are null
	 */
	Context put(Object key, Object value);

	/**
	 * Derive a {@link CancellableContext} holding the same key/value pairs. It is
	 * expired when cancelled itself, or when this context expires.
	 *
	 * @return a new child context
	 */
	CancellableContext withCancellation();

	/**
	 * Derive a {@link CancellableContext} holding the same key/value pairs which
	 * expires after the given timeout, when cancelled, or when this context expires,
	 * whichever happens first.
	 *
	 * @param timeout the time to live of the child, from now
	 * @return a new child context
	 */
	CancellableContext withTimeout(Duration timeout);

	/**
	 * @return true once this context was cancelled, passed its deadline, or has an
	 * expired parent
	 */
	boolean isExpired();

	/**
	 * @return the earliest deadline applying to this context, if any
	 */
	Optional<Instant> deadline();

	/**
	 * Return the time left before the {@link #deadline()}, {@link Duration#ZERO} once
	 * it has passed, or an empty {@link Optional} if no deadline applies.
	 *
	 * @return the remaining time to live
	 */
	Optional<Duration> timeRemaining();
}
