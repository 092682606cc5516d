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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.jspecify.annotations.Nullable;

/**
 * The cancellation and deadline state shared by a {@link Context} and every context
 * {@link Context#put(Object, Object) derived} from it with the same lifetime. A child
 * lifetime is expired whenever one of its ancestors is.
 */
final class Lifetime {

	static final Lifetime ETERNAL = new Lifetime(Clock.systemUTC(), null, null, false);

	final Clock              clock;
	@Nullable
	final Lifetime           parent;
	@Nullable
	final Instant            deadline;
	final boolean            cancellable;

	volatile int cancelled;
	static final AtomicIntegerFieldUpdater<Lifetime> CANCELLED =
			AtomicIntegerFieldUpdater.newUpdater(Lifetime.class, "cancelled");

	Lifetime(Clock clock, @Nullable Lifetime parent, @Nullable Instant deadline, boolean cancellable) {
		this.clock = clock;
		this.parent = parent;
		this.deadline = deadline;
		this.cancellable = cancellable;
	}

	static Lifetime root(Clock clock) {
		return new Lifetime(clock, null, null, true);
	}

	Lifetime child() {
		return new Lifetime(clock, this == ETERNAL ? null : this, null, true);
	}

	Lifetime child(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout");
		return new Lifetime(clock, this == ETERNAL ? null : this, clock.instant().plus(timeout), true);
	}

	boolean cancel() {
		return cancellable && CANCELLED.compareAndSet(this, 0, 1);
	}

	boolean isCancelled() {
		return cancelled == 1;
	}

	boolean isExpired() {
		for (Lifetime l = this; l != null; l = l.parent) {
			if (l.cancelled == 1) {
				return true;
			}
			if (l.deadline != null && !l.clock.instant().isBefore(l.deadline)) {
				return true;
			}
		}
		return false;
	}

	@Nullable
	Instant deadline() {
		Instant earliest = null;
		for (Lifetime l = this; l != null; l = l.parent) {
			if (l.deadline != null && (earliest == null || l.deadline.isBefore(earliest))) {
				earliest = l.deadline;
			}
		}
		return earliest;
	}

	@Nullable
	Duration timeRemaining() {
		Instant d = deadline();
		if (d == null) {
			return null;
		}
		Duration left = Duration.between(clock.instant(), d);
		return left.isNegative() ? Duration.ZERO : left;
	}

	@Override
	public String toString() {
		if (this == ETERNAL) {
			return "eternal";
		}
		return "Lifetime{expired=" + isExpired() + ", deadline=" + deadline() + "}";
	}
}
