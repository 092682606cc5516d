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
import java.util.Optional;
import java.util.concurrent.Executor;

import cascade.util.Logger;
import cascade.util.Loggers;
import org.jspecify.annotations.Nullable;

/**
 * Immutable configuration of a {@link Stage}, created through {@link #builder()}.
 * <p>
 * Defaults for the worker count and the broadcast pool size are read from the
 * {@value #WORKERS_PROPERTY} and {@value #BROADCAST_THREADS_PROPERTY} system properties
 * each time a builder is created.
 */
public final class StageSpec {

	/**
	 * System property holding the default number of workers of a stage. Falls back to 1.
	 */
	public static final String WORKERS_PROPERTY = "cascade.stage.workers";

	/**
	 * System property holding the default size of a stage's broadcast pool. Falls back
	 * to 0, an unbounded pool spawning threads on demand.
	 */
	public static final String BROADCAST_THREADS_PROPERTY = "cascade.stage.broadcastThreads";

	public static final String DEFAULT_NAME = "stage";

	final String             name;
	final int                workers;
	@Nullable
	final Logger             logger;
	final boolean            daemon;
	final int                broadcastThreads;
	@Nullable
	final Executor           broadcastExecutor;

	StageSpec(Builder builder) {
		this.name = builder.name;
		this.workers = builder.workers;
		this.logger = builder.logger;
		this.daemon = builder.daemon;
		this.broadcastThreads = builder.broadcastThreads;
		this.broadcastExecutor = builder.broadcastExecutor;
	}

	/**
	 * @return a new {@link Builder} initialized with the defaults
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a spec holding only the defaults
	 */
	public static StageSpec defaults() {
		return builder().build();
	}

	/**
	 * @param workers the number of workers, values lower than 1 meaning 1
	 * @return a spec with the given worker count and defaults otherwise
	 */
	public static StageSpec ofWorkers(int workers) {
		return builder().workers(workers).build();
	}

	/**
	 * @return the name of the stage, used as its threads name prefix
	 */
	public String name() {
		return name;
	}

	/**
	 * @return the configured number of workers, as given to the builder
	 */
	public int workers() {
		return workers;
	}

	/**
	 * @return the logger of the stage, a fresh {@link Loggers#noOp(String) no-op}
	 * logger if none was configured
	 */
	public Logger logger() {
		return logger != null ? logger : Loggers.noOp(name);
	}

	public boolean daemon() {
		return daemon;
	}

	/**
	 * @return the size of the broadcast pool owned by the stage, 0 for unbounded
	 */
	public int broadcastThreads() {
		return broadcastThreads;
	}

	/**
	 * @return the external broadcast executor, if one was configured
	 */
	public Optional<Executor> broadcastExecutor() {
		return Optional.ofNullable(broadcastExecutor);
	}

	/**
	 * @return a builder initialized with this spec's values
	 */
	public Builder toBuilder() {
		Builder b = new Builder();
		b.name = name;
		b.workers = workers;
		b.logger = logger;
		b.daemon = daemon;
		b.broadcastThreads = broadcastThreads;
		b.broadcastExecutor = broadcastExecutor;
		return b;
	}

	@Override
	public String toString() {
		return "StageSpec{name=" + name + ", workers=" + workers +
				", broadcastThreads=" + broadcastThreads +
				", externalBroadcast=" + (broadcastExecutor != null) + "}";
	}

	public static final class Builder {

		String             name = DEFAULT_NAME;
		int                workers = intProperty(WORKERS_PROPERTY, 1);
		@Nullable
		Logger             logger;
		boolean            daemon = true;
		int                broadcastThreads = intProperty(BROADCAST_THREADS_PROPERTY, 0);
		@Nullable
		Executor           broadcastExecutor;

		Builder() {
		}

		public Builder name(String name) {
			this.name = Objects.requireNonNull(name, "name");
			return this;
		}

		/**
		 * @param workers the number of workers, values lower than 1 meaning 1
		 * @return this builder
		 */
		public Builder workers(int workers) {
			this.workers = workers;
			return this;
		}

		public Builder logger(Logger logger) {
			this.logger = Objects.requireNonNull(logger, "logger");
			return this;
		}

		/**
		 * @param daemon whether the stage's threads are daemon threads (default true)
		 * @return this builder
		 */
		public Builder daemon(boolean daemon) {
			this.daemon = daemon;
			return this;
		}

		/**
		 * Bound the broadcast pool owned by the stage to the given number of threads,
		 * queueing the broadcasts that exceed it. 0 means unbounded.
		 *
		 * @param broadcastThreads the pool size, 0 or more
		 * @return this builder
		 */
		public Builder broadcastThreads(int broadcastThreads) {
			this.broadcastThreads = broadcastThreads;
			return this;
		}

		/**
		 * Broadcast through an external {@link Executor} instead of a pool owned by the
		 * stage. The stage never shuts that executor down.
		 *
		 * @param executor the executor running broadcasts
		 * @return this builder
		 */
		public Builder broadcastExecutor(Executor executor) {
			this.broadcastExecutor = Objects.requireNonNull(executor, "executor");
			return this;
		}

		/**
		 * @return the immutable spec
		 * @throws IllegalArgumentException if the broadcast pool size is negative
		 */
		public StageSpec build() {
			if (broadcastThreads < 0) {
				throw new IllegalArgumentException("broadcastThreads must be >= 0, was " + broadcastThreads);
			}
			return new StageSpec(this);
		}
	}

	static int intProperty(String property, int fallback) {
		return Optional.ofNullable(System.getProperty(property))
		               .map(String::trim)
		               .map(Integer::parseInt)
		               .orElse(fallback);
	}
}
