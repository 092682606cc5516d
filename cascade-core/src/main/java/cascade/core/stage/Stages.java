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
import java.util.concurrent.atomic.AtomicLong;

import cascade.util.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Factories and combinators for {@link Stage stages}: plain creation, creation
 * subscribed to an upstream, pass-through taps, and bridges out of a pipeline into a
 * {@link BlockingChannel}.
 * <p>
 * Every stage returned here is hot: its workers are already running, and it has to be
 * {@link Stage#shutdown() shut down} to release them.
 */
public abstract class Stages {

	/**
	 * Create a stage with the default {@link StageSpec}.
	 *
	 * @param processor the processor run for every payload
	 * @param <I> the type of values accepted
	 * @param <O> the type of values broadcast
	 * @return a new running {@link Stage}
	 */
	public static <I, O> Stage<I, O> create(Processor<I, O> processor) {
		return create(StageSpec.defaults(), processor);
	}

	/**
	 * Create a stage configured by the given {@link StageSpec}.
	 *
	 * @param spec the configuration of the stage
	 * @param processor the processor run for every payload
	 * @param <I> the type of values accepted
	 * @param <O> the type of values broadcast
	 * @return a new running {@link Stage}
	 */
	public static <I, O> Stage<I, O> create(StageSpec spec, Processor<I, O> processor) {
		Objects.requireNonNull(spec, "spec");
		return new DefaultStage<>(spec, processor);
	}

	/**
	 * Create a stage with the given number of workers and subscribe it to an upstream
	 * stage, if any. The new stage reports to the upstream's {@link Logger}.
	 *
	 * @param upstream the stage to subscribe to, or null
	 * @param workers the number of workers, values lower than 1 meaning 1
	 * @param processor the processor run for every payload
	 * @param <I> the type of values accepted
	 * @param <O> the type of values broadcast
	 * @return a new running {@link Stage}, already subscribed
	 */
	public static <I, O> Stage<I, O> from(@Nullable Stage<?, ? extends I> upstream,
			int workers,
			Processor<I, O> processor) {
		StageSpec.Builder spec = StageSpec.builder().workers(workers);
		if (upstream != null) {
			spec.logger(upstream.logger());
		}
		return from(upstream, spec.build(), processor);
	}

	/**
	 * Create a stage configured by the given {@link StageSpec} and subscribe it to an
	 * upstream stage, if any.
	 *
	 * @param upstream the stage to subscribe to, or null
	 * @param spec the configuration of the stage
	 * @param processor the processor run for every payload
	 * @param <I> the type of values accepted
	 * @param <O> the type of values broadcast
	 * @return a new running {@link Stage}, already subscribed
	 */
	public static <I, O> Stage<I, O> from(@Nullable Stage<?, ? extends I> upstream,
			StageSpec spec,
			Processor<I, O> processor) {
		Stage<I, O> stage = create(spec, processor);
		if (upstream != null) {
			upstream.stream(stage);
		}
		return stage;
	}

	/**
	 * Create a pass-through stage forwarding values and errors unchanged, typically
	 * used as the entry point of a pipeline.
	 *
	 * @param workers the number of workers, values lower than 1 meaning 1
	 * @param <T> the type of values
	 * @return a new running identity {@link Stage}
	 */
	public static <T> Stage<T, T> identity(int workers) {
		return create(StageSpec.ofWorkers(workers), Processor.identity());
	}

	public static <T> Stage<T, T> identity(StageSpec spec) {
		return create(spec, Processor.<T>identity());
	}

	/**
	 * Bridge the values broadcast by a stage into a {@link BlockingChannel}. Errors are
	 * not forwarded. The channel is closed once the upstream stage has shut down and
	 * every value it broadcast was received, so iterating it ends with the pipeline.
	 * <p>
	 * Values are handed over one at a time: a slow consumer slows the upstream stage
	 * down. The upstream can be shut down from the consuming thread, which keeps
	 * iterating until the channel closes.
	 *
	 * @param upstream the stage to receive values from
	 * @param <T> the type of values
	 * @return the channel to consume values from
	 */
	public static <T> BlockingChannel<T> receive(Stage<?, ? extends T> upstream) {
		BlockingChannel<T> channel = new BlockingChannel<>();
		Stage<T, Void> bridge = bridge(upstream, "-receive", (context, error, value) -> {
			if (error == null && value != null) {
				channel.send(value);
			}
			return Outcome.empty();
		});
		upstream.stream(bridge);
		closeOnShutdown(upstream, bridge, channel);
		return channel;
	}

	/**
	 * Bridge the errors broadcast by a stage into a {@link BlockingChannel}, values being
	 * ignored. Same lifecycle as {@link #receive(Stage)}.
	 *
	 * @param upstream the stage to receive errors from
	 * @return the channel to consume errors from
	 */
	public static BlockingChannel<Throwable> receiveErrors(Stage<?, ?> upstream) {
		BlockingChannel<Throwable> channel = new BlockingChannel<>();
		Stage<Object, Void> bridge = bridge(upstream, "-receive-errors", (context, error, value) -> {
			if (error != null) {
				channel.send(error);
			}
			return Outcome.empty();
		});
		upstream.stream(bridge);
		closeOnShutdown(upstream, bridge, channel);
		return channel;
	}

	static <T> Stage<T, Void> bridge(Stage<?, ?> upstream, String suffix, Processor<T, Void> processor) {
		StageSpec spec = StageSpec.builder()
		                          .name(upstream.name() + suffix)
		                          .workers(1)
		                          .broadcastThreads(1)
		                          .logger(upstream.logger())
		                          .build();
		return create(spec, processor);
	}

	static void closeOnShutdown(Stage<?, ?> upstream, Stage<?, ?> bridge, BlockingChannel<?> channel) {
		Logger logger = bridge.logger();
		StageThreadFactory closers = new StageThreadFactory(bridge.name() + "-closer",
				new AtomicLong(),
				true,
				(t, e) -> logger.error("[" + bridge.name() + "] failed to close the bridge", e));
		upstream.closeNotify()
		        .whenComplete((v, e) -> closers.newThread(() -> {
			        bridge.shutdown();
			        channel.close();
			        logger.debug("[{}] bridge closed after {} shut down", bridge.name(), upstream.name());
		        }).start());
	}

	Stages() {
	}
}
