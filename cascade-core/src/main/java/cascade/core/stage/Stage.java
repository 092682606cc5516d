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

import java.util.List;
import java.util.concurrent.CompletionStage;

import cascade.core.Disposable;
import cascade.util.Logger;
import cascade.util.context.Context;

/**
 * A pipeline unit with its own pool of workers: every value or error submitted to it
 * is processed by its {@link Processor} on one free worker, and the resulting
 * {@link Outcome} is broadcast to every subscriber registered with
 * {@link #stream(Stage)}.
 * <p>
 * Stages are chained into fan-out trees:
 * <pre>{@code
 * Stage<String, String> source = Stages.identity(2);
 * source.stream(Stages.create(Processor.map(String::length)))
 *       .stream(printer);
 * source.data(Context.empty(), "hello");
 * }</pre>
 * <p>
 * Submissions block until a worker takes them (there is no queue), no ordering is
 * kept across workers or subscribers, and failures never escape to the submitter:
 * they only travel as errors to the subscribers.
 * <p>
 * Lifecycle: {@link State#RUNNING} from construction, {@link State#DRAINING} from the
 * first {@link #shutdown()}, and {@link State#CLOSED} once every worker has exited and
 * every broadcast was delivered, at which point {@link #closeNotify()} completes.
 *
 * @param <I> the type of values accepted
 * @param <O> the type of values broadcast to subscribers
 */
public interface Stage<I, O> extends Disposable {

	enum State {
		RUNNING,
		DRAINING,
		CLOSED
	}

	/**
	 * @return the unique identifier of this stage
	 */
	String id();

	/**
	 * @return the name of this stage, prefix of its thread names
	 */
	String name();

	/**
	 * @return the logger this stage reports to
	 */
	Logger logger();

	/**
	 * Submit a value. Blocks until a worker takes it; silently dropped if the stage is
	 * shut down.
	 *
	 * @param context the execution context handed to the processor
	 * @param value the value, not null
	 */
	void data(Context context, I value);

	/**
	 * Submit an error. Blocks until a worker takes it; silently dropped if the stage is
	 * shut down.
	 *
	 * @param context the execution context handed to the processor
	 * @param error the error, not null
	 */
	void error(Context context, Throwable error);

	/**
	 * Register a subscriber receiving every outcome of this stage from now on. The
	 * subscriber is not owned: shutting this stage down leaves it running.
	 *
	 * @param subscriber the stage to feed
	 * @param <S> the type of the subscriber
	 * @return the given subscriber, for chaining
	 * @throws IllegalArgumentException if the subscriber is this stage or already feeds
	 * into it, which would form a cycle
	 */
	<S extends Stage<? super O, ?>> S stream(S subscriber);

	/**
	 * @return a snapshot of the registered subscribers, in registration order
	 */
	List<Stage<?, ?>> subscribers();

	/**
	 * Stop accepting submissions, let the workers drain what was already handed to them
	 * and wait for them to exit. {@link #closeNotify()} completes once the broadcasts
	 * still in flight have been delivered, which may happen after this method returns.
	 * <p>
	 * Calls after the first one return immediately. When called from one of this stage's
	 * own workers (from its processor), this method returns right away and the workers
	 * are joined on a separate thread: only {@link #closeNotify()} tells when the stage
	 * is drained.
	 */
	void shutdown();

	/**
	 * @return a stage completing once, when {@link #shutdown()} has drained this stage
	 */
	CompletionStage<Void> closeNotify();

	/**
	 * @return a snapshot of this stage's counters; never blocks
	 */
	StageStats stats();

	/**
	 * Same as {@link #shutdown()}.
	 */
	@Override
	default void dispose() {
		shutdown();
	}

	@Override
	default boolean isDisposed() {
		return stats().closed();
	}
}
