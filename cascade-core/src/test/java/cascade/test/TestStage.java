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

package cascade.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

import cascade.core.stage.Stage;
import cascade.core.stage.StageStats;
import cascade.util.Logger;
import cascade.util.Loggers;
import cascade.util.context.Context;

import static org.awaitility.Awaitility.await;

/**
 * A terminal {@link Stage} recording every value, error and context it receives, to be
 * subscribed to the stage under test. It has no workers and no subscribers of its own:
 * submissions are recorded synchronously on the calling thread.
 *
 * @param <T> the type of values recorded
 */
public class TestStage<T> implements Stage<T, Void> {

	/**
	 * @param <T> the type of values recorded
	 * @return a new recording stage named "test"
	 */
	public static <T> TestStage<T> create() {
		return new TestStage<>("test");
	}

	public static <T> TestStage<T> create(String name) {
		return new TestStage<>(name);
	}

	static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

	final String                            id = UUID.randomUUID().toString();
	final String                            name;
	final Logger                            logger;
	final ConcurrentLinkedQueue<T>          values   = new ConcurrentLinkedQueue<>();
	final ConcurrentLinkedQueue<Throwable>  errors   = new ConcurrentLinkedQueue<>();
	final ConcurrentLinkedQueue<Context>    contexts = new ConcurrentLinkedQueue<>();
	final AtomicLong                        received = new AtomicLong();
	final CompletableFuture<Void>           closed   = new CompletableFuture<>();

	TestStage(String name) {
		this.name = name;
		this.logger = Loggers.noOp(name);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public Logger logger() {
		return logger;
	}

	@Override
	public void data(Context context, T value) {
		if (closed.isDone()) {
			return;
		}
		contexts.add(context);
		values.add(value);
		received.incrementAndGet();
	}

	@Override
	public void error(Context context, Throwable error) {
		if (closed.isDone()) {
			return;
		}
		contexts.add(context);
		errors.add(error);
		received.incrementAndGet();
	}

	/**
	 * @throws UnsupportedOperationException always, a test stage is a sink
	 */
	@Override
	public <S extends Stage<? super Void, ?>> S stream(S subscriber) {
		throw new UnsupportedOperationException("TestStage is a terminal stage");
	}

	@Override
	public List<Stage<?, ?>> subscribers() {
		return Collections.emptyList();
	}

	@Override
	public void shutdown() {
		closed.complete(null);
	}

	@Override
	public CompletionStage<Void> closeNotify() {
		return closed.minimalCompletionStage();
	}

	@Override
	public StageStats stats() {
		return new StageStats(0, 1, 0, received.get(), closed.isDone() ? State.CLOSED : State.RUNNING);
	}

	/**
	 * @return a snapshot of the values received so far, in arrival order
	 */
	public List<T> values() {
		return new ArrayList<>(values);
	}

	/**
	 * @return a snapshot of the errors received so far, in arrival order
	 */
	public List<Throwable> errors() {
		return new ArrayList<>(errors);
	}

	/**
	 * @return a snapshot of the contexts received along with values and errors
	 */
	public List<Context> contexts() {
		return new ArrayList<>(contexts);
	}

	/**
	 * Wait until at least the given number of values has been received.
	 *
	 * @param count the expected number of values
	 * @return a snapshot of the values received
	 */
	public List<T> awaitValues(int count) {
		await().atMost(DEFAULT_TIMEOUT).until(() -> values.size() >= count);
		return values();
	}

	/**
	 * Wait until at least the given number of errors has been received.
	 *
	 * @param count the expected number of errors
	 * @return a snapshot of the errors received
	 */
	public List<Throwable> awaitErrors(int count) {
		await().atMost(DEFAULT_TIMEOUT).until(() -> errors.size() >= count);
		return errors();
	}

	@Override
	public String toString() {
		return "TestStage{name=" + name + ", values=" + values.size() + ", errors=" + errors.size() + "}";
	}
}
