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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import cascade.core.Exceptions;
import cascade.util.Logger;
import cascade.util.context.Context;
import org.jspecify.annotations.Nullable;

/**
 * The {@link Stage} implementation returned by {@link Stages}: a fixed pool of worker
 * threads fed through an unbuffered {@link BlockingChannel}, broadcasting each outcome
 * through one task per subscriber on its broadcast {@link Executor}.
 *
 * @param <I> the type of values accepted
 * @param <O> the type of values broadcast to subscribers
 */
final class DefaultStage<I, O> implements Stage<I, O> {

	static final int RUNNING  = 0;
	static final int DRAINING = 1;
	static final int CLOSED   = 2;

	final String          id;
	final String          name;
	final int             workers;
	final Logger          logger;
	final Processor<I, O> processor;

	final BlockingChannel<Payload<I>> intake = new BlockingChannel<>();
	final StageThreadFactory          threadFactory;
	final Thread[]                    workerThreads;
	final CountDownLatch              workersExited;

	final Executor                    broadcaster;
	@Nullable
	final ExecutorService             ownedBroadcaster;

	final CompletableFuture<Void>     closed = new CompletableFuture<>();
	final CompletionStage<Void>       closeSignal;

	final ReentrantReadWriteLock      subscribersLock = new ReentrantReadWriteLock();
	final List<Stage<? super O, ?>>   subscribers     = new ArrayList<>();

	volatile int state;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DefaultStage> STATE =
			AtomicIntegerFieldUpdater.newUpdater(DefaultStage.class, "state");

	volatile long workersRunning;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DefaultStage> WORKERS_RUNNING =
			AtomicLongFieldUpdater.newUpdater(DefaultStage.class, "workersRunning");

	volatile long pending;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DefaultStage> PENDING =
			AtomicLongFieldUpdater.newUpdater(DefaultStage.class, "pending");

	volatile long completed;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DefaultStage> COMPLETED =
			AtomicLongFieldUpdater.newUpdater(DefaultStage.class, "completed");

	//in-flight broadcasts, plus one held by the stage until its workers have exited
	volatile long broadcasting = 1L;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DefaultStage> BROADCASTING =
			AtomicLongFieldUpdater.newUpdater(DefaultStage.class, "broadcasting");

	DefaultStage(StageSpec spec, Processor<I, O> processor) {
		this.processor = Objects.requireNonNull(processor, "processor");
		this.id = UUID.randomUUID().toString();
		this.name = spec.name();
		this.logger = spec.logger();

		int requested = spec.workers();
		this.workers = requested > 0 ? requested : 1;
		if (requested <= 0) {
			logger.debug("[{}] {} workers requested, using 1", name, requested);
		}

		this.threadFactory = new StageThreadFactory(name, new AtomicLong(), spec.daemon(), this::onUncaughtException);
		Executor external = spec.broadcastExecutor().orElse(null);
		if (external != null) {
			this.broadcaster = external;
			this.ownedBroadcaster = null;
		}
		else {
			StageThreadFactory broadcastFactory = new StageThreadFactory(name + "-broadcast",
					new AtomicLong(), spec.daemon(), this::onUncaughtException);
			this.ownedBroadcaster = spec.broadcastThreads() == 0
					? Executors.newCachedThreadPool(broadcastFactory)
					: Executors.newFixedThreadPool(spec.broadcastThreads(), broadcastFactory);
			this.broadcaster = ownedBroadcaster;
		}

		this.closeSignal = closed.minimalCompletionStage();
		this.workersExited = new CountDownLatch(workers);
		this.workersRunning = workers;
		this.workerThreads = new Thread[workers];
		for (int i = 0; i < workers; i++) {
			workerThreads[i] = threadFactory.newThread(this::work);
		}
		for (Thread worker : workerThreads) {
			worker.start();
		}
		logger.debug("[{}] stage {} started with {} workers", name, id, workers);
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
	public void data(Context context, I value) {
		submit(Payload.data(context, value));
	}

	@Override
	public void error(Context context, Throwable error) {
		submit(Payload.error(context, error));
	}

	void submit(Payload<I> payload) {
		PENDING.incrementAndGet(this);
		try {
			if (state != RUNNING) {
				logger.trace("[{}] shut down, dropping {}", name, payload);
				return;
			}
			logger.trace("[{}] received {}", name, payload);
			if (!intake.send(payload)) {
				logger.trace("[{}] shut down during handoff, dropping {}", name, payload);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("[{}] interrupted during handoff, dropping {}", name, payload);
		}
		finally {
			PENDING.decrementAndGet(this);
		}
	}

	@Override
	public <S extends Stage<? super O, ?>> S stream(S subscriber) {
		Objects.requireNonNull(subscriber, "subscriber");
		if (subscriber == this || feedsInto(subscriber, this)) {
			throw new IllegalArgumentException("Subscribing " + subscriber.name() + " to " + name + " would form a cycle");
		}
		subscribersLock.writeLock().lock();
		try {
			subscribers.add(subscriber);
		}
		finally {
			subscribersLock.writeLock().unlock();
		}
		logger.debug("[{}] subscribed {} ({})", name, subscriber.name(), subscriber.id());
		return subscriber;
	}

	@Override
	public List<Stage<?, ?>> subscribers() {
		subscribersLock.readLock().lock();
		try {
			return new ArrayList<Stage<?, ?>>(subscribers);
		}
		finally {
			subscribersLock.readLock().unlock();
		}
	}

	static boolean feedsInto(Stage<?, ?> from, Stage<?, ?> target) {
		Set<Stage<?, ?>> visited = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Stage<?, ?>> toVisit = new ArrayDeque<>();
		toVisit.push(from);
		while (!toVisit.isEmpty()) {
			Stage<?, ?> current = toVisit.pop();
			if (current == target) {
				return true;
			}
			if (visited.add(current)) {
				toVisit.addAll(current.subscribers());
			}
		}
		return false;
	}

	@Override
	public void shutdown() {
		if (!STATE.compareAndSet(this, RUNNING, DRAINING)) {
			logger.debug("[{}] shutdown already requested", name);
			return;
		}
		logger.debug("[{}] shutdown requested", name);
		intake.close();

		if (isWorkerThread(Thread.currentThread())) {
			//a worker cannot join itself
			threadFactory.newThread(this::drainAndClose).start();
		}
		else {
			drainAndClose();
		}
	}

	void drainAndClose() {
		awaitUninterruptibly(workersExited);
		while (pending != 0L) {
			LockSupport.parkNanos(10_000L);
		}
		logger.debug("[{}] workers drained, {} broadcasts in flight", name, broadcasting - 1L);
		broadcastDone();
	}

	//runs on whichever thread delivers the last broadcast, or on the shutdown caller
	void close() {
		if (ownedBroadcaster != null) {
			ownedBroadcaster.shutdown();
		}
		this.state = CLOSED;
		logger.debug("[{}] shutdown completed, {}", name, stats());
		closed.complete(null);
	}

	boolean isWorkerThread(Thread thread) {
		for (Thread worker : workerThreads) {
			if (worker == thread) {
				return true;
			}
		}
		return false;
	}

	static void awaitUninterruptibly(CountDownLatch latch) {
		boolean interrupted = false;
		for (;;) {
			try {
				latch.await();
				break;
			}
			catch (InterruptedException e) {
				interrupted = true;
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public CompletionStage<Void> closeNotify() {
		return closeSignal;
	}

	@Override
	public StageStats stats() {
		return new StageStats(workersRunning, workers + 1L, pending, completed, Stage.State.values()[state]);
	}

	void work() {
		try {
			for (;;) {
				Payload<I> payload;
				try {
					payload = intake.receive();
				}
				catch (InterruptedException e) {
					logger.warn("[{}] worker {} interrupted while idle, resuming", name, Thread.currentThread().getName());
					continue;
				}
				if (payload == null) {
					break;
				}
				process(payload);
			}
		}
		finally {
			WORKERS_RUNNING.decrementAndGet(this);
			workersExited.countDown();
			logger.debug("[{}] worker {} exited", name, Thread.currentThread().getName());
		}
	}

	void process(Payload<I> payload) {
		Outcome<O> outcome;
		try {
			outcome = processor.process(payload.context, payload.error, payload.value);
			if (outcome == null) {
				outcome = fault(null, payload);
			}
		}
		catch (Throwable t) {
			outcome = fault(t, payload);
		}
		COMPLETED.incrementAndGet(this);
		logger.trace("[{}] processed {} into {}", name, payload, outcome);
		broadcast(payload.context, outcome);
	}

	Outcome<O> fault(@Nullable Throwable cause, Payload<I> payload) {
		RuntimeException fault = Exceptions.fault(cause, name);
		logger.error(fault, "[{}] processor fault on {}, broadcasting it as an error", name, payload);
		return Outcome.failure(fault);
	}

	void broadcast(Context context, Outcome<O> outcome) {
		if (outcome.isEmpty()) {
			return;
		}
		subscribersLock.readLock().lock();
		try {
			for (Stage<? super O, ?> subscriber : subscribers) {
				dispatch(subscriber, context, outcome);
			}
		}
		finally {
			subscribersLock.readLock().unlock();
		}
	}

	void dispatch(Stage<? super O, ?> subscriber, Context context, Outcome<O> outcome) {
		BROADCASTING.incrementAndGet(this);
		try {
			broadcaster.execute(() -> deliver(subscriber, context, outcome));
		}
		catch (RejectedExecutionException ree) {
			logger.warn("[{}] broadcast to {} rejected, dropping {}", name, subscriber.name(), outcome);
			broadcastDone();
		}
	}

	void deliver(Stage<? super O, ?> subscriber, Context context, Outcome<O> outcome) {
		try {
			Throwable error = outcome.error;
			if (error != null) {
				subscriber.error(context, error);
			}
			else {
				subscriber.data(context, Objects.requireNonNull(outcome.value));
			}
		}
		catch (Throwable t) {
			Exceptions.throwIfJvmFatal(t);
			logger.error(t, "[{}] subscriber {} failed to accept {}", name, subscriber.name(), outcome);
		}
		finally {
			broadcastDone();
		}
	}

	void broadcastDone() {
		if (BROADCASTING.decrementAndGet(this) == 0L) {
			close();
		}
	}

	void onUncaughtException(Thread thread, Throwable t) {
		logger.error("[" + name + "] uncaught failure on " + thread.getName(), t);
	}

	@Override
	public String toString() {
		return "DefaultStage{name=" + name + ", id=" + id + ", state=" + Stage.State.values()[state] + "}";
	}
}
