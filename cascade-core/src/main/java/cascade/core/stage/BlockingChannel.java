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

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import cascade.core.Exceptions;
import org.jspecify.annotations.Nullable;

/**
 * An unbuffered, closable channel: {@link #send(Object)} hands one element over to a
 * receiver and blocks until it has been taken. Closing the channel releases blocked
 * senders and, once the element already accepted (if any) has been received, makes
 * receivers observe the end of the stream.
 * <p>
 * Stages use it as their intake, and {@link Stages#receive(Stage)} exposes one to code
 * that wants to consume a stage synchronously, for instance by iterating over it:
 * <pre>{@code
 * for (String value : Stages.receive(stage)) {
 *     ...
 * }
 * }</pre>
 *
 * @param <T> the type of elements
 */
public final class BlockingChannel<T> implements Iterable<T> {

	final ReentrantLock lock     = new ReentrantLock();
	final Condition     slotFree = lock.newCondition();
	final Condition     slotFull = lock.newCondition();
	final Condition     taken    = lock.newCondition();

	@Nullable
	T       slot;
	long    accepted;
	long    received;
	boolean closed;

	/**
	 * Hand an element over to a receiver, blocking until it is taken. If the channel
	 * gets closed after the element was accepted, the element is still delivered and
	 * this method returns without waiting for it.
	 * <p>
	 * If the sending thread is interrupted while waiting for its accepted element to be
	 * taken, the interrupt flag is restored and the method returns {@code true}.
	 *
	 * @param element the element to send, not null
	 * @return true if the element was accepted, false if the channel was closed first
	 * @throws InterruptedException if interrupted before the element was accepted
	 */
	public boolean send(T element) throws InterruptedException {
		Objects.requireNonNull(element, "element");
		lock.lockInterruptibly();
		try {
			while (slot != null && !closed) {
				slotFree.await();
			}
			if (closed) {
				return false;
			}
			slot = element;
			long ticket = ++accepted;
			slotFull.signal();

			boolean interrupted = false;
			while (received < ticket && !closed) {
				try {
					taken.await();
				}
				catch (InterruptedException e) {
					interrupted = true;
					break;
				}
			}
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Take the next element, blocking until one is sent or the channel is closed.
	 *
	 * @return the next element, or null once the channel is closed and drained
	 * @throws InterruptedException if interrupted while waiting
	 */
	@Nullable
	public T receive() throws InterruptedException {
		lock.lockInterruptibly();
		try {
			while (slot == null) {
				if (closed) {
					return null;
				}
				slotFull.await();
			}
			return take();
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Take the next element, waiting at most the given duration.
	 *
	 * @param timeout the maximum time to wait
	 * @return the next element, or null on timeout or once the channel is closed and drained
	 * @throws InterruptedException if interrupted while waiting
	 */
	@Nullable
	public T poll(Duration timeout) throws InterruptedException {
		long nanos = timeout.toNanos();
		lock.lockInterruptibly();
		try {
			while (slot == null) {
				if (closed || nanos <= 0L) {
					return null;
				}
				nanos = slotFull.awaitNanos(nanos);
			}
			return take();
		}
		finally {
			lock.unlock();
		}
	}

	T take() {
		T element = slot;
		slot = null;
		received++;
		taken.signalAll();
		slotFree.signal();
		return element;
	}

	/**
	 * Close the channel. Idempotent.
	 *
	 * @return true if this call closed the channel, false if it already was closed
	 */
	public boolean close() {
		lock.lock();
		try {
			if (closed) {
				return false;
			}
			closed = true;
			slotFree.signalAll();
			slotFull.signalAll();
			taken.signalAll();
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	public boolean isClosed() {
		lock.lock();
		try {
			return closed;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Return a blocking {@link Iterator} over the received elements, ending when the
	 * channel is closed and drained. Several iterators compete for the same elements.
	 * An interrupt while blocked in {@link Iterator#hasNext()} restores the interrupt
	 * flag and is rethrown unchecked.
	 *
	 * @return a blocking iterator
	 */
	@Override
	public Iterator<T> iterator() {
		return new ReceivingIterator();
	}

	@Override
	public String toString() {
		return "BlockingChannel{closed=" + isClosed() + "}";
	}

	final class ReceivingIterator implements Iterator<T> {

		@Nullable
		T       next;
		boolean done;

		@Override
		public boolean hasNext() {
			if (next != null) {
				return true;
			}
			if (done) {
				return false;
			}
			try {
				next = receive();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw Exceptions.propagate(e);
			}
			done = next == null;
			return !done;
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			T element = next;
			next = null;
			return element;
		}
	}
}
