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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import cascade.core.Exceptions;

/**
 * Helpers to run several tasks as simultaneously as possible, to exercise race
 * conditions.
 */
public class RaceTestUtils {

	/**
	 * Synchronizes the execution of several {@link Runnable}s as much as possible
	 * to test race conditions. The method blocks until all have run to completion,
	 * rethrowing the first failure if any.
	 *
	 * @param rs the runnables to execute
	 */
	public static void race(final Runnable... rs) {
		race(10, rs);
	}

	/**
	 * Same as {@link #race(Runnable...)}, failing if the runnables haven't completed
	 * within the given number of seconds.
	 *
	 * @param timeoutSeconds the maximum duration of the race
	 * @param rs the runnables to execute
	 */
	public static void race(int timeoutSeconds, final Runnable... rs) {
		ExecutorService pool = Executors.newFixedThreadPool(rs.length);
		try {
			CountDownLatch ready = new CountDownLatch(rs.length);
			CountDownLatch start = new CountDownLatch(1);
			CountDownLatch done = new CountDownLatch(rs.length);
			AtomicReference<Throwable> error = new AtomicReference<>();
			List<Runnable> racers = new ArrayList<>(rs.length);

			for (Runnable r : rs) {
				racers.add(() -> {
					try {
						ready.countDown();
						start.await();
						r.run();
					}
					catch (Throwable t) {
						error.compareAndSet(null, t);
					}
					finally {
						done.countDown();
					}
				});
			}
			racers.forEach(pool::execute);

			try {
				ready.await();
				start.countDown();
				if (!done.await(timeoutSeconds, TimeUnit.SECONDS)) {
					throw new AssertionError("The race didn't complete within " + timeoutSeconds + "s");
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw Exceptions.propagate(e);
			}

			Throwable t = error.get();
			if (t instanceof Error) {
				throw (Error) t;
			}
			if (t != null) {
				throw Exceptions.propagate(t);
			}
		}
		finally {
			pool.shutdownNow();
		}
	}
}
