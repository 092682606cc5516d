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

/**
 * A point-in-time snapshot of the counters of a {@link Stage}.
 */
public final class StageStats {

	final long        workersRunning;
	final long        totalWorkers;
	final long        pending;
	final long        completed;
	final Stage.State state;

	public StageStats(long workersRunning, long totalWorkers, long pending, long completed, Stage.State state) {
		this.workersRunning = workersRunning;
		this.totalWorkers = totalWorkers;
		this.pending = pending;
		this.completed = completed;
		this.state = state;
	}

	/**
	 * @return the number of worker threads that have not exited yet
	 */
	public long workersRunning() {
		return workersRunning;
	}

	/**
	 * @return the configured number of workers plus one for the broadcaster
	 */
	public long totalWorkers() {
		return totalWorkers;
	}

	/**
	 * @return the number of submissions currently waiting to be handed to a worker
	 */
	public long pending() {
		return pending;
	}

	/**
	 * @return the number of payloads processed, whatever their outcome
	 */
	public long completed() {
		return completed;
	}

	public Stage.State state() {
		return state;
	}

	/**
	 * @return true as soon as a shutdown has been requested
	 */
	public boolean closed() {
		return state != Stage.State.RUNNING;
	}

	@Override
	public String toString() {
		return "StageStats{workersRunning=" + workersRunning +
				", totalWorkers=" + totalWorkers +
				", pending=" + pending +
				", completed=" + completed +
				", state=" + state + "}";
	}
}
