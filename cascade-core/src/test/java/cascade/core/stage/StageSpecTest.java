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

import java.util.concurrent.Executor;

import cascade.test.TestLogger;
import cascade.util.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

class StageSpecTest {

	@AfterEach
	void clearProperties() {
		System.clearProperty(StageSpec.WORKERS_PROPERTY);
		System.clearProperty(StageSpec.BROADCAST_THREADS_PROPERTY);
	}

	@Test
	void defaults() {
		StageSpec spec = StageSpec.defaults();

		assertThat(spec.name()).isEqualTo(StageSpec.DEFAULT_NAME);
		assertThat(spec.workers()).isOne();
		assertThat(spec.daemon()).isTrue();
		assertThat(spec.broadcastThreads()).isZero();
		assertThat(spec.broadcastExecutor()).isEmpty();
		assertThat(spec.logger().getName()).isEqualTo(StageSpec.DEFAULT_NAME);
		assertThat(spec.logger().isErrorEnabled()).as("no-op by default").isFalse();
	}

	@Test
	void defaultsFromSystemProperties() {
		System.setProperty(StageSpec.WORKERS_PROPERTY, " 4 ");
		System.setProperty(StageSpec.BROADCAST_THREADS_PROPERTY, "2");

		StageSpec spec = StageSpec.defaults();

		assertThat(spec.workers()).isEqualTo(4);
		assertThat(spec.broadcastThreads()).isEqualTo(2);
	}

	@Test
	void builderSetsEverything() {
		Logger logger = new TestLogger();
		Executor executor = Runnable::run;

		StageSpec spec = StageSpec.builder()
		                          .name("parse")
		                          .workers(3)
		                          .logger(logger)
		                          .daemon(false)
		                          .broadcastThreads(5)
		                          .broadcastExecutor(executor)
		                          .build();

		assertThat(spec.name()).isEqualTo("parse");
		assertThat(spec.workers()).isEqualTo(3);
		assertThat(spec.logger()).isSameAs(logger);
		assertThat(spec.daemon()).isFalse();
		assertThat(spec.broadcastThreads()).isEqualTo(5);
		assertThat(spec.broadcastExecutor()).containsSame(executor);
	}

	@Test
	void toBuilderCopies() {
		StageSpec spec = StageSpec.builder().name("a").workers(2).build();

		StageSpec copy = spec.toBuilder().name("b").build();

		assertThat(copy.name()).isEqualTo("b");
		assertThat(copy.workers()).isEqualTo(2);
		assertThat(spec.name()).isEqualTo("a");
	}

	@Test
	void ofWorkersKeepsTheRawValue() {
		assertThat(StageSpec.ofWorkers(0).workers()).isZero();
	}

	@Test
	void negativeBroadcastThreadsAreRejected() {
		assertThatIllegalArgumentException()
				.isThrownBy(() -> StageSpec.builder().broadcastThreads(-1).build())
				.withMessageContaining("broadcastThreads");
	}

	@Test
	void nullsAreRejected() {
		assertThatNullPointerException().isThrownBy(() -> StageSpec.builder().name(null));
		assertThatNullPointerException().isThrownBy(() -> StageSpec.builder().logger(null));
		assertThatNullPointerException().isThrownBy(() -> StageSpec.builder().broadcastExecutor(null));
	}
}
