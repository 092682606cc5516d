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

/**
 * Concurrent pipeline stages. A {@link cascade.core.stage.Stage} runs a
 * {@link cascade.core.stage.Processor} on a pool of workers and broadcasts each
 * {@link cascade.core.stage.Outcome} to its subscribers, themselves stages.
 *
 * <h2>Building pipelines</h2>
 * {@link cascade.core.stage.Stages} creates stages, subscribes them to an upstream
 * stage, and bridges the end of a pipeline into a
 * {@link cascade.core.stage.BlockingChannel} that can be iterated.
 *
 * <h2>Configuration</h2>
 * {@link cascade.core.stage.StageSpec} carries the name, worker count, logger and
 * broadcast executor of a stage.
 */
@NullMarked
package cascade.core.stage;

import org.jspecify.annotations.NullMarked;
