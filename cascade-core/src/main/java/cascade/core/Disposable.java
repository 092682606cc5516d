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

package cascade.core;

/**
 * A resource with a terminal release operation, such as a
 * {@link cascade.core.stage.Stage Stage} (whose disposal is its shutdown) or a
 * {@link cascade.util.context.CancellableContext CancellableContext} (whose disposal
 * is its cancellation).
 * <p>Calls to {@link #dispose()} must be idempotent.
 */
@FunctionalInterface
public interface Disposable {

	/**
	 * Release the underlying resource. Only the first call has an effect.
	 */
	void dispose();

	/**
	 * Return {@literal true} once the resource is known to be released.
	 * <p>
	 * Implementations that do not track disposal may always return {@literal false},
	 * but must never return {@literal true} before disposal actually happened.
	 *
	 * @return {@literal true} when there's a guarantee the resource is disposed.
	 */
	default boolean isDisposed() {
		return false;
	}
}
