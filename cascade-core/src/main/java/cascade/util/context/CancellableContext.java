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

package cascade.util.context;

import cascade.core.Disposable;

/**
 * A {@link Context} whose lifetime can be ended explicitly. Cancelling a context also
 * expires every context derived from it.
 */
public interface CancellableContext extends Context, Disposable {

	/**
	 * Mark this context as expired. Idempotent.
	 *
	 * @return true if this call cancelled the context, false if it already was
	 */
	boolean cancel();

	/**
	 * @return true if {@link #cancel()} was called on this very context
	 */
	boolean isCancelled();

	@Override
	default void dispose() {
		cancel();
	}

	@Override
	default boolean isDisposed() {
		return isCancelled();
	}
}
