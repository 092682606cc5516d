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

import java.util.Objects;

import cascade.util.context.Context;
import org.jspecify.annotations.Nullable;

/**
 * One unit of work handed from a submitter to a worker: exactly one of value and
 * error is set.
 */
final class Payload<T> {

	final Context   context;
	@Nullable
	final T         value;
	@Nullable
	final Throwable error;

	private Payload(Context context, @Nullable T value, @Nullable Throwable error) {
		this.context = context;
		this.value = value;
		this.error = error;
	}

	static <T> Payload<T> data(Context context, T value) {
		return new Payload<>(Objects.requireNonNull(context, "context"),
				Objects.requireNonNull(value, "value"), null);
	}

	static <T> Payload<T> error(Context context, Throwable error) {
		return new Payload<>(Objects.requireNonNull(context, "context"), null,
				Objects.requireNonNull(error, "error"));
	}

	@Override
	public String toString() {
		return error != null ? "Payload{error=" + error + "}" : "Payload{value=" + value + "}";
	}
}
