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

import java.time.Duration;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.jspecify.annotations.Nullable;

/**
 * Copy-on-write {@link Context} backed by an insertion-ordered map, carrying a
 * {@link Lifetime}. Only instances created by {@link Context#cancellable()},
 * {@link Context#withCancellation()} or {@link Context#withTimeout(Duration)} are exposed
 * as {@link CancellableContext}; the others hold a non-cancellable lifetime.
 */
final class ContextN implements CancellableContext {

	final Map<Object, Object> entries;
	final Lifetime            lifetime;

	ContextN(Lifetime lifetime) {
		this(Collections.emptyMap(), lifetime);
	}

	ContextN(Map<Object, Object> entries, Lifetime lifetime) {
		this.entries = entries;
		this.lifetime = lifetime;
	}

	@Override
	public Context put(Object key, Object value) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");
		Map<Object, Object> copy = new LinkedHashMap<>(entries);
		copy.put(key, value);
		return new ContextN(Collections.unmodifiableMap(copy), lifetime);
	}

	@Override
	public CancellableContext withCancellation() {
		return new ContextN(entries, lifetime.child());
	}

	@Override
	public CancellableContext withTimeout(Duration timeout) {
		return new ContextN(entries, lifetime.child(timeout));
	}

	@Override
	public boolean cancel() {
		return lifetime.cancel();
	}

	@Override
	public boolean isCancelled() {
		return lifetime.isCancelled();
	}

	@Override
	public boolean isExpired() {
		return lifetime.isExpired();
	}

	@Override
	public Optional<Instant> deadline() {
		return Optional.ofNullable(lifetime.deadline());
	}

	@Override
	public Optional<Duration> timeRemaining() {
		return Optional.ofNullable(lifetime.timeRemaining());
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> T get(Object key) {
		Object o = entries.get(key);
		if (o != null) {
			return (T) o;
		}
		throw new NoSuchElementException("Context does not contain key: " + key);
	}

	@Override
	@Nullable
	@SuppressWarnings("unchecked")
	public <T> T getOrDefault(Object key, @Nullable T defaultValue) {
		Object o = entries.get(key);
		if (o != null) {
			return (T) o;
		}
		return defaultValue;
	}

	@Override
	public boolean hasKey(Object key) {
		return entries.containsKey(key);
	}

	@Override
	public int size() {
		return entries.size();
	}

	@Override
	public Stream<Map.Entry<Object, Object>> stream() {
		return entries.entrySet().stream().map(AbstractMap.SimpleImmutableEntry::new);
	}

	@Override
	public String toString() {
		return "ContextN" + entries + "[" + lifetime + "]";
	}
}
