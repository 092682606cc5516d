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

import java.io.IOException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class ExceptionsTest {

	@Test
	public void faultWrapsCause() {
		IllegalStateException cause = new IllegalStateException("boom");

		RuntimeException fault = Exceptions.fault(cause, "parse");

		assertThat(fault)
				.isInstanceOf(Exceptions.ProcessorFaultException.class)
				.hasMessageContaining("parse")
				.hasCause(cause);
		assertThat(Exceptions.isFault(fault)).isTrue();
		assertThat(Exceptions.unwrap(fault)).isSameAs(cause);
	}

	@Test
	public void faultWithoutCauseReportsMissingOutcome() {
		RuntimeException fault = Exceptions.fault(null, "parse");

		assertThat(fault).hasMessage("Processor of stage parse returned no outcome")
		                 .hasNoCause();
		assertThat(Exceptions.isFault(fault)).isTrue();
		assertThat(Exceptions.unwrap(fault)).isSameAs(fault);
	}

	@Test
	public void faultRethrowsJvmFatal() {
		OutOfMemoryError oom = new OutOfMemoryError("test");

		assertThatThrownBy(() -> Exceptions.fault(oom, "parse"))
				.isSameAs(oom);
	}

	@Test
	public void isFaultRejectsOtherExceptions() {
		assertThat(Exceptions.isFault(null)).isFalse();
		assertThat(Exceptions.isFault(new IllegalStateException())).isFalse();
		assertThat(Exceptions.isFault(Exceptions.propagate(new IOException()))).isFalse();
	}

	@Test
	public void propagateKeepsRuntimeExceptions() {
		IllegalArgumentException iae = new IllegalArgumentException();

		assertThat(Exceptions.propagate(iae)).isSameAs(iae);
	}

	@Test
	public void propagateWrapsCheckedExceptions() {
		IOException ioe = new IOException("test");

		RuntimeException propagated = Exceptions.propagate(ioe);

		assertThat(propagated).isNotSameAs(ioe).hasCause(ioe);
		assertThat(Exceptions.unwrap(propagated)).isSameAs(ioe);
	}

	@Test
	public void throwIfJvmFatal() {
		VirtualMachineError fatal1 = new InternalError();
		LinkageError fatal2 = new LinkageError();

		assertThatThrownBy(() -> Exceptions.throwIfJvmFatal(fatal1))
				.as("VirtualMachineError")
				.isSameAs(fatal1);

		assertThatThrownBy(() -> Exceptions.throwIfJvmFatal(fatal2))
				.as("LinkageError")
				.isSameAs(fatal2);
	}

	@Test
	public void throwIfJvmFatalIgnoresRegularErrors() {
		assertThatCode(() -> Exceptions.throwIfJvmFatal(new AssertionError()))
				.doesNotThrowAnyException();
		assertThatCode(() -> Exceptions.throwIfJvmFatal(null))
				.doesNotThrowAnyException();
	}

	@Test
	public void unwrapLeavesPlainExceptions() {
		IllegalStateException ise = new IllegalStateException();

		assertThat(Exceptions.unwrap(ise)).isSameAs(ise);
	}
}
