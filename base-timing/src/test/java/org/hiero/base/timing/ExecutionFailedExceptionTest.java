// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExecutionFailedExceptionTest {

    @Test
    void runtimeExceptionIsRethrownAsIs() {
        final IllegalArgumentException failure = new IllegalArgumentException("bad");
        assertThatThrownBy(() -> ExecutionFailedException.rethrow("the action", failure))
                .isSameAs(failure);
    }

    @Test
    void errorIsRethrownAsIs() {
        final AssertionError failure = new AssertionError("nested assertion");
        assertThatThrownBy(() -> ExecutionFailedException.rethrow("the action", failure))
                .isSameAs(failure);
    }

    @Test
    void checkedExceptionIsWrapped() {
        final IOException failure = new IOException("unreachable");
        assertThatThrownBy(() -> ExecutionFailedException.rethrow("the upload", failure))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageStartingWith("Execution of the upload failed")
                .cause()
                .isSameAs(failure);
    }
}
