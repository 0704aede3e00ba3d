// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.test;

import java.util.ArrayList;
import son.util.condition.Condition;
import son.util.condition.ConditionContext;
import son.util.condition.Handler;
import son.util.condition.Restart;
import son.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new TestCondition("ignored"));
    }

    @Test
    void errorWithoutHandlersThrows() {
        final var condition = new TestCondition("boom");
        final var error = catchThrowableOfType(() -> ConditionContext.error(condition), UnhandledErrorError.class);
        assertThat(error).isNotNull();
        assertThat(error.condition()).isSameAs(condition);
        assertThat(error).hasMessageContaining("boom");
    }

    @Test
    void handlersRunNewestFirstUntilOneUnwinds() {
        final var seen = new ArrayList<String>();
        final var result = ConditionContext.withRestart("outer", restart -> {
            try (final var oldest = new Handler(signaled -> {
                seen.add("oldest");
                restart.unwindTo();
            })) {
                oldest.use();
                try (final var newest = new Handler(signaled -> seen.add("newest"))) {
                    newest.use();
                    ConditionContext.error(new TestCondition("handled"));
                    seen.add("not reached");
                }
            }
            return "returned normally";
        });
        assertThat(result).isNull();
        assertThat(seen).containsExactly("newest", "oldest");
    }

    @Test
    void declinedSignalReturnsToCaller() {
        final var fatality = new ArrayList<Boolean>();
        try (final var handler = new Handler(signaled -> fatality.add(signaled.isFatal()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("just a notice"));
        }
        assertThat(fatality).containsExactly(false);
    }

    @Test
    void withRestartReturnsCallbackValue() {
        final Integer result = ConditionContext.withRestart("unused", restart -> 42);
        assertThat(result).isEqualTo(42);
    }

    @Test
    void restartsAreListedNewestFirstAndUnlinkedAfterwards() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("first", outer -> ConditionContext.withRestart("second", inner -> {
            for (final Restart restart : ConditionContext.restarts()) {
                names.add(restart.name());
            }
            return null;
        }));
        assertThat(names).startsWith("second", "first");
        assertThat(ConditionContext.restarts()).extracting(Restart::name).doesNotContain("first", "second");
    }

    @Test
    void unwindingPassesThroughInnerRestarts() {
        final var seen = new ArrayList<String>();
        ConditionContext.withRestart("outer", outer -> {
            final var innerResult = ConditionContext.withRestart("inner", inner -> {
                outer.unwindTo();
                return "inner body finished";
            });
            seen.add("after inner: " + innerResult);
            return null;
        });
        assertThat(seen).isEmpty();
    }

    @Test
    void conditionSignaledInHandlerOnlyReachesOlderHandlers() {
        final var seen = new ArrayList<String>();
        try (final var oldest = new Handler(signaled -> seen.add("oldest saw " + signaled.condition().message()))) {
            oldest.use();
            try (final var newest = new Handler(signaled -> {
                seen.add("newest saw " + signaled.condition().message());
                if (signaled.condition().message().equals("first")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                newest.use();
                ConditionContext.signal(new TestCondition("first"));
            }
        }
        assertThat(seen).containsExactly("newest saw first", "oldest saw nested", "oldest saw first");
    }

    @Test
    void detailedMessageDefaultsToMessage() {
        final var condition = new TestCondition("plain");
        assertThat(condition.detailedMessage()).isEqualTo("plain");
        assertThat(condition.toString()).endsWith(": plain");
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
