package org.neuralchilli.taskgroup.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.taskgroup.domain.Result;

import static org.assertj.core.api.Assertions.*;

class ResultChannelTest {

    @Test
    void shouldDrainInArrivalOrder() {
        ResultChannel channel = new ResultChannel(3, CancellationSignal.root());

        assertThat(channel.offer(Result.success("c"))).isTrue();
        assertThat(channel.offer(Result.success("a"))).isTrue();
        assertThat(channel.offer(Result.success("b"))).isTrue();

        assertThat(channel.closeAndDrain()).extracting(Result::value).containsExactly("c", "a", "b");
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    void shouldRefuseOfferOnceDeadlineFired() {
        CancellationSignal deadline = CancellationSignal.root();
        ResultChannel channel = new ResultChannel(2, deadline);
        channel.offer(Result.success("in-time"));

        deadline.cancel();

        assertThat(channel.isClosed()).isFalse();
        assertThat(channel.offer(Result.success("late"))).isFalse();
        assertThat(channel.closeAndDrain()).extracting(Result::value).containsExactly("in-time");
    }

    @Test
    void shouldRefuseOfferAfterClose() {
        ResultChannel channel = new ResultChannel(2, CancellationSignal.root());
        channel.closeAndDrain();

        assertThat(channel.offer(Result.success("late"))).isFalse();
        assertThat(channel.closeAndDrain()).isEmpty();
    }

    @Test
    void shouldFailWhenOfferedMoreThanCapacity() {
        ResultChannel channel = new ResultChannel(1, CancellationSignal.root());
        channel.offer(Result.success("only"));

        assertThatThrownBy(() -> channel.offer(Result.success("extra")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("capacity");
    }
}
