package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.service.session.SessionHandle;
import com.phillippitts.agenthandoff.service.session.SessionPort;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SessionSlotTest {

    private final SessionPort port = mock(SessionPort.class);

    private ManagedSession session(String id) {
        return new ManagedSession(port, new SessionHandle(id, "ctx", "persona-" + id, Instant.now()));
    }

    @Test
    void installsOnlyIntoEmptySlot() {
        SessionSlot slot = new SessionSlot();
        ManagedSession first = session("1");
        ManagedSession second = session("2");

        assertThat(slot.install(first)).isTrue();
        assertThat(slot.install(second)).isFalse();
        assertThat(slot.current()).isSameAs(first);
    }

    @Test
    void releasesOnlyExpectedSession() {
        SessionSlot slot = new SessionSlot();
        ManagedSession first = session("1");
        slot.install(first);

        assertThat(slot.release(session("other"))).isFalse();
        assertThat(slot.isOccupied()).isTrue();
        assertThat(slot.release(first)).isTrue();
        assertThat(slot.isOccupied()).isFalse();
    }

    @Test
    void detachReturnsWhateverWasCurrent() {
        SessionSlot slot = new SessionSlot();
        ManagedSession first = session("1");
        slot.install(first);

        assertThat(slot.detach()).isSameAs(first);
        assertThat(slot.detach()).isNull();
    }

    @Test
    void rejectsNullSession() {
        assertThatThrownBy(() -> new SessionSlot().install(null)).isInstanceOf(NullPointerException.class);
    }
}
