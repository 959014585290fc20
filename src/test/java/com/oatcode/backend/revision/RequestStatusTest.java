package com.oatcode.backend.revision;

import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.web.IllegalTransitionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestStatusTest {

    @Test
    void processing_can_only_move_to_pending_or_stay() {
        assertTrue(RequestStatus.PROCESSING.canTransitionTo(RequestStatus.PENDING_APPROVAL));
        assertTrue(RequestStatus.PROCESSING.canTransitionTo(RequestStatus.PROCESSING));
        assertFalse(RequestStatus.PROCESSING.canTransitionTo(RequestStatus.APPROVED));
    }

    @Test
    void pending_can_be_approved_or_sent_back() {
        assertTrue(RequestStatus.PENDING_APPROVAL.canTransitionTo(RequestStatus.APPROVED));
        assertTrue(RequestStatus.PENDING_APPROVAL.canTransitionTo(RequestStatus.PROCESSING));
        assertFalse(RequestStatus.PENDING_APPROVAL.canTransitionTo(RequestStatus.PENDING_APPROVAL));
    }

    @Test
    void approved_is_terminal() {
        for (RequestStatus target : RequestStatus.values()) {
            assertFalse(RequestStatus.APPROVED.canTransitionTo(target), "APPROVED -> " + target);
        }
        assertTrue(RequestStatus.APPROVED.isTerminal());
        assertFalse(RequestStatus.APPROVED.isActive());
    }

    @Test
    void assert_transition_throws_with_both_ends() {
        IllegalTransitionException ex = assertThrows(IllegalTransitionException.class,
                () -> RequestStatus.PROCESSING.assertTransition(RequestStatus.APPROVED));
        assertEquals(RequestStatus.PROCESSING, ex.from());
        assertEquals(RequestStatus.APPROVED, ex.to());
    }

    @Test
    void active_statuses_are_processing_and_pending() {
        assertTrue(RequestStatus.PROCESSING.isActive());
        assertTrue(RequestStatus.PENDING_APPROVAL.isActive());
        assertFalse(RequestStatus.PROCESSING.canTransitionTo(null));
    }
}
