package com.ryuqq.provisioner.core.statemachine;

import com.ryuqq.provisioner.core.exception.InvalidMachineStateException;
import com.ryuqq.provisioner.core.model.MachineResult;
import com.ryuqq.provisioner.core.model.MachineStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MachineResultTransitionTest {

    @Test
    void validate_ExecutingToSettled_Succeeds() {
        assertDoesNotThrow(() -> MachineResultTransition.validate(MachineResult.EXECUTING, MachineResult.SUCCEED));
        assertDoesNotThrow(() -> MachineResultTransition.validate(MachineResult.EXECUTING, MachineResult.FAIL));
    }

    @Test
    void validate_AlreadySettled_ThrowsException() {
        assertThrows(InvalidMachineStateException.class,
            () -> MachineResultTransition.validate(MachineResult.SUCCEED, MachineResult.FAIL));
        assertThrows(InvalidMachineStateException.class,
            () -> MachineResultTransition.validate(MachineResult.FAIL, MachineResult.SUCCEED));
    }

    @Test
    void validate_BackToExecuting_ThrowsException() {
        assertThrows(InvalidMachineStateException.class,
            () -> MachineResultTransition.validate(MachineResult.EXECUTING, MachineResult.EXECUTING));
    }

    @Test
    void resultFor_MapsObservedStatus() {
        assertEquals(MachineResult.SUCCEED, MachineResultTransition.resultFor(MachineStatus.RUNNING));
        assertEquals(MachineResult.FAIL, MachineResultTransition.resultFor(MachineStatus.FAILED));
        assertEquals(MachineResult.FAIL, MachineResultTransition.resultFor(MachineStatus.TERMINATED));
        assertEquals(MachineResult.EXECUTING, MachineResultTransition.resultFor(MachineStatus.PENDING));
    }
}
