package com.routerline.backend.batch;

public enum BatchState {
    EMPTY,         // nothing recorded yet
    ACCUMULATING,  // at least one instruction
    SUBMITTED,     // handed to the executor, no further mutation
    COMMITTED,     // device applied the batch
    REJECTED       // device refused it, or it never reached the device
}
