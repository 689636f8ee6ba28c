package com.routerline.backend.batch;

import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.device.CommitResult;
import com.routerline.backend.device.DeviceConfigSnapshot;
import com.routerline.backend.device.DeviceContext;
import com.routerline.backend.device.DeviceSessionRegistry;
import com.routerline.backend.error.ValidationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Submits finished batches. Validation, capability and unknown-operation failures all happen while a
 * batch is built, so nothing partial ever reaches a device from here.
 */
@Service
public class BatchExecutor {

    private final DeviceSessionRegistry sessions;

    public BatchExecutor(DeviceSessionRegistry sessions) {
        this.sessions = sessions;
    }

    public CommitResult commit(BatchBuilder batch, DeviceContext device) {
        if (batch.isEmpty()) throw new ValidationException("No operations to execute");

        batch.markSubmitted();
        try {
            CommitResult result = commit(batch.operations(), device);
            batch.markCommitted();
            return result;
        } catch (RuntimeException e) {
            batch.markRejected();
            throw e;
        }
    }

    public CommitResult commit(List<Instruction> instructions, DeviceContext device) {
        return sessions.session(device).commit(instructions);
    }

    /** Opens the device's session ahead of the first commit, warming its configuration cache when enabled. */
    public void connect(DeviceContext device) {
        sessions.connect(device);
    }

    public DeviceConfigSnapshot getFullConfig(DeviceContext device, boolean forceRefresh) {
        return sessions.session(device).getFullConfig(forceRefresh);
    }
}
