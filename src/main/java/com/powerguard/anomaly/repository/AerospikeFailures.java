package com.powerguard.anomaly.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.powerguard.anomaly.exception.DetectionException;
import com.powerguard.anomaly.exception.StoreUnavailableException;
import com.powerguard.anomaly.exception.StoreWriteException;

/**
 * Maps Aerospike client failures onto the engine's store exceptions.
 */
final class AerospikeFailures {

    private AerospikeFailures() {}

    static boolean isUnavailable(AerospikeException e) {
        if (e instanceof AerospikeException.Connection) return true;
        int code = e.getResultCode();
        return code == ResultCode.SERVER_NOT_AVAILABLE || code == ResultCode.INVALID_NODE_ERROR;
    }

    static DetectionException onWrite(AerospikeException e, String recordKey) {
        if (isUnavailable(e)) {
            return new StoreUnavailableException("Store unreachable while writing " + recordKey, e);
        }
        return new StoreWriteException(recordKey, e);
    }

    /**
     * Read paths only distinguish an unreachable store; other client errors propagate unchanged.
     */
    static RuntimeException onRead(AerospikeException e, String what) {
        if (isUnavailable(e)) {
            return new StoreUnavailableException("Store unreachable while reading " + what, e);
        }
        return e;
    }
}
