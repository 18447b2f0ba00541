package podpilot.controlplane.server;

import org.junit.jupiter.api.Test;
import podpilot.controlplane.exception.ErrorCode;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RouterHandlerTest {

    @Test
    void mapsErrorCodesToStatuses() {
        assertEquals(CONFLICT, RouterHandler.statusFor(ErrorCode.DUPLICATE_NODE));
        assertEquals(CONFLICT, RouterHandler.statusFor(ErrorCode.DUPLICATE_POD));
        assertEquals(NOT_FOUND, RouterHandler.statusFor(ErrorCode.NODE_NOT_FOUND));
        assertEquals(BAD_REQUEST, RouterHandler.statusFor(ErrorCode.MISSING_FIELD));
        assertEquals(UNPROCESSABLE_ENTITY, RouterHandler.statusFor(ErrorCode.INSUFFICIENT_CLUSTER_CAPACITY));
        assertEquals(UNPROCESSABLE_ENTITY, RouterHandler.statusFor(ErrorCode.NO_FEASIBLE_NODE));
        assertEquals(INTERNAL_SERVER_ERROR, RouterHandler.statusFor(ErrorCode.STORE_FAILURE));
    }
}
