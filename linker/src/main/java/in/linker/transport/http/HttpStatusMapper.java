package in.linker.transport.http;

import in.linker.domain.common.LinkResult;
import io.undertow.util.StatusCodes;

/**
 * Maps engine outcomes to HTTP status codes.
 */
public final class HttpStatusMapper {

    private HttpStatusMapper() {}

    public static int statusFor(LinkResult.Outcome outcome) {
        return switch (outcome) {
            case OK -> StatusCodes.OK;
            case VALIDATION_ERROR -> StatusCodes.BAD_REQUEST;
            case NOT_FOUND -> StatusCodes.NOT_FOUND;
            case EXHAUSTED -> StatusCodes.INTERNAL_SERVER_ERROR;
            case STORE_ERROR -> StatusCodes.SERVICE_UNAVAILABLE;
        };
    }
}
