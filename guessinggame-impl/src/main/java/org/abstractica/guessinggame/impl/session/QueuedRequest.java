package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.handlers.ResponseHandler;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A request waiting in a session's mailbox.
 *
 * @param request the request
 * @param replyTo receives the responses, or null when the caller only waits on {@code result}
 * @param result  completed with the responses once the request has been processed
 */
record QueuedRequest(Request request, ResponseHandler replyTo, CompletableFuture<List<Response>> result)
{
    QueuedRequest
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(result, "result");
    }
}
