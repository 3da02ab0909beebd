package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.browser.relay.CommandExecutor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Records executed commands and answers them from a queue of canned replies.
 */
class FakeExecutor implements CommandExecutor {

    record Call(String tabId, String command, JsonNode params, long timeoutMs) {
    }

    final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Deque<Function<Call, CompletableFuture<JsonNode>>> replies = new ArrayDeque<>();

    FakeExecutor reply(JsonNode result) {
        replies.add(call -> CompletableFuture.completedFuture(result));
        return this;
    }

    FakeExecutor fail(RuntimeException error) {
        replies.add(call -> CompletableFuture.failedFuture(error));
        return this;
    }

    FakeExecutor throwing(RuntimeException error) {
        replies.add(call -> {
            throw error;
        });
        return this;
    }

    FakeExecutor answer(Function<Call, CompletableFuture<JsonNode>> reply) {
        replies.add(reply);
        return this;
    }

    @Override
    public synchronized CompletableFuture<JsonNode> execute(String tabId, String command, JsonNode params,
                                                            long timeoutMs) {
        Call call = new Call(tabId, command, params, timeoutMs);
        calls.add(call);
        Function<Call, CompletableFuture<JsonNode>> reply = replies.poll();
        if (reply == null) {
            return new CompletableFuture<>();
        }
        return reply.apply(call);
    }
}
